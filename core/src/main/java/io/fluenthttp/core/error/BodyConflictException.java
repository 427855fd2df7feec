package io.fluenthttp.core.error;

/** Thrown when both a raw body and a body pending serialization are configured on one request. */
public final class BodyConflictException extends RequestBuildException {

    private static final long serialVersionUID = 1L;

    public BodyConflictException(String message, String method, String endpoint) {
        super(message, method, endpoint);
    }
}
