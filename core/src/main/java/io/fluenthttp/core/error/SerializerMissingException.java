package io.fluenthttp.core.error;

/** Thrown when a body pending serialization is configured without a serializer. */
public final class SerializerMissingException extends RequestBuildException {

    private static final long serialVersionUID = 1L;

    public SerializerMissingException(String message, String method, String endpoint) {
        super(message, method, endpoint);
    }
}
