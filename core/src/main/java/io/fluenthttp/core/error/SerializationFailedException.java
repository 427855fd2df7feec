package io.fluenthttp.core.error;

/** Thrown when the body serializer fails. The serializer's exception is the cause. */
public final class SerializationFailedException extends RequestBuildException {

    private static final long serialVersionUID = 1L;

    public SerializationFailedException(String message, Throwable cause, String method, String endpoint) {
        super(message, cause, method, endpoint);
    }
}
