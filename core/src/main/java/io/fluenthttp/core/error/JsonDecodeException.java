package io.fluenthttp.core.error;

/** Thrown when a JSON response body cannot be decoded into the registered destination. */
public final class JsonDecodeException extends ResponseResolveException {

    private static final long serialVersionUID = 1L;

    public JsonDecodeException(String message, Throwable cause, String method, String uri, int statusCode) {
        super(message, cause, method, uri, statusCode);
    }
}
