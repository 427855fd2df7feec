package io.fluenthttp.core.error;

/** Thrown when the method token or URI is rejected while constructing the request object. */
public final class RequestConstructionException extends RequestBuildException {

    private static final long serialVersionUID = 1L;

    public RequestConstructionException(String message, Throwable cause, String method, String endpoint) {
        super(message, cause, method, endpoint);
    }
}
