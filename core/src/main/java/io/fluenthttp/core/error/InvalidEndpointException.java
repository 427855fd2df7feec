package io.fluenthttp.core.error;

/** Thrown when the endpoint string given to a request builder cannot be parsed as a URI. */
public final class InvalidEndpointException extends RequestBuildException {

    private static final long serialVersionUID = 1L;

    public InvalidEndpointException(String message, Throwable cause, String method, String endpoint) {
        super(message, cause, method, endpoint);
    }
}
