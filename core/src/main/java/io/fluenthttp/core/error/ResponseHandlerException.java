package io.fluenthttp.core.error;

/**
 * Wraps a checked exception thrown by a status handler. Unchecked exceptions thrown by handlers
 * are never wrapped, so callers can catch their own exception types directly.
 */
public final class ResponseHandlerException extends ResponseResolveException {

    private static final long serialVersionUID = 1L;

    public ResponseHandlerException(String message, Throwable cause, String method, String uri, int statusCode) {
        super(message, cause, method, uri, statusCode);
    }
}
