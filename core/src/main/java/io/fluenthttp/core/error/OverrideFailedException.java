package io.fluenthttp.core.error;

/**
 * Thrown when the request override hook fails or returns no request. The hook's exception, if
 * any, is the cause.
 */
public final class OverrideFailedException extends RequestBuildException {

    private static final long serialVersionUID = 1L;

    public OverrideFailedException(String message, Throwable cause, String method, String endpoint) {
        super(message, cause, method, endpoint);
    }
}
