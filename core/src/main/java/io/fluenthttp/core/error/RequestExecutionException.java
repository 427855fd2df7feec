package io.fluenthttp.core.error;

/**
 * Thrown when the {@code Doer} fails to execute a finalized request (connection refused, timeout,
 * interrupted, ...). The executor's {@link java.io.IOException} is the cause.
 */
public final class RequestExecutionException extends FluentHttpException {

    private static final long serialVersionUID = 1L;

    private final String method;
    private final String uri;

    public RequestExecutionException(String message, Throwable cause, String method, String uri) {
        super(message, cause, Stage.EXECUTION);
        this.method = method;
        this.uri = uri;
    }

    /** The HTTP method of the failed request. */
    public String method() {
        return method;
    }

    /** The target URI of the failed request. */
    public String uri() {
        return uri;
    }
}
