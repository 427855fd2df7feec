package io.fluenthttp.core.error;

/**
 * Abstract parent for errors raised while resolving an executed response. Carries the request
 * method, request URI and response status code; the message always starts with
 * {@code "request {METHOD} {URI} failed with status {CODE}"}.
 */
public abstract class ResponseResolveException extends FluentHttpException {

    private static final long serialVersionUID = 1L;

    private final String method;
    private final String uri;
    private final int statusCode;

    protected ResponseResolveException(String message, String method, String uri, int statusCode) {
        super(message, Stage.RESOLUTION);
        this.method = method;
        this.uri = uri;
        this.statusCode = statusCode;
    }

    protected ResponseResolveException(
            String message, Throwable cause, String method, String uri, int statusCode) {
        super(message, cause, Stage.RESOLUTION);
        this.method = method;
        this.uri = uri;
        this.statusCode = statusCode;
    }

    /** The method of the request that produced the response. */
    public String method() {
        return method;
    }

    /** The URI of the request that produced the response. */
    public String uri() {
        return uri;
    }

    /** The response status code. */
    public int statusCode() {
        return statusCode;
    }
}
