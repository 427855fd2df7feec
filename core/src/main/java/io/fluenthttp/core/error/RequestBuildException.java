package io.fluenthttp.core.error;

/**
 * Abstract parent for errors raised while finalizing a request: bad endpoint, bad method token,
 * body source misconfiguration, serialization or override-hook failure. Carries the method and
 * endpoint the builder held at the time, either of which may be {@code null}.
 */
public abstract class RequestBuildException extends FluentHttpException {

    private static final long serialVersionUID = 1L;

    private final String method;
    private final String endpoint;

    protected RequestBuildException(String message, String method, String endpoint) {
        super(message, Stage.CONSTRUCTION);
        this.method = method;
        this.endpoint = endpoint;
    }

    protected RequestBuildException(String message, Throwable cause, String method, String endpoint) {
        super(message, cause, Stage.CONSTRUCTION);
        this.method = method;
        this.endpoint = endpoint;
    }

    /** The HTTP method of the request being built. */
    public String method() {
        return method;
    }

    /** The endpoint of the request being built, as the caller supplied or the builder resolved it. */
    public String endpoint() {
        return endpoint;
    }
}
