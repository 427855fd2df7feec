package io.fluenthttp.core.error;

/**
 * Abstract base for all fluent-http exceptions. Never thrown directly; use the concrete
 * subclasses under {@link RequestBuildException}, {@link ResponseResolveException}, or the
 * stand-alone {@link RequestExecutionException} and {@link FormDecodeException}.
 *
 * <p>Every failure of a request/response cycle surfaces as exactly one of these, thrown from
 * {@code ResponseBuilder.resolve()}. Construction and execution failures are captured when they
 * happen and only rethrown at resolve time.
 */
public abstract class FluentHttpException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Stage of the request/response cycle in which the error occurred. */
    public enum Stage {
        CONSTRUCTION,
        EXECUTION,
        RESOLUTION,
        FORM_DECODING
    }

    private final Stage stage;

    protected FluentHttpException(String message, Stage stage) {
        super(message);
        this.stage = stage;
    }

    protected FluentHttpException(String message, Throwable cause, Stage stage) {
        super(message, cause);
        this.stage = stage;
    }

    /** The stage in which the error occurred. */
    public Stage stage() {
        return stage;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }
}
