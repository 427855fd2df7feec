package io.fluenthttp.core.error;

/** Thrown when a request body cannot be read or parsed as url-encoded form values. */
public final class FormDecodeException extends FluentHttpException {

    private static final long serialVersionUID = 1L;

    public FormDecodeException(String message, Throwable cause) {
        super(message, cause, Stage.FORM_DECODING);
    }
}
