package io.fluenthttp.example;

/** The API answered with success but without the expected payload. */
public final class EmptyResponseException extends UserApiException {

    private static final long serialVersionUID = 1L;

    public EmptyResponseException(String operation) {
        super(operation + ": empty response body");
    }
}
