package io.fluenthttp.example;

/** The API rejected the caller's credentials (HTTP 401). */
public final class UnauthorizedException extends UserApiException {

    private static final long serialVersionUID = 1L;

    public UnauthorizedException() {
        super("unauthorized");
    }
}
