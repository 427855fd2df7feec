package io.fluenthttp.example;

/** Base of the domain failures reported by {@link UserClient}. */
public abstract class UserApiException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected UserApiException(String message) {
        super(message);
    }
}
