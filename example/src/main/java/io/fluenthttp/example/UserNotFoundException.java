package io.fluenthttp.example;

/** The requested user does not exist (HTTP 404). */
public final class UserNotFoundException extends UserApiException {

    private static final long serialVersionUID = 1L;

    public UserNotFoundException() {
        super("user not found");
    }
}
