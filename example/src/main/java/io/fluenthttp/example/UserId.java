package io.fluenthttp.example;

/** Identifier of a user. */
public record UserId(long value) {

    public UserId {
        if (value < 0) {
            throw new IllegalArgumentException("user id must not be negative, got: " + value);
        }
    }

    /** Decimal form, as used in URL paths. */
    @Override
    public String toString() {
        return Long.toString(value);
    }
}
