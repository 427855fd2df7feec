package io.fluenthttp.core.engine;

/**
 * Outcome of applying a body read limit to a response's declared content
 * length.
 *
 * <p>
 * Rules, with {@code limit} the configured read limit and {@code declared} the
 * response's content length (negative when unknown):
 * <ul>
 * <li>{@code limit < 0} → {@link Unlimited}.</li>
 * <li>{@code declared < 0} → {@link Capped} at {@code limit}; reading stops
 * there silently.</li>
 * <li>{@code limit == 0} → {@link Capped} at {@code declared}.</li>
 * <li>{@code limit >= declared} → {@link Capped} at {@code declared}.</li>
 * <li>{@code limit < declared} → {@link Exceeded}; the only rejecting case.</li>
 * </ul>
 */
public sealed interface BodyReadLimit {

    /**
     * Evaluates the limit against the declared length.
     *
     * @param limit    configured read limit; negative disables the check
     * @param declared declared content length; negative when unknown
     */
    static BodyReadLimit evaluate(long limit, long declared) {
        if (limit < 0) {
            return new Unlimited();
        }
        if (declared < 0) {
            return new Capped(limit);
        }
        if (limit == 0 || limit >= declared) {
            return new Capped(declared);
        }
        return new Exceeded(declared, limit);
    }

    /** No limit applies. */
    record Unlimited() implements BodyReadLimit {}

    /** Reading must stop after {@code maxBytes}. */
    record Capped(long maxBytes) implements BodyReadLimit {
        public Capped {
            if (maxBytes < 0) {
                throw new IllegalArgumentException("maxBytes must not be negative, got: " + maxBytes);
            }
        }
    }

    /** The declared length is above the limit. */
    record Exceeded(long contentLength, long readLimit) implements BodyReadLimit {}
}
