package io.fluenthttp.core.error;

/**
 * Thrown when no handler is registered for the response status code. Holds whatever body bytes
 * could be drained from the response; the message embeds them base64-encoded.
 */
public final class UnhandledStatusException extends ResponseResolveException {

    private static final long serialVersionUID = 1L;

    private final byte[] body;

    public UnhandledStatusException(String message, String method, String uri, int statusCode, byte[] body) {
        super(message, method, uri, statusCode);
        this.body = body != null ? body.clone() : new byte[0];
    }

    /** A copy of the drained response body (empty when the response had none). */
    public byte[] body() {
        return body.clone();
    }
}
