package io.fluenthttp.core.error;

/** Thrown when the declared content length of a response exceeds the configured read limit. */
public final class BodyTooLargeException extends ResponseResolveException {

    private static final long serialVersionUID = 1L;

    private final long contentLength;
    private final long readLimit;

    public BodyTooLargeException(
            String message, String method, String uri, int statusCode, long contentLength, long readLimit) {
        super(message, method, uri, statusCode);
        this.contentLength = contentLength;
        this.readLimit = readLimit;
    }

    /** The content length the response declared. */
    public long contentLength() {
        return contentLength;
    }

    /** The read limit that was exceeded. */
    public long readLimit() {
        return readLimit;
    }
}
