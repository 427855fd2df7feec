package io.fluenthttp.core.model;

import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An executed HTTP response: status, headers, declared content length, body
 * stream, and the request that produced it.
 *
 * <p>
 * The readable body may be replaced (e.g. by a length-capped view), but
 * {@link #close()} always releases the stream the response was created with,
 * and does so at most once.
 *
 * <p>
 * Not thread-safe.
 */
public final class Response implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(Response.class);

    /** Declared length when the response does not state one. */
    public static final long UNKNOWN_LENGTH = -1;

    private final int statusCode;
    private final HttpHeaders headers;
    private final long contentLength;
    private final InputStream original;

    private InputStream body;
    private Request request;
    private boolean closed;

    /**
     * Creates a response whose declared length is read from the
     * {@code content-length} header ({@link #UNKNOWN_LENGTH} when absent or
     * unparsable).
     */
    public Response(int statusCode, HttpHeaders headers, InputStream body) {
        this(statusCode, headers, body, declaredLength(headers));
    }

    /**
     * @param statusCode    HTTP status code
     * @param headers       response headers, {@code null} for none
     * @param body          body stream, {@code null} for an empty body
     * @param contentLength declared length, negative when unknown
     */
    public Response(int statusCode, HttpHeaders headers, InputStream body, long contentLength) {
        this.statusCode = statusCode;
        this.headers = headers != null ? headers : HttpHeaders.empty();
        this.original = body != null ? body : new ByteArrayInputStream(new byte[0]);
        this.body = this.original;
        this.contentLength = contentLength < 0 ? UNKNOWN_LENGTH : contentLength;
    }

    /**
     * Creates a response with a UTF-8 text body whose declared length is the
     * encoded byte count.
     */
    public static Response ofString(int statusCode, String text) {
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        return new Response(statusCode, HttpHeaders.empty(), new ByteArrayInputStream(bytes), bytes.length);
    }

    public int statusCode() {
        return statusCode;
    }

    public HttpHeaders headers() {
        return headers;
    }

    /** Declared content length, or {@link #UNKNOWN_LENGTH}. */
    public long contentLength() {
        return contentLength;
    }

    /** The readable body stream. */
    public InputStream body() {
        return body;
    }

    /** Reads the remaining readable body. */
    public byte[] readBody() throws IOException {
        return body.readAllBytes();
    }

    /**
     * Replaces the readable body. The stream passed at construction stays the
     * one released by {@link #close()}.
     */
    public void replaceBody(InputStream newBody) {
        this.body = newBody;
    }

    /** The request that produced this response, or {@code null} if not bound yet. */
    public Request request() {
        return request;
    }

    /**
     * Binds the originating request unless one is already bound.
     *
     * @return this response
     */
    public Response bindRequest(Request origin) {
        if (this.request == null) {
            this.request = origin;
        }
        return this;
    }

    public boolean isClosed() {
        return closed;
    }

    /** Releases the original body stream. Idempotent; a failing close is logged, not thrown. */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            original.close();
        } catch (IOException e) {
            LOG.debug("Failed to close response body (status {}): {}", statusCode, e.getMessage());
        }
    }

    private static long declaredLength(HttpHeaders headers) {
        String value = headers != null ? headers.first("content-length") : null;
        if (value == null) {
            return UNKNOWN_LENGTH;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return UNKNOWN_LENGTH;
        }
    }

    @Override
    public String toString() {
        return "Response[" + statusCode + ", " + contentLength + " bytes declared]";
    }
}
