package io.fluenthttp.core.model;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A finalized HTTP request: method, target URI, headers and a body stream.
 *
 * <p>
 * Method, URI and headers are fixed at construction. The body is a
 * single-consumption stream; {@link #bufferBody()} turns it into a re-readable
 * buffer so that several readers (matchers, dumps, form decoding) can inspect
 * it. The parsed form is populated lazily by {@code Forms.parsePostForm}.
 *
 * <p>
 * Not thread-safe.
 */
public final class Request {

    /** RFC 9110 §5.6.2 token characters. */
    private static final Pattern METHOD_TOKEN = Pattern.compile("[!#$%&'*+\\-.^_`|~0-9A-Za-z]+");

    private static final byte[] NO_BYTES = new byte[0];

    private final String method;
    private final URI uri;
    private final HttpHeaders headers;

    private InputStream body;
    private byte[] buffered;
    private FormValues form;

    /**
     * @param method  HTTP method; {@code null} or blank means {@code GET}
     * @param uri     target URI
     * @param headers request headers, {@code null} for none
     * @param body    body stream, {@code null} for no body
     * @throws IllegalArgumentException if {@code method} is not a valid HTTP token
     * @throws NullPointerException     if {@code uri} is null
     */
    public Request(String method, URI uri, HttpHeaders headers, InputStream body) {
        String resolved = method == null || method.isBlank() ? "GET" : method;
        if (!METHOD_TOKEN.matcher(resolved).matches()) {
            throw new IllegalArgumentException("invalid method " + '"' + resolved + '"');
        }
        this.method = resolved;
        this.uri = Objects.requireNonNull(uri, "uri must not be null");
        this.headers = headers != null ? headers : HttpHeaders.empty();
        this.body = body != null ? body : new ByteArrayInputStream(NO_BYTES);
    }

    /** Creates a request without headers or body. */
    public static Request of(String method, String uri) {
        return new Request(method, URI.create(uri), HttpHeaders.empty(), null);
    }

    public String method() {
        return method;
    }

    public URI uri() {
        return uri;
    }

    public HttpHeaders headers() {
        return headers;
    }

    /** The body stream. Never {@code null}; empty when the request carries no body. */
    public InputStream body() {
        return body;
    }

    /**
     * Reads the whole body once and replaces the stream with a buffer positioned
     * at its start. Subsequent calls return the same bytes and rewind the stream.
     *
     * @return a copy of the body bytes
     * @throws IOException if the original stream cannot be read
     */
    public byte[] bufferBody() throws IOException {
        if (buffered == null) {
            try (InputStream in = body) {
                buffered = in.readAllBytes();
            }
        }
        body = new ByteArrayInputStream(buffered);
        return buffered.clone();
    }

    /** Replaces the body stream; drops any previous buffer. */
    public void replaceBody(InputStream newBody) {
        this.body = newBody != null ? newBody : new ByteArrayInputStream(NO_BYTES);
        this.buffered = null;
    }

    /** Parsed form values, or {@code null} when the form has not been decoded yet. */
    public FormValues form() {
        return form;
    }

    /** Stores the parsed form values. */
    public void form(FormValues form) {
        this.form = form;
    }

    /**
     * Returns a copy with different headers. The copy shares this request's body
     * stream, so only one of them should be read.
     */
    public Request withHeaders(HttpHeaders newHeaders) {
        Request copy = new Request(method, uri, newHeaders, body);
        copy.buffered = buffered;
        copy.form = form;
        return copy;
    }

    /** Returns a copy with one header replaced. */
    public Request withHeader(String name, String value) {
        return withHeaders(headers.with(name, List.of(value)));
    }

    @Override
    public String toString() {
        return "Request[" + method + " " + uri + "]";
    }
}
