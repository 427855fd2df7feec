package io.fluenthttp.core.engine;

import io.fluenthttp.core.model.FormValues;
import java.net.URI;
import java.net.URISyntaxException;

/**
 * Decomposed request target: scheme, authority parts, <em>decoded</em> path,
 * query values and fragment.
 *
 * <p>
 * Keeping the path decoded lets callers substitute placeholders such as
 * {@code {userID}} before the URI is assembled and percent-encoded by
 * {@link #toUri()}. Query values are re-encoded, keys sorted.
 *
 * @param scheme   scheme or {@code null} for a relative endpoint
 * @param userInfo decoded user info or {@code null}
 * @param host     host or {@code null}
 * @param port     port or {@code -1}
 * @param path     decoded path, possibly empty
 * @param query    query values, never {@code null}
 * @param fragment decoded fragment or {@code null}
 */
public record Endpoint(
        String scheme, String userInfo, String host, int port, String path, FormValues query, String fragment) {

    /** Characters Java's URI parser rejects but browsers and most HTTP stacks accept in a URL. */
    private static final String LENIENT_CHARS = " \"<>{}|\\^`";

    public Endpoint {
        path = path != null ? path : "";
        query = query != null ? query : FormValues.empty();
    }

    /**
     * Parses an endpoint string, escaping characters that are commonly written
     * unescaped (spaces, braces, ...) before handing it to {@link URI}.
     *
     * @throws URISyntaxException       if the string is still not a valid URI
     * @throws IllegalArgumentException if the query holds malformed escapes
     */
    public static Endpoint parse(String endpoint) throws URISyntaxException {
        if (endpoint == null) {
            throw new URISyntaxException("null", "endpoint must not be null");
        }
        URI uri = new URI(escapeLenient(endpoint));
        return new Endpoint(
                uri.getScheme(),
                uri.getUserInfo(),
                uri.getHost(),
                uri.getPort(),
                uri.getPath(),
                FormValues.parse(uri.getRawQuery()),
                uri.getFragment());
    }

    /** Copies this endpoint from a URI. */
    public static Endpoint of(URI uri) {
        return new Endpoint(
                uri.getScheme(),
                uri.getUserInfo(),
                uri.getHost(),
                uri.getPort(),
                uri.getPath(),
                FormValues.parse(uri.getRawQuery()),
                uri.getFragment());
    }

    public Endpoint withPath(String newPath) {
        return new Endpoint(scheme, userInfo, host, port, newPath, query, fragment);
    }

    public Endpoint withQuery(FormValues newQuery) {
        return new Endpoint(scheme, userInfo, host, port, path, newQuery, fragment);
    }

    /**
     * Assembles and percent-encodes the URI.
     *
     * @throws URISyntaxException if the components do not form a valid URI (e.g.
     *                            a relative path with an authority)
     */
    public URI toUri() throws URISyntaxException {
        String base = new URI(scheme, userInfo, host, port, path.isEmpty() ? null : path, null, null)
                .toASCIIString();
        StringBuilder out = new StringBuilder(base);
        if (!query.isEmpty()) {
            out.append('?').append(query.encode());
        }
        if (fragment != null) {
            out.append(new URI(null, null, null, -1, null, null, fragment).toASCIIString());
        }
        return new URI(out.toString());
    }

    /** Best-effort string form for messages; never throws. */
    @Override
    public String toString() {
        try {
            return toUri().toString();
        } catch (URISyntaxException e) {
            return (scheme != null ? scheme + "://" : "") + (host != null ? host : "") + path;
        }
    }

    private static String escapeLenient(String raw) {
        StringBuilder out = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (LENIENT_CHARS.indexOf(c) >= 0) {
                out.append('%').append(String.format("%02X", (int) c));
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }
}
