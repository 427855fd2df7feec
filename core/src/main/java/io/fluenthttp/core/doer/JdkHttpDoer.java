package io.fluenthttp.core.doer;

import io.fluenthttp.core.config.ApiConfig;
import io.fluenthttp.core.model.HttpHeaders;
import io.fluenthttp.core.model.Request;
import io.fluenthttp.core.model.Response;
import io.fluenthttp.core.spi.Doer;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JDK {@link HttpClient}-based {@link Doer}.
 *
 * <p>
 * Sends the request with its headers and buffered body, and returns the
 * response with a streaming body. Headers the JDK client manages itself are not forwarded.
 * The read timeout, when set, bounds the wait for response headers.
 *
 * <p>
 * This class is thread-safe: the underlying {@link HttpClient} is
 * thread-safe and designed for concurrent use.
 */
public final class JdkHttpDoer implements Doer {

    private static final Logger LOG = LoggerFactory.getLogger(JdkHttpDoer.class);

    /** Headers {@link HttpRequest.Builder} refuses to set. */
    private static final Set<String> RESTRICTED_HEADERS =
            Set.of("connection", "content-length", "expect", "host", "upgrade");

    private final HttpClient httpClient;
    private final Duration readTimeout;

    /**
     * Wraps an existing client.
     *
     * @param httpClient  the client to send requests with
     * @param readTimeout per-request timeout, or {@code null} for none
     */
    public JdkHttpDoer(HttpClient httpClient, Duration readTimeout) {
        this.httpClient = httpClient;
        this.readTimeout = readTimeout;
    }

    /**
     * Creates a doer from configuration: HTTP/1.1, connect timeout, read
     * timeout and redirect policy.
     */
    public static JdkHttpDoer fromConfig(ApiConfig config) {
        HttpClient client = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofMillis(config.connectTimeoutMs()))
                .followRedirects(config.followRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .build();
        Duration readTimeout = config.readTimeoutMs() > 0 ? Duration.ofMillis(config.readTimeoutMs()) : null;
        LOG.debug(
                "JdkHttpDoer initialized: connectTimeout={}ms, readTimeout={}ms, followRedirects={}",
                config.connectTimeoutMs(),
                config.readTimeoutMs(),
                config.followRedirects());
        return new JdkHttpDoer(client, readTimeout);
    }

    /** Default instance built from {@link ApiConfig#defaults()}, created on first use. */
    public static JdkHttpDoer shared() {
        return SharedHolder.INSTANCE;
    }

    private static final class SharedHolder {
        static final JdkHttpDoer INSTANCE = fromConfig(ApiConfig.defaults());
    }

    @Override
    public Response execute(Request request) throws IOException {
        byte[] body = request.bufferBody();
        HttpRequest.Builder builder;
        try {
            builder = HttpRequest.newBuilder()
                    .uri(request.uri())
                    .method(
                            request.method(),
                            body.length > 0
                                    ? HttpRequest.BodyPublishers.ofByteArray(body)
                                    : HttpRequest.BodyPublishers.noBody());
            for (Map.Entry<String, List<String>> entry : request.headers().toMultiValueMap().entrySet()) {
                if (RESTRICTED_HEADERS.contains(entry.getKey())) {
                    continue;
                }
                for (String value : entry.getValue()) {
                    builder.header(entry.getKey(), value);
                }
            }
        } catch (IllegalArgumentException e) {
            throw new IOException(
                    "unsupported request " + request.method() + " " + request.uri() + ": " + e.getMessage(), e);
        }
        if (readTimeout != null) {
            builder.timeout(readTimeout);
        }

        HttpResponse<InputStream> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofInputStream());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            InterruptedIOException interrupted =
                    new InterruptedIOException("interrupted while executing " + request.method() + " " + request.uri());
            interrupted.initCause(e);
            throw interrupted;
        } catch (IllegalArgumentException e) {
            throw new IOException("rejected request " + request.method() + " " + request.uri(), e);
        }

        LOG.debug("Backend responded: {} {} → {}", request.method(), request.uri(), response.statusCode());

        return new Response(response.statusCode(), HttpHeaders.ofMulti(response.headers().map()), response.body())
                .bindRequest(request);
    }

    /** Returns the underlying {@link HttpClient}; package-private for tests. */
    HttpClient httpClient() {
        return httpClient;
    }
}
