package io.fluenthttp.testkit;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.fluenthttp.core.config.ApiConfig;
import io.fluenthttp.core.doer.JdkHttpDoer;
import io.fluenthttp.core.model.HttpHeaders;
import io.fluenthttp.core.model.Request;
import io.fluenthttp.core.spi.Doer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * End-to-end assertion helper: starts a throw-away HTTP server, runs the code
 * under test against it, checks the request the server received and answers
 * with a scripted response.
 *
 * <pre>{@code
 * HttpTestServer<Consumer<User>> server = new HttpTestServer<>((address, doer, check) -> {
 *     UserClient client = new UserClient(doer, address);
 *     check.accept(client.getUserById(new UserId(42)));
 * });
 *
 * server.assertRequest(
 *         new RequestMatcherBuilder().method("GET").urlPath("/users/42"),
 *         ResponseWriter.json(200, Map.of("id", 42, "name", "ada")),
 *         user -> assertThat(user.name()).isEqualTo("ada"));
 * }</pre>
 *
 * The server binds an ephemeral loopback port for each assertion and is
 * stopped before {@link #assertRequest} returns. Exactly one request is
 * expected per assertion.
 *
 * @param <C> type of the check handed through to the interaction
 */
public final class HttpTestServer<C> {

    private static final Logger LOG = LoggerFactory.getLogger(HttpTestServer.class);

    private static final String LOOPBACK = "127.0.0.1";
    private static final long EXCHANGE_WAIT_SECONDS = 5;

    /** The code under test. */
    @FunctionalInterface
    public interface Interaction<C> {
        /**
         * @param serverAddress base URL of the running server
         * @param serverDoer    doer able to reach the server
         * @param check         the value given to {@link HttpTestServer#assertRequest}
         */
        void run(URI serverAddress, Doer serverDoer, C check) throws Exception;
    }

    private final Interaction<C> interaction;
    private final Doer serverDoer;

    public HttpTestServer(Interaction<C> interaction) {
        this(interaction, JdkHttpDoer.fromConfig(ApiConfig.builder()
                .connectTimeoutMs(2000)
                .readTimeoutMs(10000)
                .build()));
    }

    /** Uses {@code serverDoer} instead of a default {@link JdkHttpDoer}. */
    public HttpTestServer(Interaction<C> interaction, Doer serverDoer) {
        this.interaction = Objects.requireNonNull(interaction, "interaction must not be null");
        this.serverDoer = Objects.requireNonNull(serverDoer, "serverDoer must not be null");
    }

    /** {@link #assertRequest(RequestMatcher, ResponseWriter, Object)} without a check. */
    public void assertRequest(RequestMatcher expectations, ResponseWriter writeResponse) {
        assertRequest(expectations, writeResponse, null);
    }

    /**
     * Runs the interaction against a fresh server.
     *
     * @throws AssertionError if the received request fails {@code expectations},
     *                        the response cannot be written, the interaction
     *                        throws, or no request arrives
     */
    public void assertRequest(RequestMatcher expectations, ResponseWriter writeResponse, C check) {
        BlockingQueue<String> outcome = new ArrayBlockingQueue<>(1);
        AtomicBoolean received = new AtomicBoolean();

        HttpServer server;
        try {
            server = HttpServer.create(new InetSocketAddress(LOOPBACK, 0), 0);
        } catch (IOException e) {
            throw new AssertionError("unable to start test server: " + e.getMessage(), e);
        }
        server.createContext("/", exchange -> {
            received.set(true);
            String result;
            try {
                result = serve(exchange, expectations, writeResponse);
            } catch (IOException | RuntimeException e) {
                result = "unable to answer request: " + e.getMessage();
            } finally {
                exchange.close();
            }
            outcome.offer(result);
        });
        server.start();

        URI address = URI.create("http://" + LOOPBACK + ":" + server.getAddress().getPort());
        LOG.debug("Test server listening on {}", address);

        try {
            Exception failure = null;
            try {
                interaction.run(address, serverDoer, check);
            } catch (Exception e) {
                failure = e;
            }

            String serverOutcome = received.get() ? awaitOutcome(outcome) : null;
            if (serverOutcome != null && !serverOutcome.isEmpty()) {
                AssertionError error = new AssertionError(serverOutcome);
                if (failure != null) {
                    error.addSuppressed(failure);
                }
                throw error;
            }
            if (failure != null) {
                throw new AssertionError("doer execution failed: " + failure.getMessage(), failure);
            }
            if (serverOutcome == null) {
                throw new AssertionError("test server received no request");
            }
        } finally {
            server.stop(0);
        }
    }

    /** Waits for the handler to finish the exchange it started. */
    private static String awaitOutcome(BlockingQueue<String> outcome) {
        String result;
        try {
            result = outcome.poll(EXCHANGE_WAIT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssertionError("interrupted while waiting for the test server", e);
        }
        return result != null ? result : "test server did not complete the exchange";
    }

    /** Handles the exchange; returns an empty string on success, else the failure description. */
    private static String serve(HttpExchange exchange, RequestMatcher expectations, ResponseWriter writeResponse)
            throws IOException {
        Request request;
        try {
            request = toRequest(exchange);
        } catch (IllegalArgumentException e) {
            reject(exchange, "unable to read request: " + e.getMessage());
            return "unable to read request: " + e.getMessage();
        }

        List<String> mismatches = expectations.mismatches(request);
        if (!mismatches.isEmpty()) {
            String message = "request does not match: " + String.join("; ", mismatches);
            LOG.debug("Test server rejected {} {}: {}", request.method(), request.uri(), mismatches);
            reject(exchange, message);
            return message;
        }

        try {
            writeResponse.write(exchange);
        } catch (IOException | RuntimeException e) {
            return "unable to write response: " + e.getMessage();
        }
        return "";
    }

    private static Request toRequest(HttpExchange exchange) {
        String host = exchange.getRequestHeaders().getFirst("Host");
        if (host == null) {
            host = exchange.getLocalAddress().getHostString() + ":" + exchange.getLocalAddress().getPort();
        }
        URI uri = URI.create("http://" + host + exchange.getRequestURI().toString());
        return new Request(
                exchange.getRequestMethod(),
                uri,
                HttpHeaders.ofMulti(exchange.getRequestHeaders()),
                exchange.getRequestBody());
    }

    private static void reject(HttpExchange exchange, String message) throws IOException {
        byte[] body = message.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(500, body.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
        }
    }
}
