package io.fluenthttp.core;

import com.fasterxml.jackson.core.type.TypeReference;
import io.fluenthttp.core.engine.BodyReadLimit;
import io.fluenthttp.core.engine.CappedInputStream;
import io.fluenthttp.core.engine.JsonCodec;
import io.fluenthttp.core.error.BodyTooLargeException;
import io.fluenthttp.core.error.FluentHttpException;
import io.fluenthttp.core.error.JsonDecodeException;
import io.fluenthttp.core.error.ResponseHandlerException;
import io.fluenthttp.core.error.UnhandledStatusException;
import io.fluenthttp.core.model.Request;
import io.fluenthttp.core.model.Response;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fluent handling of one executed response.
 *
 * <p>
 * Wraps either an executed {@link Response} or the failure that prevented one.
 * Callers register per-status handlers and a body read limit, then call
 * {@link #resolve()} exactly once:
 * <ol>
 * <li>a captured build/execution failure is rethrown;</li>
 * <li>the body read limit is applied ({@link BodyReadLimit});</li>
 * <li>the handler registered for the exact status code runs;</li>
 * <li>without one, an {@link UnhandledStatusException} carrying the drained
 * body is thrown.</li>
 * </ol>
 * The response is closed on every path.
 *
 * <p>
 * Not thread-safe. Each instance handles a single response.
 */
public final class ResponseBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(ResponseBuilder.class);

    private final Outcome outcome;
    private final Map<Integer, ResponseHandler> statusHandlers = new HashMap<>();

    private long bodySizeReadLimit = -1;
    private boolean resolved;

    /** Either the executed response or the failure that prevented it. */
    private sealed interface Outcome {}

    private record Executed(Response response) implements Outcome {}

    private record Failed(FluentHttpException cause) implements Outcome {}

    private ResponseBuilder(Outcome outcome) {
        this.outcome = outcome;
    }

    /** Wraps an executed response. */
    public static ResponseBuilder of(Response response) {
        return new ResponseBuilder(new Executed(Objects.requireNonNull(response, "response must not be null")));
    }

    /** Wraps a failure; {@link #resolve()} will throw it. */
    public static ResponseBuilder failed(FluentHttpException cause) {
        return new ResponseBuilder(new Failed(Objects.requireNonNull(cause, "cause must not be null")));
    }

    /**
     * Sets the maximum number of body bytes readable by handlers.
     *
     * <ul>
     * <li>Positive: maximum bytes; a larger declared content length fails
     * before any read.</li>
     * <li>Zero: the declared content length is the limit.</li>
     * <li>Negative: no limit.</li>
     * </ul>
     * Without a declared content length, reading silently stops at the limit.
     */
    public ResponseBuilder bodySizeReadLimit(long limit) {
        this.bodySizeReadLimit = limit;
        return this;
    }

    /** Registers the handler for a status code, replacing any previous one. */
    public ResponseBuilder onStatus(int status, ResponseHandler handler) {
        statusHandlers.put(status, Objects.requireNonNull(handler, "handler must not be null"));
        return this;
    }

    /** Registers one handler for several status codes. */
    public ResponseBuilder onStatuses(ResponseHandler handler, int... statuses) {
        for (int status : statuses) {
            onStatus(status, handler);
        }
        return this;
    }

    /** Treats the given status codes as success. */
    public ResponseBuilder successOnStatus(int... statuses) {
        return onStatuses(response -> {}, statuses);
    }

    /** Fails with a freshly supplied exception on the given status code. */
    public ResponseBuilder errorOnStatus(int status, Supplier<? extends RuntimeException> error) {
        Objects.requireNonNull(error, "error supplier must not be null");
        return onStatus(status, response -> {
            throw error.get();
        });
    }

    /**
     * Decodes a JSON body into an existing object on the given status code,
     * updating its properties in place. Content-Type is not checked.
     */
    public ResponseBuilder receiveJson(int status, Object destination) {
        Objects.requireNonNull(destination, "destination must not be null");
        return onStatus(status, response -> decodeJson(response, body -> {
            JsonCodec.mapper().readerForUpdating(destination).readValue(body);
            return null;
        }));
    }

    /** Decodes a JSON body as {@code type} on the given status code and hands it to {@code sink}. */
    public <T> ResponseBuilder receiveJson(int status, Class<T> type, Consumer<? super T> sink) {
        Objects.requireNonNull(sink, "sink must not be null");
        return onStatus(status, response -> sink.accept(
                decodeJson(response, body -> JsonCodec.mapper().readValue(body, type))));
    }

    /** Generic variant of {@link #receiveJson(int, Class, Consumer)}. */
    public <T> ResponseBuilder receiveJson(int status, TypeReference<T> type, Consumer<? super T> sink) {
        Objects.requireNonNull(sink, "sink must not be null");
        return onStatus(status, response -> sink.accept(
                decodeJson(response, body -> JsonCodec.mapper().readValue(body, type))));
    }

    /** Merges handlers without replacing those already registered. */
    ResponseBuilder withDefaultHandlers(Map<Integer, ResponseHandler> defaults) {
        defaults.forEach(statusHandlers::putIfAbsent);
        return this;
    }

    /**
     * Applies the read limit and status dispatch.
     *
     * @throws FluentHttpException   the captured build/execution failure, or a
     *                               resolution failure
     * @throws RuntimeException      whatever unchecked exception the matching
     *                               handler throws
     * @throws IllegalStateException if called more than once
     */
    public void resolve() {
        if (resolved) {
            throw new IllegalStateException("response already resolved");
        }
        resolved = true;

        if (outcome instanceof Failed failed) {
            throw failed.cause();
        }

        try (Response response = ((Executed) outcome).response()) {
            BodyReadLimit limit = BodyReadLimit.evaluate(bodySizeReadLimit, response.contentLength());
            if (limit instanceof BodyReadLimit.Exceeded exceeded) {
                throw new BodyTooLargeException(
                        describe(response) + ": content length " + exceeded.contentLength()
                                + " is above read limit " + exceeded.readLimit(),
                        method(response),
                        uri(response),
                        response.statusCode(),
                        exceeded.contentLength(),
                        exceeded.readLimit());
            }
            if (limit instanceof BodyReadLimit.Capped capped) {
                response.replaceBody(new CappedInputStream(response.body(), capped.maxBytes()));
            }

            ResponseHandler handler = statusHandlers.get(response.statusCode());
            if (handler != null) {
                invoke(handler, response);
                return;
            }

            byte[] body = drain(response.body());
            String suffix = body.length > 0 ? " with b64 body " + Base64.getEncoder().encodeToString(body) : "";
            throw new UnhandledStatusException(
                    describe(response) + ": unhandled status" + suffix,
                    method(response),
                    uri(response),
                    response.statusCode(),
                    body);
        }
    }

    private static void invoke(ResponseHandler handler, Response response) {
        try {
            handler.handle(response);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new ResponseHandlerException(
                    describe(response) + ": response handler failed: " + e.getMessage(),
                    e,
                    method(response),
                    uri(response),
                    response.statusCode());
        }
    }

    @FunctionalInterface
    private interface JsonRead<T> {
        T read(InputStream body) throws IOException;
    }

    private static <T> T decodeJson(Response response, JsonRead<T> read) {
        try {
            return read.read(response.body());
        } catch (IOException e) {
            throw new JsonDecodeException(
                    describe(response) + ": unable to parse JSON response body: " + e.getMessage(),
                    e,
                    method(response),
                    uri(response),
                    response.statusCode());
        }
    }

    /** Reads what remains of the body; a read failure keeps the bytes read so far. */
    private static byte[] drain(InputStream body) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buffer = new byte[8192];
        try {
            int n;
            while ((n = body.read(buffer)) != -1) {
                out.write(buffer, 0, n);
            }
        } catch (IOException e) {
            LOG.debug("Unhandled response body drained partially ({} bytes): {}", out.size(), e.getMessage());
        }
        return out.toByteArray();
    }

    /** Shared prefix of resolution errors: {@code request METHOD URI failed with status CODE}. */
    static String describe(Response response) {
        return "request " + method(response) + " " + uri(response) + " failed with status " + response.statusCode();
    }

    private static String method(Response response) {
        Request request = response.request();
        return request != null ? request.method() : "UNKNOWN";
    }

    private static String uri(Response response) {
        Request request = response.request();
        return request != null ? request.uri().toString() : "";
    }
}
