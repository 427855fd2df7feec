package io.fluenthttp.core;

import io.fluenthttp.core.doer.JdkHttpDoer;
import io.fluenthttp.core.engine.Endpoint;
import io.fluenthttp.core.error.BodyConflictException;
import io.fluenthttp.core.error.FluentHttpException;
import io.fluenthttp.core.error.InvalidEndpointException;
import io.fluenthttp.core.error.OverrideFailedException;
import io.fluenthttp.core.error.RequestBuildException;
import io.fluenthttp.core.error.RequestConstructionException;
import io.fluenthttp.core.error.RequestExecutionException;
import io.fluenthttp.core.error.SerializationFailedException;
import io.fluenthttp.core.error.SerializerMissingException;
import io.fluenthttp.core.model.FormValues;
import io.fluenthttp.core.model.HttpHeaders;
import io.fluenthttp.core.model.MediaType;
import io.fluenthttp.core.model.Request;
import io.fluenthttp.core.model.Response;
import io.fluenthttp.core.spi.Doer;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fluent, mutable builder for one HTTP request.
 *
 * <p>
 * Every setter mutates this builder and returns it, so two references to the
 * same builder observe each other's changes. Errors are never thrown by
 * setters: a malformed endpoint is recorded at creation, body misconfiguration
 * is detected by {@link #build()}, and {@link #execute()} captures every
 * failure into the returned {@link ResponseBuilder}.
 *
 * <p>
 * {@link #build()} does not consume builder state and may be called more than
 * once. A raw {@link InputStream} body is shared between the built requests
 * and can only be read once.
 *
 * <p>
 * Not thread-safe.
 */
public final class RequestBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(RequestBuilder.class);

    private static final String CONTENT_TYPE = "content-type";

    private final String method;
    private final String rawEndpoint;
    private final Map<String, List<String>> headers = new LinkedHashMap<>();

    private RequestBuildException builderError;
    private Endpoint endpoint;
    private Doer doer;

    private InputStream body;
    private byte[] bodyBytes;
    private Object bodyToSerialize;
    private BodySerializer serializer;
    private RequestOverride override;

    /**
     * Creates a builder executing through {@code doer}.
     *
     * @param method   HTTP method, validated at build time
     * @param endpoint absolute or relative URL; parse errors are deferred
     * @param doer     executor used by {@link #execute()}
     */
    public RequestBuilder(String method, String endpoint, Doer doer) {
        this.method = method;
        this.rawEndpoint = endpoint;
        this.doer = Objects.requireNonNull(doer, "doer must not be null");
        try {
            this.endpoint = Endpoint.parse(endpoint);
        } catch (URISyntaxException | IllegalArgumentException e) {
            this.builderError = new InvalidEndpointException(
                    "unable to parse endpoint url " + '"' + endpoint + '"' + ": " + e.getMessage(),
                    e,
                    method,
                    endpoint);
            this.endpoint = new Endpoint(null, null, null, -1, "", FormValues.empty(), null);
        }
    }

    /** Creates a builder executing through {@link JdkHttpDoer#shared()}. */
    public static RequestBuilder newRequest(String method, String endpoint) {
        return new RequestBuilder(method, endpoint, JdkHttpDoer.shared());
    }

    /** Replaces the executor. */
    public RequestBuilder client(Doer newDoer) {
        this.doer = Objects.requireNonNull(newDoer, "doer must not be null");
        return this;
    }

    // ── Headers ──

    /** Replaces all values of a header. */
    public RequestBuilder setHeader(String name, String value, String... values) {
        headers.put(HttpHeaders.normalize(name), concat(value, values));
        return this;
    }

    /** Replaces each given header; other headers are left untouched. */
    public RequestBuilder setHeaders(Map<String, List<String>> newHeaders) {
        newHeaders.forEach((name, values) -> headers.put(HttpHeaders.normalize(name), new ArrayList<>(values)));
        return this;
    }

    /** Replaces each given header; other headers are left untouched. */
    public RequestBuilder setHeaders(HttpHeaders newHeaders) {
        return setHeaders(newHeaders.toMultiValueMap());
    }

    /** Appends values to a header. */
    public RequestBuilder addHeader(String name, String value, String... values) {
        headers.computeIfAbsent(HttpHeaders.normalize(name), k -> new ArrayList<>())
                .addAll(concat(value, values));
        return this;
    }

    /** Appends values to each given header. */
    public RequestBuilder addHeaders(Map<String, List<String>> extraHeaders) {
        extraHeaders.forEach((name, values) ->
                headers.computeIfAbsent(HttpHeaders.normalize(name), k -> new ArrayList<>())
                        .addAll(values));
        return this;
    }

    // ── Query and path ──

    /** Replaces all values of a query parameter. */
    public RequestBuilder setQueryParam(String key, String value, String... values) {
        endpoint = endpoint.withQuery(endpoint.query().with(key, concat(value, values)));
        return this;
    }

    /** Replaces each given query parameter; other parameters are left untouched. */
    public RequestBuilder setQueryParams(FormValues params) {
        FormValues query = endpoint.query();
        for (Map.Entry<String, List<String>> entry : params.toMap().entrySet()) {
            query = query.with(entry.getKey(), entry.getValue());
        }
        endpoint = endpoint.withQuery(query);
        return this;
    }

    /** Appends values to a query parameter. */
    public RequestBuilder addQueryParam(String key, String value, String... values) {
        endpoint = endpoint.withQuery(endpoint.query().withAdded(key, concat(value, values)));
        return this;
    }

    /** Appends values to each given query parameter. */
    public RequestBuilder addQueryParams(FormValues params) {
        FormValues query = endpoint.query();
        for (Map.Entry<String, List<String>> entry : params.toMap().entrySet()) {
            query = query.withAdded(entry.getKey(), entry.getValue());
        }
        endpoint = endpoint.withQuery(query);
        return this;
    }

    /**
     * Replaces every occurrence of {@code pattern} in the decoded URL path, e.g.
     * {@code pathReplacer("{userID}", "42")} on {@code /users/{userID}}.
     */
    public RequestBuilder pathReplacer(String pattern, String replacement) {
        endpoint = endpoint.withPath(endpoint.path().replace(pattern, replacement));
        return this;
    }

    // ── Body ──

    /** Sends the form values url-encoded, with the matching content type. */
    public RequestBuilder sendForm(FormValues values) {
        this.body = null;
        this.bodyBytes = values.encode().getBytes(StandardCharsets.UTF_8);
        return setHeader(CONTENT_TYPE, MediaType.FORM.value());
    }

    /**
     * Sends {@code value} serialized as JSON at build time, with the matching
     * content type. A {@code null} value clears the pending body.
     */
    public RequestBuilder sendJson(Object value) {
        this.bodyToSerialize = value;
        this.serializer = BodySerializer.JSON;
        return setHeader(CONTENT_TYPE, MediaType.JSON.value());
    }

    /** Sends the stream as-is, with content type {@code application/octet-stream}. */
    public RequestBuilder send(InputStream stream) {
        this.body = stream;
        this.bodyBytes = null;
        return setHeader(CONTENT_TYPE, MediaType.BINARY.value());
    }

    /** Sends the bytes as-is with the given content type. */
    public RequestBuilder sendBytes(byte[] bytes, String contentType) {
        this.body = null;
        this.bodyBytes = bytes.clone();
        return setHeader(CONTENT_TYPE, contentType);
    }

    /**
     * Sends {@code value} serialized at build time by {@code bodySerializer}.
     * The content type is left to the caller.
     */
    public RequestBuilder sendSerialized(Object value, BodySerializer bodySerializer) {
        this.bodyToSerialize = value;
        this.serializer = bodySerializer;
        return this;
    }

    /** Replaces the serializer used for a pending body; {@code null} unsets it. */
    public RequestBuilder serializer(BodySerializer bodySerializer) {
        this.serializer = bodySerializer;
        return this;
    }

    /** Sets the hook applied last during {@link #build()}; {@code null} removes it. */
    public RequestBuilder override(RequestOverride hook) {
        this.override = hook;
        return this;
    }

    /** The URI as currently configured, or {@code null} if it cannot be assembled. */
    public URI uri() {
        try {
            return endpoint.toUri();
        } catch (URISyntaxException e) {
            return null;
        }
    }

    public String method() {
        return method;
    }

    // ── Finalize ──

    /**
     * Finalizes the request.
     *
     * @return the request to send
     * @throws RequestBuildException if the endpoint was malformed, body sources
     *                               conflict, serialization fails, the method or
     *                               URI is rejected, or the override hook fails
     */
    public Request build() {
        if (builderError != null) {
            throw builderError;
        }

        String target = endpoint.toString();
        InputStream payload = body;
        if (bodyBytes != null) {
            payload = new ByteArrayInputStream(bodyBytes);
        }

        if (bodyToSerialize != null) {
            if (payload != null) {
                throw new BodyConflictException(
                        "body to serialize is set but raw body is already set", method, target);
            }
            if (serializer == null) {
                throw new SerializerMissingException(
                        "body to serialize is set but body serializer is unset", method, target);
            }
            try {
                payload = new ByteArrayInputStream(serializer.serialize(bodyToSerialize));
            } catch (Exception e) {
                throw new SerializationFailedException(
                        "unable to serialize body: " + e.getMessage(), e, method, target);
            }
        }

        Request request;
        try {
            request = new Request(method, endpoint.toUri(), HttpHeaders.ofMulti(headers), payload);
        } catch (URISyntaxException | IllegalArgumentException e) {
            throw new RequestConstructionException(
                    "unable to create request " + method + " " + target + ": " + e.getMessage(), e, method, target);
        }

        if (override != null) {
            Request replaced;
            try {
                replaced = override.apply(request);
            } catch (Exception e) {
                throw new OverrideFailedException(
                        "request override failed: " + e.getMessage(), e, request.method(), target);
            }
            if (replaced == null) {
                throw new OverrideFailedException(
                        "request override returned no request", null, request.method(), target);
            }
            request = replaced;
        }

        return request;
    }

    /**
     * Builds the request and executes it. Never throws: build and execution
     * failures are captured and surface from {@link ResponseBuilder#resolve()}.
     */
    public ResponseBuilder execute() {
        Request request;
        try {
            request = build();
        } catch (FluentHttpException e) {
            LOG.debug("Request {} {} not built: {}", method, rawEndpoint, e.getMessage());
            return ResponseBuilder.failed(e);
        }

        LOG.debug("Executing {} {}", request.method(), request.uri());

        Response response;
        try {
            response = doer.execute(request);
        } catch (IOException | RuntimeException e) {
            LOG.debug("Execution of {} {} failed: {}", request.method(), request.uri(), e.toString());
            return ResponseBuilder.failed(new RequestExecutionException(
                    "unable to execute " + request.method() + " " + request.uri() + " request: " + e.getMessage(),
                    e,
                    request.method(),
                    request.uri().toString()));
        }

        if (response == null) {
            return ResponseBuilder.failed(new RequestExecutionException(
                    "unable to execute " + request.method() + " " + request.uri() + " request: no response",
                    null,
                    request.method(),
                    request.uri().toString()));
        }

        LOG.debug("{} {} → {}", request.method(), request.uri(), response.statusCode());
        return ResponseBuilder.of(response.bindRequest(request));
    }

    private static List<String> concat(String first, String... rest) {
        List<String> all = new ArrayList<>(1 + rest.length);
        all.add(first);
        all.addAll(Arrays.asList(rest));
        return all;
    }
}
