package io.fluenthttp.core;

import io.fluenthttp.core.config.ApiConfig;
import io.fluenthttp.core.doer.JdkHttpDoer;
import io.fluenthttp.core.engine.Endpoint;
import io.fluenthttp.core.model.HttpHeaders;
import io.fluenthttp.core.spi.Doer;
import java.net.URI;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Defaults shared by every request sent to one server: base address, default
 * request headers, default status handlers, default body read limit and an
 * optional request override hook.
 *
 * <p>
 * Request factories ({@link #get(String)}, {@link #post(String)}, ...) return
 * fresh {@link RequestBuilder}s with the base address, headers and hook
 * applied. {@link #execute(RequestBuilder)} runs a builder and applies the
 * response defaults; handlers registered afterwards on the returned
 * {@link ResponseBuilder} take precedence.
 *
 * <p>
 * Configure once, then share: request production only reads the
 * configuration and is safe from several threads, as long as no
 * {@code with*} method runs concurrently.
 */
public final class Api {

    private final Doer doer;
    private final Endpoint serverAddress;

    private final Map<String, List<String>> defaultRequestHeaders = new LinkedHashMap<>();
    private final Map<Integer, ResponseHandler> defaultResponseHandlers = new HashMap<>();
    private long defaultBodySizeReadLimit = ApiConfig.DEFAULT_BODY_SIZE_READ_LIMIT;
    private RequestOverride defaultOverride;

    /**
     * @param doer          executor for every request
     * @param serverAddress base URL; endpoints are appended to its path
     */
    public Api(Doer doer, URI serverAddress) {
        this.doer = Objects.requireNonNull(doer, "doer must not be null");
        this.serverAddress = Endpoint.of(Objects.requireNonNull(serverAddress, "serverAddress must not be null"));
    }

    /** Creates an API executing through a {@link JdkHttpDoer} built from the same configuration. */
    public static Api fromConfig(ApiConfig config) {
        return fromConfig(config, JdkHttpDoer.fromConfig(config));
    }

    /** Creates an API from configuration, executing through {@code doer}. */
    public static Api fromConfig(ApiConfig config, Doer doer) {
        Api api = new Api(doer, URI.create(config.baseUrl()));
        api.withRequestHeaders(config.defaultHeaders());
        api.withResponseBodySizeReadLimit(config.bodySizeReadLimit());
        return api;
    }

    /** Deep copy: later changes to either instance do not affect the other. */
    public Api copy() {
        Api clone = new Api(doer, URI.create(url("")));
        defaultRequestHeaders.forEach((name, values) -> clone.defaultRequestHeaders.put(name, List.copyOf(values)));
        clone.defaultResponseHandlers.putAll(defaultResponseHandlers);
        clone.defaultBodySizeReadLimit = defaultBodySizeReadLimit;
        clone.defaultOverride = defaultOverride;
        return clone;
    }

    /** Sets headers sent with every request, replacing earlier defaults with the same name. */
    public Api withRequestHeaders(Map<String, List<String>> headers) {
        headers.forEach((name, values) -> defaultRequestHeaders.put(HttpHeaders.normalize(name), List.copyOf(values)));
        return this;
    }

    /** Sets one header sent with every request. */
    public Api withRequestHeader(String name, String value, String... values) {
        List<String> all = new ArrayList<>();
        all.add(value);
        all.addAll(Arrays.asList(values));
        return withRequestHeaders(Map.of(name, all));
    }

    /** Sets the handler used for {@code status} unless a request registers its own. */
    public Api withResponseHandler(int status, ResponseHandler handler) {
        defaultResponseHandlers.put(status, Objects.requireNonNull(handler, "handler must not be null"));
        return this;
    }

    /**
     * Sets the body read limit of every response (64 KiB unless changed). See
     * {@link ResponseBuilder#bodySizeReadLimit(long)}.
     */
    public Api withResponseBodySizeReadLimit(long limit) {
        this.defaultBodySizeReadLimit = limit;
        return this;
    }

    /** Sets the override hook given to every request builder; {@code null} removes it. */
    public Api withRequestOverride(RequestOverride hook) {
        this.defaultOverride = hook;
        return this;
    }

    /**
     * Absolute URL for an endpoint: the base address with {@code endpoint}
     * appended to its path.
     */
    public String url(String endpoint) {
        return serverAddress.withPath(serverAddress.path() + endpoint).toString();
    }

    public RequestBuilder head(String endpoint) {
        return request("HEAD", endpoint);
    }

    public RequestBuilder get(String endpoint) {
        return request("GET", endpoint);
    }

    public RequestBuilder post(String endpoint) {
        return request("POST", endpoint);
    }

    public RequestBuilder put(String endpoint) {
        return request("PUT", endpoint);
    }

    public RequestBuilder patch(String endpoint) {
        return request("PATCH", endpoint);
    }

    public RequestBuilder delete(String endpoint) {
        return request("DELETE", endpoint);
    }

    /** Request builder for any method, with the API defaults applied. */
    public RequestBuilder request(String method, String endpoint) {
        RequestBuilder builder = new RequestBuilder(method, url(endpoint), doer).setHeaders(defaultRequestHeaders);
        if (defaultOverride != null) {
            builder.override(defaultOverride);
        }
        return builder;
    }

    /** Executes the request and returns a response builder carrying the API's response defaults. */
    public ResponseBuilder execute(RequestBuilder request) {
        return request.execute()
                .bodySizeReadLimit(defaultBodySizeReadLimit)
                .withDefaultHandlers(defaultResponseHandlers);
    }

    /** Executes the request and resolves it with the API's response defaults only. */
    public void executeAndResolve(RequestBuilder request) {
        execute(request).resolve();
    }
}
