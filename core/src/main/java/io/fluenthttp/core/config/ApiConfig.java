package io.fluenthttp.core.config;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration for an {@code Api} and the JDK-backed doer it uses.
 *
 * <p>
 * All fields have defaults; {@code baseUrl} defaults to the empty string, in
 * which case endpoints must be absolute. Use {@link #builder()} to construct
 * instances.
 *
 * @param baseUrl           base server address (scheme, userinfo, host, port,
 *                          path prefix)
 * @param defaultHeaders    headers merged into every request
 * @param bodySizeReadLimit default response body read limit in bytes; 0 means
 *                          "declared length", negative disables the limit
 * @param connectTimeoutMs  TCP connect timeout in ms
 * @param readTimeoutMs     response timeout in ms; 0 disables it
 * @param followRedirects   whether the JDK client follows redirects
 */
public record ApiConfig(
        String baseUrl,
        Map<String, List<String>> defaultHeaders,
        long bodySizeReadLimit,
        int connectTimeoutMs,
        int readTimeoutMs,
        boolean followRedirects) {

    /** 64 KiB. */
    public static final long DEFAULT_BODY_SIZE_READ_LIMIT = 1L << 16;

    public ApiConfig {
        baseUrl = baseUrl != null ? baseUrl : "";
        defaultHeaders = defaultHeaders != null ? Map.copyOf(defaultHeaders) : Map.of();
        if (connectTimeoutMs <= 0) {
            throw new IllegalArgumentException("connectTimeoutMs must be positive, got: " + connectTimeoutMs);
        }
        if (readTimeoutMs < 0) {
            throw new IllegalArgumentException("readTimeoutMs must not be negative, got: " + readTimeoutMs);
        }
    }

    /** Configuration with every default applied. */
    public static ApiConfig defaults() {
        return builder().build();
    }

    /** Creates a new builder with sensible defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link ApiConfig}. */
    public static final class Builder {
        private String baseUrl = "";
        private final Map<String, List<String>> defaultHeaders = new LinkedHashMap<>();
        private long bodySizeReadLimit = DEFAULT_BODY_SIZE_READ_LIMIT;
        private int connectTimeoutMs = 10_000;
        private int readTimeoutMs = 30_000;
        private boolean followRedirects = false;

        Builder() {}

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder defaultHeader(String name, List<String> values) {
            this.defaultHeaders.put(name, List.copyOf(values));
            return this;
        }

        public Builder defaultHeaders(Map<String, List<String>> headers) {
            headers.forEach(this::defaultHeader);
            return this;
        }

        public Builder bodySizeReadLimit(long bodySizeReadLimit) {
            this.bodySizeReadLimit = bodySizeReadLimit;
            return this;
        }

        public Builder connectTimeoutMs(int connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
            return this;
        }

        public Builder readTimeoutMs(int readTimeoutMs) {
            this.readTimeoutMs = readTimeoutMs;
            return this;
        }

        public Builder followRedirects(boolean followRedirects) {
            this.followRedirects = followRedirects;
            return this;
        }

        public ApiConfig build() {
            return new ApiConfig(
                    baseUrl, defaultHeaders, bodySizeReadLimit, connectTimeoutMs, readTimeoutMs, followRedirects);
        }
    }
}
