package io.fluenthttp.testkit;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectReader;
import io.fluenthttp.core.Forms;
import io.fluenthttp.core.engine.JsonCodec;
import io.fluenthttp.core.error.FormDecodeException;
import io.fluenthttp.core.model.FormValues;
import io.fluenthttp.core.model.HttpHeaders;
import io.fluenthttp.core.model.Request;
import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Fluent {@link RequestMatcher}: each method adds one expectation, and
 * {@link #mismatches(Request)} reports every expectation the request fails.
 *
 * <pre>{@code
 * RequestMatcher matcher = new RequestMatcherBuilder()
 *         .method("POST")
 *         .urlPath("/users")
 *         .headersContains(Map.of("content-type", List.of("application/json")))
 *         .bodyJson(new CreateUser("bob"), CreateUser.class, true);
 * }</pre>
 *
 * Body expectations buffer the request body, so it stays readable.
 */
public final class RequestMatcherBuilder implements RequestMatcher {

    private final List<Function<Request, List<String>>> assertions = new ArrayList<>();

    /** Expects this exact (case-sensitive) method. */
    public RequestMatcherBuilder method(String method) {
        assertions.add(request -> request.method().equals(method)
                ? List.of()
                : List.of("request method " + quote(request.method()) + " != " + quote(method)));
        return this;
    }

    /** Expects this host, including the port when the URL has one ({@code example.com:8080}). */
    public RequestMatcherBuilder urlHost(String host) {
        assertions.add(request -> {
            String actual = hostOf(request.uri());
            return Objects.equals(actual, host)
                    ? List.of()
                    : List.of("request url host " + quote(actual) + " != " + quote(host));
        });
        return this;
    }

    /** Expects this decoded path. */
    public RequestMatcherBuilder urlPath(String path) {
        assertions.add(request -> {
            String actual = request.uri().getPath() != null ? request.uri().getPath() : "";
            return actual.equals(path)
                    ? List.of()
                    : List.of("request url path " + quote(actual) + " != " + quote(path));
        });
        return this;
    }

    /**
     * Expects each given query key with exactly these values, in order. Other
     * keys are allowed.
     */
    public RequestMatcherBuilder urlQueryParamsContains(FormValues params) {
        assertions.add(request -> {
            FormValues actual;
            try {
                actual = FormValues.parse(request.uri().getRawQuery());
            } catch (IllegalArgumentException e) {
                return List.of("unable to parse url query: " + e.getMessage());
            }
            List<String> errors = new ArrayList<>();
            params.toMap().forEach((key, values) -> {
                if (!actual.contains(key)) {
                    errors.add("expected url query param key " + key + " to be set");
                } else if (!actual.all(key).equals(values)) {
                    errors.add("expected url query param key " + key + " to be " + values + " but is "
                            + actual.all(key));
                }
            });
            return errors;
        });
        return this;
    }

    /**
     * Expects each given header with exactly these values, in order. Names are
     * case-insensitive; other headers are allowed.
     */
    public RequestMatcherBuilder headersContains(Map<String, List<String>> headers) {
        Map<String, List<String>> expected = new LinkedHashMap<>(headers);
        assertions.add(request -> {
            HttpHeaders actual = request.headers();
            List<String> errors = new ArrayList<>();
            expected.forEach((name, values) -> {
                if (!actual.contains(name)) {
                    errors.add("expected header key " + name + " to be set");
                } else if (!actual.all(name).equals(values)) {
                    errors.add("expected header key " + name + " to be " + values + " but is " + actual.all(name));
                }
            });
            return errors;
        });
        return this;
    }

    /**
     * Expects a url-encoded form body holding these values. With
     * {@code strict}, keys not listed are reported too.
     *
     * @see Forms#parsePostForm(Request)
     */
    public RequestMatcherBuilder bodyForm(FormValues expected, boolean strict) {
        assertions.add(request -> {
            try {
                Forms.parsePostForm(request);
            } catch (FormDecodeException e) {
                return List.of("unable to parse post form: " + e.getMessage());
            }
            Map<String, List<String>> remaining = new LinkedHashMap<>(request.form().toMap());
            List<String> errors = new ArrayList<>();
            expected.toMap().forEach((key, values) -> {
                List<String> actual = remaining.remove(key);
                if (actual == null) {
                    errors.add("key " + key + " is expected to exist but is not found");
                } else if (!actual.equals(values)) {
                    errors.add("key " + key + " values differ " + values + " " + actual);
                }
            });
            if (strict) {
                remaining.forEach((key, values) ->
                        errors.add("remaining key found in form: " + quote(key) + ": " + values));
            }
            return errors;
        });
        return this;
    }

    /**
     * Expects a JSON body that decodes as {@code type} to a value equal to
     * {@code expected}. With {@code strict}, properties unknown to
     * {@code type} fail the decoding.
     */
    public <T> RequestMatcherBuilder bodyJson(T expected, Class<T> type, boolean strict) {
        ObjectReader reader = strict
                ? JsonCodec.mapper().readerFor(type).with(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                : JsonCodec.mapper().readerFor(type).without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        assertions.add(request -> {
            Object actual;
            try {
                actual = reader.readValue(request.bufferBody());
            } catch (IOException e) {
                return List.of("unable to parse json: " + e.getMessage());
            }
            return Objects.equals(actual, expected)
                    ? List.of()
                    : List.of("json does not match: expected " + expected + " but was " + actual);
        });
        return this;
    }

    @Override
    public List<String> mismatches(Request request) {
        List<String> errors = new ArrayList<>();
        for (Function<Request, List<String>> assertion : assertions) {
            errors.addAll(assertion.apply(request));
        }
        return errors;
    }

    private static String hostOf(URI uri) {
        if (uri.getHost() == null) {
            return "";
        }
        return uri.getPort() >= 0 ? uri.getHost() + ":" + uri.getPort() : uri.getHost();
    }

    private static String quote(String value) {
        return '"' + value + '"';
    }
}
