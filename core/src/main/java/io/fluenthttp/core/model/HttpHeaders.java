package io.fluenthttp.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable multi-valued headers of a {@link Request} or {@link Response}.
 *
 * <p>
 * Names are stored lowercase (RFC 9110 field names are case-insensitive) and
 * iterate in name order. Values keep the order they were given in. Modifiers
 * return copies.
 */
public final class HttpHeaders {

    private static final HttpHeaders EMPTY = new HttpHeaders(new TreeMap<>());

    /** Internal storage: lowercase keys, values are non-empty unmodifiable lists. */
    private final TreeMap<String, List<String>> store;

    private HttpHeaders(TreeMap<String, List<String>> store) {
        this.store = store;
    }

    /** First value of {@code name}, or {@code null} when it is not set. */
    public String first(String name) {
        List<String> values = store.get(normalize(name));
        return values == null ? null : values.get(0);
    }

    /** Every value of {@code name} in order; empty when it is not set. */
    public List<String> all(String name) {
        List<String> values = store.get(normalize(name));
        return values != null ? values : List.of();
    }

    /** Whether {@code name} has at least one value. */
    public boolean contains(String name) {
        return store.containsKey(normalize(name));
    }

    public boolean isEmpty() {
        return store.isEmpty();
    }

    /** Read-only name → values view, sorted by name. */
    public Map<String, List<String>> toMultiValueMap() {
        return Collections.unmodifiableMap(store);
    }

    /**
     * Returns a copy in which {@code name} holds exactly {@code values}. An
     * empty list removes the header.
     */
    public HttpHeaders with(String name, List<String> values) {
        TreeMap<String, List<String>> copy = new TreeMap<>(store);
        if (values == null || values.isEmpty()) {
            copy.remove(normalize(name));
        } else {
            copy.put(normalize(name), List.copyOf(values));
        }
        return new HttpHeaders(copy);
    }

    /** Returns a copy in which {@code values} are appended to those of {@code name}. */
    public HttpHeaders withAdded(String name, List<String> values) {
        List<String> merged = new ArrayList<>(all(name));
        merged.addAll(values);
        return with(name, merged);
    }

    // ── Factories ──

    /** One value per name. */
    public static HttpHeaders of(Map<String, String> singleValue) {
        if (singleValue == null || singleValue.isEmpty()) {
            return EMPTY;
        }
        TreeMap<String, List<String>> map = new TreeMap<>();
        singleValue.forEach((key, value) -> map.put(normalize(key), List.of(value)));
        return new HttpHeaders(map);
    }

    /**
     * Several values per name. Names differing only in case are merged in
     * iteration order; names without values are dropped.
     */
    public static HttpHeaders ofMulti(Map<String, List<String>> multiValue) {
        if (multiValue == null || multiValue.isEmpty()) {
            return EMPTY;
        }
        TreeMap<String, List<String>> map = new TreeMap<>();
        multiValue.forEach((key, values) -> {
            if (values == null || values.isEmpty()) {
                return;
            }
            map.merge(normalize(key), List.copyOf(values), (left, right) -> {
                List<String> merged = new ArrayList<>(left);
                merged.addAll(right);
                return List.copyOf(merged);
            });
        });
        return new HttpHeaders(map);
    }

    public static HttpHeaders empty() {
        return EMPTY;
    }

    /** Lowercases a header name; the canonical key form used throughout the library. */
    public static String normalize(String name) {
        Objects.requireNonNull(name, "header name must not be null");
        return name.toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof HttpHeaders && store.equals(((HttpHeaders) o).store);
    }

    @Override
    public int hashCode() {
        return store.hashCode();
    }

    @Override
    public String toString() {
        return "headers" + store.keySet();
    }
}
