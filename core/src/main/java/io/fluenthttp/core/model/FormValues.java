package io.fluenthttp.core.model;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable multi-valued map of url-encoded form or query values.
 *
 * <p>
 * Keys are kept sorted so that {@link #encode()} is deterministic; values keep
 * their insertion order.
 */
public final class FormValues {

    private static final FormValues EMPTY = new FormValues(new TreeMap<>());

    private final TreeMap<String, List<String>> values;

    private FormValues(TreeMap<String, List<String>> values) {
        this.values = values;
    }

    /** Returns an empty instance. */
    public static FormValues empty() {
        return EMPTY;
    }

    /** Creates form values from a multi-value map. Empty value lists are kept as present keys. */
    public static FormValues of(Map<String, List<String>> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        TreeMap<String, List<String>> copy = new TreeMap<>();
        values.forEach((key, list) -> copy.put(key, List.copyOf(list)));
        return new FormValues(copy);
    }

    /** Creates form values holding a single key. */
    public static FormValues of(String key, String... values) {
        return of(Map.of(key, List.of(values)));
    }

    /**
     * Parses an {@code application/x-www-form-urlencoded} string. Empty
     * segments are skipped; a segment without {@code '='} yields an empty value.
     *
     * @throws IllegalArgumentException if a segment holds a malformed escape
     *                                  sequence
     */
    public static FormValues parse(String encoded) {
        if (encoded == null || encoded.isEmpty()) {
            return EMPTY;
        }
        TreeMap<String, List<String>> parsed = new TreeMap<>();
        for (String segment : encoded.split("&")) {
            if (segment.isEmpty()) {
                continue;
            }
            int eq = segment.indexOf('=');
            String key = eq >= 0 ? segment.substring(0, eq) : segment;
            String value = eq >= 0 ? segment.substring(eq + 1) : "";
            parsed.computeIfAbsent(decode(key), k -> new ArrayList<>()).add(decode(value));
        }
        TreeMap<String, List<String>> frozen = new TreeMap<>();
        parsed.forEach((key, list) -> frozen.put(key, List.copyOf(list)));
        return new FormValues(frozen);
    }

    /** First value for a key, or {@code null}. */
    public String first(String key) {
        List<String> list = values.get(key);
        return list != null && !list.isEmpty() ? list.get(0) : null;
    }

    /** All values for a key; empty when absent. */
    public List<String> all(String key) {
        return values.getOrDefault(key, List.of());
    }

    /** True if the key is present, even with no values. */
    public boolean contains(String key) {
        return values.containsKey(key);
    }

    /** Sorted key set. */
    public Set<String> keys() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /** Unmodifiable, key-sorted view. */
    public Map<String, List<String>> toMap() {
        return Collections.unmodifiableMap(values);
    }

    /** Returns a copy with {@code key} replaced by {@code newValues}. */
    public FormValues with(String key, List<String> newValues) {
        TreeMap<String, List<String>> copy = new TreeMap<>(values);
        copy.put(key, List.copyOf(newValues));
        return new FormValues(copy);
    }

    /** Returns a copy with {@code extraValues} appended to {@code key}. */
    public FormValues withAdded(String key, List<String> extraValues) {
        List<String> merged = new ArrayList<>(all(key));
        merged.addAll(extraValues);
        return with(key, merged);
    }

    /**
     * Encodes as {@code application/x-www-form-urlencoded}, keys sorted, UTF-8.
     * An empty instance encodes to the empty string.
     */
    public String encode() {
        StringBuilder out = new StringBuilder();
        values.forEach((key, list) -> {
            String encodedKey = URLEncoder.encode(key, StandardCharsets.UTF_8);
            for (String value : list) {
                if (out.length() > 0) {
                    out.append('&');
                }
                out.append(encodedKey).append('=').append(URLEncoder.encode(value, StandardCharsets.UTF_8));
            }
        });
        return out.toString();
    }

    private static String decode(String component) {
        return URLDecoder.decode(component, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FormValues that)) return false;
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "FormValues" + values;
    }
}
