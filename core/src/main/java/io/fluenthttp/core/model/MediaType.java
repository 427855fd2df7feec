package io.fluenthttp.core.model;

import java.util.Locale;

/**
 * Content types the library writes on request bodies and recognizes when
 * decoding them.
 */
public enum MediaType {
    JSON("application/json", null),
    FORM("application/x-www-form-urlencoded", null),
    TEXT("text/plain", "utf-8"),
    BINARY("application/octet-stream", null);

    private final String essence;
    private final String charset;

    MediaType(String essence, String charset) {
        this.essence = essence;
        this.charset = charset;
    }

    /** The bare {@code type/subtype}. */
    public String value() {
        return essence;
    }

    /** The value written in a {@code content-type} header, charset included where one applies. */
    public String headerValue() {
        return charset == null ? essence : essence + "; charset=" + charset;
    }

    /**
     * Whether a {@code content-type} header value denotes this type. Parameters
     * and case are ignored; {@link #JSON} also accepts {@code +json} suffixes.
     * A {@code null} header matches nothing.
     */
    public boolean matches(String contentType) {
        String actual = essenceOf(contentType);
        if (actual.isEmpty()) {
            return false;
        }
        return actual.equals(essence) || (this == JSON && actual.endsWith("+json"));
    }

    private static String essenceOf(String contentType) {
        if (contentType == null) {
            return "";
        }
        int end = contentType.indexOf(';');
        String type = end < 0 ? contentType : contentType.substring(0, end);
        return type.strip().toLowerCase(Locale.ROOT);
    }
}
