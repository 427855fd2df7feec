package io.fluenthttp.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Shared Jackson mapper for request serialization and response decoding.
 *
 * <p>
 * Unknown properties are ignored when decoding. Thread-safe: the mapper is
 * configured once and only read afterwards.
 */
public final class JsonCodec {

    private static final ObjectMapper MAPPER =
            new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private JsonCodec() {
        // utility class
    }

    /** The shared mapper. Callers must not reconfigure it. */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /** Serializes a value to JSON bytes (UTF-8). */
    public static byte[] encode(Object value) throws JsonProcessingException {
        return MAPPER.writeValueAsBytes(value);
    }
}
