package io.fluenthttp.testkit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.sun.net.httpserver.HttpExchange;
import io.fluenthttp.core.engine.JsonCodec;
import io.fluenthttp.core.model.MediaType;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Writes the response of an {@link HttpTestServer} exchange: status line,
 * headers and body. The server closes the exchange afterwards.
 */
@FunctionalInterface
public interface ResponseWriter {

    void write(HttpExchange exchange) throws IOException;

    /** Status only, empty body. */
    static ResponseWriter status(int status) {
        return exchange -> exchange.sendResponseHeaders(status, -1);
    }

    /** Status and a body with the given content type. */
    static ResponseWriter body(int status, String contentType, byte[] body) {
        byte[] copy = body.clone();
        return exchange -> {
            exchange.getResponseHeaders().set("Content-Type", contentType);
            exchange.sendResponseHeaders(status, copy.length == 0 ? -1 : copy.length);
            if (copy.length > 0) {
                try (OutputStream out = exchange.getResponseBody()) {
                    out.write(copy);
                }
            }
        };
    }

    /** Status and a UTF-8 text body. */
    static ResponseWriter text(int status, String text) {
        return body(status, MediaType.TEXT.headerValue(), text.getBytes(StandardCharsets.UTF_8));
    }

    /** Status and {@code value} serialized as JSON. */
    static ResponseWriter json(int status, Object value) {
        byte[] encoded;
        try {
            encoded = JsonCodec.encode(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("value is not serializable to JSON: " + e.getMessage(), e);
        }
        return body(status, MediaType.JSON.value(), encoded);
    }
}
