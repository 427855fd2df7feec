package io.fluenthttp.core.doer;

import io.fluenthttp.core.model.Request;
import io.fluenthttp.core.model.Response;
import io.fluenthttp.core.spi.Doer;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * {@link Doer} decorator that captures every exchange as a pair of base64
 * dumps: the request (request line, headers, body) and the response (status
 * line, headers, body).
 *
 * <p>
 * Bodies are buffered so the caller can still read them. When the wrapped
 * doer fails, the response dump is empty and the failure is rethrown after the
 * sink ran. A dump that cannot be produced contains
 * {@code "unable to dump request: ..."} (or {@code response}) instead.
 */
public final class DumpingDoer implements Doer {

    private final Doer delegate;
    private final BiConsumer<String, String> sink;

    /**
     * @param delegate the doer performing the requests
     * @param sink     receives {@code (requestBase64, responseBase64)}; {@code null}
     *                 discards the dumps
     */
    public DumpingDoer(Doer delegate, BiConsumer<String, String> sink) {
        this.delegate = delegate;
        this.sink = sink != null ? sink : (request, response) -> {};
    }

    @Override
    public Response execute(Request request) throws IOException {
        String requestDump = dumpRequest(request);
        Response response = null;
        try {
            response = delegate.execute(request);
            return response;
        } finally {
            sink.accept(requestDump, response != null ? dumpResponse(response) : "");
        }
    }

    private static String dumpRequest(Request request) {
        if (request == null) {
            return "";
        }
        byte[] out;
        try {
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            URI uri = request.uri();
            String target = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
            if (uri.getRawQuery() != null) {
                target += "?" + uri.getRawQuery();
            }
            buffer.writeBytes((request.method() + " " + target + " HTTP/1.1\r\n").getBytes(StandardCharsets.UTF_8));
            if (uri.getHost() != null) {
                String host = uri.getPort() >= 0 ? uri.getHost() + ":" + uri.getPort() : uri.getHost();
                buffer.writeBytes(("host: " + host + "\r\n").getBytes(StandardCharsets.UTF_8));
            }
            writeHeaders(buffer, request.headers().toMultiValueMap());
            buffer.writeBytes(request.bufferBody());
            out = buffer.toByteArray();
        } catch (IOException e) {
            out = ("unable to dump request: " + e.getMessage()).getBytes(StandardCharsets.UTF_8);
        }
        return Base64.getEncoder().encodeToString(out);
    }

    private static String dumpResponse(Response response) {
        byte[] out;
        try {
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            buffer.writeBytes(("HTTP/1.1 " + response.statusCode() + "\r\n").getBytes(StandardCharsets.UTF_8));
            writeHeaders(buffer, response.headers().toMultiValueMap());
            byte[] body = response.readBody();
            response.replaceBody(new ByteArrayInputStream(body));
            buffer.writeBytes(body);
            out = buffer.toByteArray();
        } catch (IOException e) {
            out = ("unable to dump response: " + e.getMessage()).getBytes(StandardCharsets.UTF_8);
        }
        return Base64.getEncoder().encodeToString(out);
    }

    private static void writeHeaders(ByteArrayOutputStream buffer, Map<String, List<String>> headers) {
        headers.forEach((name, values) -> {
            for (String value : values) {
                buffer.writeBytes((name + ": " + value + "\r\n").getBytes(StandardCharsets.UTF_8));
            }
        });
        buffer.writeBytes("\r\n".getBytes(StandardCharsets.UTF_8));
    }
}
