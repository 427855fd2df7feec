package io.fluenthttp.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

/** Tests for {@link Response}. */
class ResponseTest {

    @Test
    void declaredLengthComesFromContentLengthHeader() {
        Response response = new Response(200, HttpHeaders.of(Map.of("Content-Length", "42")), null);
        assertThat(response.contentLength()).isEqualTo(42);
    }

    @Test
    void missingOrInvalidContentLengthIsUnknown() {
        assertThat(new Response(200, null, null).contentLength()).isEqualTo(Response.UNKNOWN_LENGTH);
        assertThat(new Response(200, HttpHeaders.of(Map.of("Content-Length", "abc")), null).contentLength())
                .isEqualTo(Response.UNKNOWN_LENGTH);
    }

    @Test
    void ofStringDeclaresUtf8ByteLength() throws IOException {
        Response response = Response.ofString(200, "héllo");

        assertThat(response.contentLength()).isEqualTo(6);
        assertThat(response.readBody()).hasSize(6);
    }

    @Test
    void closeReleasesOriginalStreamExactlyOnce() {
        AtomicInteger closes = new AtomicInteger();
        Response response = new Response(200, null, new ByteArrayInputStream(new byte[0]) {
            @Override
            public void close() {
                closes.incrementAndGet();
            }
        });
        response.replaceBody(new ByteArrayInputStream(new byte[] {1}));

        response.close();
        response.close();

        assertThat(closes).hasValue(1);
        assertThat(response.isClosed()).isTrue();
    }

    @Test
    void closeFailureIsNotThrown() {
        Response response = new Response(200, null, new ByteArrayInputStream(new byte[0]) {
            @Override
            public void close() throws IOException {
                throw new IOException("broken pipe");
            }
        });

        response.close();

        assertThat(response.isClosed()).isTrue();
    }

    @Test
    void bindRequestKeepsFirstBinding() {
        Request first = Request.of("GET", "http://h/a");
        Request second = Request.of("GET", "http://h/b");

        Response response = Response.ofString(200, "").bindRequest(first).bindRequest(second);

        assertThat(response.request()).isSameAs(first);
    }
}
