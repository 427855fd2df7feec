package io.fluenthttp.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/** Tests for {@link Request}. */
class RequestTest {

    @Test
    void blankMethodDefaultsToGet() {
        assertThat(new Request("", URI.create("http://h/"), null, null).method()).isEqualTo("GET");
        assertThat(new Request(null, URI.create("http://h/"), null, null).method()).isEqualTo("GET");
    }

    @ParameterizedTest
    @ValueSource(strings = {"PO ST", "GET\n", "(GET)", "GÉT"})
    void invalidMethodTokenIsRejected(String method) {
        assertThatThrownBy(() -> new Request(method, URI.create("http://h/"), null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("invalid method");
    }

    @Test
    void customMethodTokenIsAccepted() {
        assertThat(Request.of("PROPFIND", "http://h/").method()).isEqualTo("PROPFIND");
    }

    @Test
    void absentBodyIsEmptyStream() throws Exception {
        assertThat(Request.of("GET", "http://h/").body().readAllBytes()).isEmpty();
    }

    @Test
    void bufferBodyMakesBodyReReadable() throws Exception {
        Request request = new Request(
                "POST",
                URI.create("http://h/"),
                null,
                new ByteArrayInputStream("payload".getBytes(StandardCharsets.UTF_8)));

        byte[] first = request.bufferBody();
        byte[] second = request.bufferBody();

        assertThat(first).isEqualTo(second);
        assertThat(new String(request.body().readAllBytes(), StandardCharsets.UTF_8)).isEqualTo("payload");
    }

    @Test
    void withHeaderReplacesOneHeaderAndSharesBody() throws Exception {
        Request request = new Request(
                "POST",
                URI.create("http://h/"),
                HttpHeaders.of(Map.of("Accept", "text/html", "X-Id", "1")),
                new ByteArrayInputStream(new byte[] {1, 2}));
        request.bufferBody();

        Request copy = request.withHeader("accept", "application/json");

        assertThat(copy.headers().first("accept")).isEqualTo("application/json");
        assertThat(copy.headers().first("x-id")).isEqualTo("1");
        assertThat(copy.bufferBody()).containsExactly(1, 2);
        assertThat(request.headers().first("accept")).isEqualTo("text/html");
    }
}
