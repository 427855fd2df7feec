package io.fluenthttp.testkit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.core.type.TypeReference;
import io.fluenthttp.core.Api;
import io.fluenthttp.core.model.FormValues;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for {@link HttpTestServer} driving real requests through {@link Api}. */
@DisplayName("HttpTestServer — end-to-end request assertions")
class HttpTestServerTest {

    /** Posts a form to /login and hands the response body to the check. */
    private final HttpTestServer<Consumer<String>> loginServer = new HttpTestServer<>((address, doer, check) -> {
        Api api = new Api(doer, address);
        AtomicReference<String> body = new AtomicReference<>();
        api.execute(api.post("/login")
                        .setHeader("X-Client", "tests")
                        .sendForm(FormValues.of("user", "ada")))
                .onStatus(200, response -> body.set(new String(response.readBody(), StandardCharsets.UTF_8)))
                .resolve();
        if (check != null) {
            check.accept(body.get());
        }
    });

    private static RequestMatcher loginExpectations() {
        return new RequestMatcherBuilder()
                .method("POST")
                .urlPath("/login")
                .headersContains(Map.of("x-client", List.of("tests")))
                .bodyForm(FormValues.of("user", "ada"), true);
    }

    @Test
    @DisplayName("Matching request → scripted response reaches the code under test")
    void matchingRequest() {
        AtomicReference<String> seen = new AtomicReference<>();

        loginServer.assertRequest(loginExpectations(), ResponseWriter.text(200, "welcome"), seen::set);

        assertThat(seen.get()).isEqualTo("welcome");
    }

    @Test
    @DisplayName("Mismatching request → AssertionError listing the mismatches")
    void mismatchingRequest() {
        RequestMatcher expectations = new RequestMatcherBuilder().method("PUT").urlPath("/signin");

        assertThatThrownBy(() -> loginServer.assertRequest(expectations, ResponseWriter.status(200)))
                .isInstanceOf(AssertionError.class)
                .hasMessageContaining("request does not match")
                .hasMessageContaining("request method \"POST\" != \"PUT\"")
                .hasMessageContaining("request url path \"/login\" != \"/signin\"");
    }

    @Test
    @DisplayName("Failing code under test → AssertionError with the failure as cause")
    void failingInteraction() {
        assertThatThrownBy(() -> loginServer.assertRequest(loginExpectations(), ResponseWriter.status(503)))
                .isInstanceOf(AssertionError.class)
                .hasMessageStartingWith("doer execution failed: request POST")
                .hasMessageContaining("failed with status 503");
    }

    @Test
    @DisplayName("Failing response writer → AssertionError")
    void failingWriter() {
        ResponseWriter broken = exchange -> {
            throw new IOException("disk full");
        };

        assertThatThrownBy(() -> loginServer.assertRequest(loginExpectations(), broken))
                .isInstanceOf(AssertionError.class)
                .hasMessage("unable to write response: disk full");
    }

    @Test
    @DisplayName("Code under test sending nothing → AssertionError")
    void noRequest() {
        HttpTestServer<Void> silent = new HttpTestServer<>((address, doer, check) -> {});

        assertThatThrownBy(() -> silent.assertRequest(new RequestMatcherBuilder(), ResponseWriter.status(200)))
                .isInstanceOf(AssertionError.class)
                .hasMessage("test server received no request");
    }

    @Test
    @DisplayName("JSON response writer serializes the value")
    void jsonWriter() {
        AtomicReference<Map<String, Object>> seen = new AtomicReference<>();
        HttpTestServer<Void> server = new HttpTestServer<>((address, doer, check) -> {
            Api api = new Api(doer, address);
            api.execute(api.get("/me"))
                    .receiveJson(200, new TypeReference<Map<String, Object>>() {}, seen::set)
                    .resolve();
        });

        server.assertRequest(new RequestMatcherBuilder().method("GET"), ResponseWriter.json(200, Map.of("id", 1)));

        assertThat(seen.get()).containsEntry("id", 1);
    }
}
