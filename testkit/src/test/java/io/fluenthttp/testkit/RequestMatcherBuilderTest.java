package io.fluenthttp.testkit;

import static org.assertj.core.api.Assertions.assertThat;

import io.fluenthttp.core.model.FormValues;
import io.fluenthttp.core.model.HttpHeaders;
import io.fluenthttp.core.model.Request;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link RequestMatcherBuilder}. */
@DisplayName("RequestMatcherBuilder — request expectations")
class RequestMatcherBuilderTest {

    public record Greeting(String name, int count) {}

    private static Request request(String method, String uri, Map<String, List<String>> headers, String body) {
        return new Request(
                method,
                URI.create(uri),
                HttpHeaders.ofMulti(headers),
                new ByteArrayInputStream(body.getBytes(StandardCharsets.UTF_8)));
    }

    private static Request formRequest(String method, String body) {
        return request(method, "http://h/", Map.of("Content-Type", List.of("application/x-www-form-urlencoded")), body);
    }

    @Test
    @DisplayName("No expectations → every request matches")
    void emptyMatcherMatches() {
        assertThat(new RequestMatcherBuilder().matches(Request.of("GET", "http://h/"))).isTrue();
    }

    @Nested
    @DisplayName("URL and method")
    class UrlAndMethod {

        private final Request request = Request.of("POST", "http://api.local:8080/users/42?tag=a&tag=b&page=1");

        @Test
        @DisplayName("Matching method, host, path and query → no mismatches")
        void allMatch() {
            RequestMatcher matcher = new RequestMatcherBuilder()
                    .method("POST")
                    .urlHost("api.local:8080")
                    .urlPath("/users/42")
                    .urlQueryParamsContains(FormValues.of("tag", "a", "b"));

            assertThat(matcher.mismatches(request)).isEmpty();
        }

        @Test
        @DisplayName("Every failed expectation is reported")
        void allMismatchesReported() {
            RequestMatcher matcher = new RequestMatcherBuilder()
                    .method("GET")
                    .urlHost("api.local")
                    .urlPath("/users/43");

            assertThat(matcher.mismatches(request))
                    .containsExactly(
                            "request method \"POST\" != \"GET\"",
                            "request url host \"api.local:8080\" != \"api.local\"",
                            "request url path \"/users/42\" != \"/users/43\"");
        }

        @Test
        @DisplayName("Query expectations report missing keys and differing values")
        void queryMismatches() {
            Map<String, List<String>> expected = new LinkedHashMap<>();
            expected.put("tag", List.of("b", "a"));
            expected.put("missing", List.of("x"));

            assertThat(new RequestMatcherBuilder()
                            .urlQueryParamsContains(FormValues.of(expected))
                            .mismatches(request))
                    .containsExactlyInAnyOrder(
                            "expected url query param key missing to be set",
                            "expected url query param key tag to be [b, a] but is [a, b]");
        }
    }

    @Nested
    @DisplayName("Headers")
    class Headers {

        @Test
        @DisplayName("Header names are case-insensitive; values must match in order")
        void headersContains() {
            Request request = request("GET", "http://h/", Map.of("X-Trace", List.of("1", "2"), "Accept", List.of("*/*")), "");

            assertThat(new RequestMatcherBuilder()
                            .headersContains(Map.of("x-trace", List.of("1", "2")))
                            .matches(request))
                    .isTrue();
            assertThat(new RequestMatcherBuilder()
                            .headersContains(Map.of("X-TRACE", List.of("2", "1")))
                            .mismatches(request))
                    .containsExactly("expected header key X-TRACE to be [2, 1] but is [1, 2]");
            assertThat(new RequestMatcherBuilder()
                            .headersContains(Map.of("authorization", List.of("x")))
                            .mismatches(request))
                    .containsExactly("expected header key authorization to be set");
        }
    }

    @Nested
    @DisplayName("Form body")
    class FormBody {

        @Test
        @DisplayName("Lenient form match allows extra keys")
        void lenientForm() {
            Request request = formRequest("POST", "user=ada&extra=1");

            assertThat(new RequestMatcherBuilder()
                            .bodyForm(FormValues.of("user", "ada"), false)
                            .matches(request))
                    .isTrue();
        }

        @Test
        @DisplayName("Strict form match reports extra keys")
        void strictForm() {
            Request request = formRequest("POST", "user=ada&extra=1");

            assertThat(new RequestMatcherBuilder()
                            .bodyForm(FormValues.of("user", "ada"), true)
                            .mismatches(request))
                    .containsExactly("remaining key found in form: \"extra\": [1]");
        }

        @Test
        @DisplayName("Missing and differing keys are reported")
        void formMismatches() {
            Map<String, List<String>> expected = new LinkedHashMap<>();
            expected.put("user", List.of("bob"));
            expected.put("role", List.of("admin"));

            assertThat(new RequestMatcherBuilder()
                            .bodyForm(FormValues.of(expected), false)
                            .mismatches(formRequest("PUT", "user=ada")))
                    .containsExactlyInAnyOrder(
                            "key role is expected to exist but is not found", "key user values differ [bob] [ada]");
        }

        @Test
        @DisplayName("Form on a DELETE body is parsed too")
        void deleteForm() {
            Request request = request("DELETE", "http://h/", Map.of(), "id=7");

            assertThat(new RequestMatcherBuilder().bodyForm(FormValues.of("id", "7"), true).matches(request))
                    .isTrue();
        }

        @Test
        @DisplayName("Unparsable form → mismatch, not exception")
        void unparsableForm() {
            assertThat(new RequestMatcherBuilder()
                            .bodyForm(FormValues.empty(), false)
                            .mismatches(request("DELETE", "http://h/", Map.of(), "id=%zz")))
                    .singleElement()
                    .asString()
                    .startsWith("unable to parse post form: ");
        }
    }

    @Nested
    @DisplayName("JSON body")
    class JsonBody {

        @Test
        @DisplayName("Equal JSON value → match, body still readable")
        void jsonMatches() throws IOException {
            Request request = request("POST", "http://h/", Map.of(), "{\"name\":\"ada\",\"count\":2}");

            boolean matches = new RequestMatcherBuilder()
                    .bodyJson(new Greeting("ada", 2), Greeting.class, true)
                    .matches(request);

            assertThat(matches).isTrue();
            assertThat(new String(request.body().readAllBytes(), StandardCharsets.UTF_8)).contains("ada");
        }

        @Test
        @DisplayName("Different value → json does not match")
        void jsonDiffers() {
            Request request = request("POST", "http://h/", Map.of(), "{\"name\":\"bob\",\"count\":2}");

            assertThat(new RequestMatcherBuilder()
                            .bodyJson(new Greeting("ada", 2), Greeting.class, false)
                            .mismatches(request))
                    .singleElement()
                    .asString()
                    .startsWith("json does not match: ");
        }

        @Test
        @DisplayName("Unknown property fails only in strict mode")
        void unknownProperty() {
            String body = "{\"name\":\"ada\",\"count\":2,\"extra\":true}";

            assertThat(new RequestMatcherBuilder()
                            .bodyJson(new Greeting("ada", 2), Greeting.class, false)
                            .matches(request("POST", "http://h/", Map.of(), body)))
                    .isTrue();
            assertThat(new RequestMatcherBuilder()
                            .bodyJson(new Greeting("ada", 2), Greeting.class, true)
                            .mismatches(request("POST", "http://h/", Map.of(), body)))
                    .singleElement()
                    .asString()
                    .startsWith("unable to parse json: ");
        }
    }
}
