package io.fluenthttp.testkit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.fluenthttp.core.model.Request;
import io.fluenthttp.core.model.Response;
import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link DoerStub}. */
@DisplayName("DoerStub — scripted answers")
class DoerStubTest {

    private static final Response FIRST = Response.ofString(200, "first");
    private static final Response SECOND = Response.ofString(201, "second");

    private static RequestMatcher path(String path) {
        return new RequestMatcherBuilder().urlPath(path);
    }

    @Nested
    @DisplayName("Strict order")
    class StrictOrder {

        @Test
        @DisplayName("Calls are consumed in configuration order")
        void consumedInOrder() throws IOException {
            DoerStub stub = new DoerStub(
                    List.of(DoerStubCall.respond(path("/a"), FIRST), DoerStubCall.respond(path("/b"), SECOND)), true);

            assertThat(stub.execute(Request.of("GET", "http://h/a"))).isSameAs(FIRST);
            assertThat(stub.execute(Request.of("GET", "http://h/b"))).isSameAs(SECOND);
            assertThat(stub.remainingCalls()).isEmpty();
        }

        @Test
        @DisplayName("Out-of-order request → IOException, nothing consumed")
        void mismatchFails() {
            DoerStub stub = new DoerStub(
                    List.of(DoerStubCall.respond(path("/a"), FIRST), DoerStubCall.respond(path("/b"), SECOND)), true);

            assertThatThrownBy(() -> stub.execute(Request.of("GET", "http://h/b")))
                    .isInstanceOf(IOException.class)
                    .hasMessage("request does not match: request url path \"/b\" != \"/a\"");
            assertThat(stub.remainingCalls()).hasSize(2);
        }

        @Test
        @DisplayName("Call without matcher accepts any request")
        void matcherLessCall() throws IOException {
            DoerStub stub = new DoerStub(List.of(DoerStubCall.respond(FIRST)), true);

            assertThat(stub.execute(Request.of("DELETE", "http://h/anything"))).isSameAs(FIRST);
        }
    }

    @Nested
    @DisplayName("Flexible order")
    class FlexibleOrder {

        @Test
        @DisplayName("First matching call is consumed, others are skipped")
        void firstMatchConsumed() throws IOException {
            DoerStub stub = new DoerStub(
                    List.of(DoerStubCall.respond(path("/a"), FIRST), DoerStubCall.respond(path("/b"), SECOND)), false);

            assertThat(stub.execute(Request.of("GET", "http://h/b"))).isSameAs(SECOND);
            assertThat(stub.remainingCalls()).extracting(DoerStubCall::response).containsExactly(FIRST);
        }

        @Test
        @DisplayName("No matching call → not configured")
        void noMatch() {
            DoerStub stub = new DoerStub(List.of(DoerStubCall.respond(path("/a"), FIRST)), false);

            assertThatThrownBy(() -> stub.execute(Request.of("GET", "http://h/z")))
                    .isInstanceOf(IOException.class)
                    .hasMessage("http doer not configured for this call");
        }
    }

    @Test
    @DisplayName("Exhausted stub → not configured")
    void exhausted() throws IOException {
        DoerStub stub = new DoerStub(List.of(DoerStubCall.respond(FIRST)), true);
        stub.execute(Request.of("GET", "http://h/"));

        assertThatThrownBy(() -> stub.execute(Request.of("GET", "http://h/")))
                .isInstanceOf(IOException.class)
                .hasMessage("http doer not configured for this call");
    }

    @Test
    @DisplayName("Configured error is thrown and the call consumed")
    void configuredError() {
        IOException failure = new IOException("timeout");
        DoerStub stub = new DoerStub(List.of(DoerStubCall.fail(null, failure)), true);

        assertThatThrownBy(() -> stub.execute(Request.of("GET", "http://h/"))).isSameAs(failure);
        assertThat(stub.remainingCalls()).isEmpty();
    }

    @Test
    @DisplayName("remainingCalls returns an unmodifiable snapshot")
    void remainingCallsSnapshot() {
        DoerStub stub = new DoerStub(List.of(DoerStubCall.respond(FIRST)), true);

        List<DoerStubCall> remaining = stub.remainingCalls();

        assertThatThrownBy(remaining::clear).isInstanceOf(UnsupportedOperationException.class);
        assertThat(stub.remainingCalls()).hasSize(1);
    }
}
