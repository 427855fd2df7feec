package io.fluenthttp.testkit;

import io.fluenthttp.core.model.Response;
import java.io.IOException;

/**
 * One pre-configured answer of a {@link DoerStub}.
 *
 * @param matcher  requests this answer applies to; {@code null} matches any
 *                 request
 * @param response the response to return
 * @param error    the exception to throw instead, or {@code null}
 */
public record DoerStubCall(RequestMatcher matcher, Response response, IOException error) {

    /** Answers any request with {@code response}. */
    public static DoerStubCall respond(Response response) {
        return new DoerStubCall(null, response, null);
    }

    /** Answers requests accepted by {@code matcher} with {@code response}. */
    public static DoerStubCall respond(RequestMatcher matcher, Response response) {
        return new DoerStubCall(matcher, response, null);
    }

    /** Fails requests accepted by {@code matcher} (any request when {@code null}) with {@code error}. */
    public static DoerStubCall fail(RequestMatcher matcher, IOException error) {
        return new DoerStubCall(matcher, null, error);
    }
}
