package io.fluenthttp.testkit;

import io.fluenthttp.core.model.Request;
import java.util.List;

/** Expectations on a request. */
@FunctionalInterface
public interface RequestMatcher {

    /**
     * Checks the request.
     *
     * @return a description of every failed expectation; empty when the
     *         request matches
     */
    List<String> mismatches(Request request);

    default boolean matches(Request request) {
        return mismatches(request).isEmpty();
    }
}
