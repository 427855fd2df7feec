package io.fluenthttp.testkit;

import io.fluenthttp.core.model.Request;
import io.fluenthttp.core.model.Response;

/**
 * One call observed by a {@link DoerSpy}.
 *
 * @param request  the request passed to the wrapped doer
 * @param response the response it returned, {@code null} on failure
 * @param error    the exception it threw, {@code null} on success
 */
public record DoerSpyRecord(Request request, Response response, Exception error) {}
