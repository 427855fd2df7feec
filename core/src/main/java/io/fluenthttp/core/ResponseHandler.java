package io.fluenthttp.core;

import io.fluenthttp.core.model.Response;

/**
 * Handles a response for one status code. Returning normally means success.
 *
 * <p>
 * Unchecked exceptions propagate out of {@link ResponseBuilder#resolve()}
 * unchanged; checked exceptions are wrapped in a
 * {@link io.fluenthttp.core.error.ResponseHandlerException}.
 */
@FunctionalInterface
public interface ResponseHandler {

    void handle(Response response) throws Exception;
}
