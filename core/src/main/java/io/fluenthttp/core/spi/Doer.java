package io.fluenthttp.core.spi;

import io.fluenthttp.core.model.Request;
import io.fluenthttp.core.model.Response;
import java.io.IOException;

/**
 * Executor SPI: performs one HTTP request and returns its response.
 *
 * <p>
 * The library makes no assumption about pooling, retries, redirects, TLS or
 * timeouts; all of that belongs to the implementation. The JDK-backed
 * implementation is {@link io.fluenthttp.core.doer.JdkHttpDoer}; the testkit
 * module provides spies and stubs.
 *
 * <p>
 * The returned response's body stream is owned by the caller, who must close
 * the response.
 */
@FunctionalInterface
public interface Doer {

    /**
     * Executes the request.
     *
     * @param request the finalized request
     * @return the response; never {@code null}
     * @throws IOException if the request could not be executed
     */
    Response execute(Request request) throws IOException;
}
