package io.fluenthttp.core;

import io.fluenthttp.core.model.Request;

/**
 * Last step of request finalization: receives the constructed request and
 * returns the one to send, e.g. a signed copy.
 */
@FunctionalInterface
public interface RequestOverride {

    Request apply(Request request) throws Exception;
}
