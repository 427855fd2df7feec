package io.fluenthttp.core;

import io.fluenthttp.core.engine.JsonCodec;

/** Turns a request body object into bytes at finalize time. */
@FunctionalInterface
public interface BodySerializer {

    /** Serializer backed by the shared Jackson mapper. */
    BodySerializer JSON = JsonCodec::encode;

    byte[] serialize(Object body) throws Exception;
}
