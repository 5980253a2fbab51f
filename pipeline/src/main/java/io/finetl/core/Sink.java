package io.finetl.core;

import java.io.Closeable;

/**
 * Sink consumes records handed over by a processor. It may buffer internally but must not block indefinitely.
 */
public interface Sink<T> extends Closeable {
    void accept(Record<T> record) throws Exception;

    @Override
    default void close() {}
}
