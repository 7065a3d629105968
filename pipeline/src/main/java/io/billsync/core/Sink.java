package io.billsync.core;

import java.io.Closeable;

/**
 * Consumes records one at a time.
 */
public interface Sink<T> extends Closeable {
    void accept(Record<T> record) throws Exception;

    @Override
    default void close() {}
}
