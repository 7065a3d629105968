package io.billsync.core;

import java.util.List;

/** Sink that can hand a whole group of records to its target in one call. */
public interface BatchSink<T> extends Sink<T> {
    void acceptBatch(List<Record<T>> records) throws Exception;
}
