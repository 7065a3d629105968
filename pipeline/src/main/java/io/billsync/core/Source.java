package io.billsync.core;

import java.io.Closeable;
import java.io.IOException;
import java.util.Optional;

/**
 * A finite producer of records, polled until {@link #isFinished()} reports true.
 */
public interface Source<T> extends Closeable {
    /**
     * Next record, or empty once the source is exhausted.
     */
    Optional<Record<T>> poll() throws IOException;

    boolean isFinished();

    @Override
    default void close() throws IOException {}
}
