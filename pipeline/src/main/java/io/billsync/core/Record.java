package io.billsync.core;

/**
 * Payload wrapper carrying its position in a run. seq orders records across a source;
 * subSeq orders records fanned out from the same input (e.g. rows of one ledger file).
 */
public record Record<T>(long seq, int subSeq, T payload) implements Comparable<Record<?>> {

    public static <T> Record<T> of(long seq, T payload) {
        return new Record<>(seq, 0, payload);
    }

    /** Same position, different payload. Stages use this to keep ordering intact. */
    public <R> Record<R> withPayload(R next) {
        return new Record<>(seq, subSeq, next);
    }

    @Override
    public int compareTo(Record<?> o) {
        int c = Long.compare(seq, o.seq);
        if (c != 0) return c;
        return Integer.compare(subSeq, o.subSeq);
    }
}
