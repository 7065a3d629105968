package io.billsync.ledger;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Run-scoped identifier ({@code yyMMdd_HHmmss}) plus the instant it was taken from, which the
 * run-marker row records as its timestamp.
 */
public record BatchNumber(String value, Instant startedAt) {
    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyMMdd_HHmmss");

    public static BatchNumber at(Clock clock) {
        Instant now = clock.instant();
        return new BatchNumber(LocalDateTime.ofInstant(now, clock.getZone()).format(FORMAT), now);
    }

    public long startedAtMillis() { return startedAt.toEpochMilli(); }

    @Override
    public String toString() { return value; }
}
