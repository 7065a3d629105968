package io.billsync.ledger;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

class BatchNumberTest {
    @Test
    void formatsWallClockTimeOfRunStart() {
        Instant start = Instant.parse("2024-03-05T01:02:03.456Z");
        BatchNumber b = BatchNumber.at(Clock.fixed(start, ZoneId.of("Asia/Shanghai")));

        assertEquals("240305_090203", b.value());
        assertEquals("240305_090203", b.toString());
        assertEquals(start.toEpochMilli(), b.startedAtMillis());
    }
}
