package io.billsync.ledger;

import io.billsync.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Recovers transaction rows from an Alipay CSV export.
 * <p>
 * The export has free-form preamble and footer lines and no usable header marker, so a line is
 * treated as a transaction only when it starts with the 8-digit transaction number. Columns are
 * split on bare commas (the provider never quotes) and read by position.
 */
public class LedgerExtractor {
    private static final Logger log = LoggerFactory.getLogger(LedgerExtractor.class);

    public static final String SOURCE = "alipay";
    static final int MIN_COLUMNS = 11;

    static final int COL_UNIQUE_ID = 0;
    static final int COL_OCCURRED_AT = 3;
    static final int COL_MEMO = 8;
    static final int COL_AMOUNT = 9;
    static final int COL_KIND = 10;

    private static final Pattern ROW_PREFIX = Pattern.compile("^[0-9]{8}");

    private final LedgerDecoder decoder;
    private final Metrics metrics;

    public LedgerExtractor() { this(new LedgerDecoder(), Metrics.detached()); }

    public LedgerExtractor(LedgerDecoder decoder, Metrics metrics) {
        this.decoder = decoder;
        this.metrics = metrics;
    }

    /**
     * @throws LedgerDecodeException if the stream cannot be read
     */
    public List<LedgerRow> extract(InputStream in, String batchNumber) {
        DecodedText decoded = decoder.decode(in);
        switch (decoded.branch()) {
            case FAILED -> throw new LedgerDecodeException("ledger bytes could not be decoded", decoded.failure());
            case LOSSY -> {
                metrics.inc("ledger.decode.lossy");
                log.warn("Ledger is not valid {}; decoded as UTF-8 with invalid bytes dropped", LedgerDecoder.LEGACY.name());
            }
            case STRICT -> metrics.inc("ledger.decode.strict");
        }
        return extract(decoded.text(), batchNumber);
    }

    public List<LedgerRow> extract(String text, String batchNumber) {
        List<LedgerRow> rows = new ArrayList<>();
        for (String line : text.split("\n")) {
            String trimmed = stripBom(line).strip();
            if (trimmed.isEmpty()) continue;
            metrics.inc("ledger.lines.read");
            parseLine(trimmed, batchNumber).ifPresent(rows::add);
        }
        metrics.inc("ledger.rows.kept", rows.size());
        log.debug("Extracted {} rows for batch {}", rows.size(), batchNumber);
        return rows;
    }

    Optional<LedgerRow> parseLine(String line, String batchNumber) {
        if (!ROW_PREFIX.matcher(line).find()) {
            metrics.inc("ledger.lines.skipped");
            return Optional.empty();
        }
        String[] cols = line.split(",", -1);
        if (cols.length < MIN_COLUMNS) {
            metrics.inc("ledger.lines.short");
            log.debug("Dropping line with {} columns: {}", cols.length, line);
            return Optional.empty();
        }
        String kindText = cols[COL_KIND].strip();
        Optional<TransactionKind> kind = TransactionKind.fromLabel(kindText);
        if (kind.isEmpty()) {
            metrics.inc("ledger.rows.filtered");
            return Optional.empty();
        }
        LedgerRow row = new LedgerRow(
                cols[COL_UNIQUE_ID].strip(),
                cols[COL_OCCURRED_AT].strip(),
                cols[COL_AMOUNT].strip(),
                cols[COL_MEMO].strip(),
                kind.get(),
                SOURCE,
                batchNumber);
        log.debug("Found row id={} date={} amount={} memo={} kind={}",
                row.uniqueId(), row.occurredAt(), row.amount(), row.memo(), kindText);
        return Optional.of(row);
    }

    private static String stripBom(String line) {
        return line.startsWith("\uFEFF") ? line.substring(1) : line;
    }
}
