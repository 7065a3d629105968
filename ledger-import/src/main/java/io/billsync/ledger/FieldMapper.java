package io.billsync.ledger;

import io.billsync.bitable.StorePayload;
import io.billsync.core.Record;
import io.billsync.core.Transform;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Renames ledger keys to the billing table's column names and coerces the date and amount
 * columns into the types the table expects. Values that fail coercion are sent as-is.
 */
public class FieldMapper implements Transform<LedgerRow, StorePayload> {
    public static final String UNIQUE_ID = "唯一字段";
    public static final String DATE = "日期";
    public static final String AMOUNT = "金额";
    public static final String MEMO = "备注";
    public static final String KIND = "收支";
    public static final String BATCH_NUMBER = "导入批次号";

    /** Ledger key to remote column. Keys outside this table never reach the store. */
    public static final Map<String, String> FIELD_NAMES;
    static {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("uniqueId", UNIQUE_ID);
        m.put("occurredAt", DATE);
        m.put("amount", AMOUNT);
        m.put("memo", MEMO);
        m.put("kind", KIND);
        m.put("batchNumber", BATCH_NUMBER);
        FIELD_NAMES = Collections.unmodifiableMap(m);
    }

    static final DateTimeFormatter LEDGER_TIME = DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss")
            .withResolverStyle(ResolverStyle.STRICT);

    // finite decimals only
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private final ZoneId zone;

    public FieldMapper() { this(ZoneId.systemDefault()); }

    /** @param zone zone the export's wall-clock times are interpreted in */
    public FieldMapper(ZoneId zone) {
        this.zone = zone;
    }

    public StorePayload toStorePayload(LedgerRow row) {
        return toStorePayload(row.asFields());
    }

    public StorePayload toStorePayload(Map<String, ?> source) {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : FIELD_NAMES.entrySet()) {
            if (source.containsKey(e.getKey())) {
                fields.put(e.getValue(), source.get(e.getKey()));
            }
        }
        if (fields.get(DATE) instanceof String s) {
            Long millis = toEpochMillis(s);
            if (millis != null) fields.put(DATE, millis);
        }
        if (fields.get(AMOUNT) instanceof String s) {
            Double amount = toAmount(s);
            if (amount != null) fields.put(AMOUNT, amount);
        }
        return new StorePayload(fields);
    }

    @Override
    public List<Record<StorePayload>> apply(Record<LedgerRow> input) {
        return List.of(input.withPayload(toStorePayload(input.payload())));
    }

    Long toEpochMillis(String text) {
        try {
            return LocalDateTime.parse(text, LEDGER_TIME).atZone(zone).toInstant().toEpochMilli();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    static Double toAmount(String text) {
        String t = text.strip();
        if (!DECIMAL.matcher(t).matches()) return null;
        return Double.parseDouble(t);
    }
}
