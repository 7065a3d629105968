package io.billsync.ledger;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One ledger line that survived extraction. Values are kept as the export wrote them (trimmed);
 * coercion happens in {@link FieldMapper}.
 */
public record LedgerRow(
        String uniqueId,
        String occurredAt,
        String amount,
        String memo,
        TransactionKind kind,
        String source,
        String batchNumber
) {
    /**
     * Generic key/value view used by the mapper. Null attributes are left out rather than written as null.
     */
    public Map<String, Object> asFields() {
        Map<String, Object> out = new LinkedHashMap<>();
        putIfPresent(out, "uniqueId", uniqueId);
        putIfPresent(out, "occurredAt", occurredAt);
        putIfPresent(out, "amount", amount);
        putIfPresent(out, "memo", memo);
        putIfPresent(out, "kind", kind == null ? null : kind.label());
        putIfPresent(out, "source", source);
        putIfPresent(out, "batchNumber", batchNumber);
        return out;
    }

    private static void putIfPresent(Map<String, Object> out, String key, Object value) {
        if (value != null) out.put(key, value);
    }
}
