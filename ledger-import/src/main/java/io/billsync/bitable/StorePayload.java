package io.billsync.bitable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One record as the Bitable API takes it: serializes to {@code {"fields": {...}}}.
 * Column order is kept so request bodies are stable.
 */
public record StorePayload(Map<String, Object> fields) {
    public StorePayload {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Object get(String column) { return fields.get(column); }
}
