package io.billsync.importer;

import com.fasterxml.jackson.databind.JsonNode;
import io.billsync.bitable.BitableClient;
import io.billsync.bitable.StorePayload;
import io.billsync.core.BatchSink;
import io.billsync.core.Record;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes payloads into one Bitable table. A batch goes out as a single batch_create call in record order;
 * splitting it to fit the API's batch limit is up to the caller.
 */
public class BitableBatchSink implements BatchSink<StorePayload> {
    private final BitableClient client;
    private final String appToken;
    private final String tableId;
    private JsonNode lastResponse;

    public BitableBatchSink(BitableClient client, String appToken, String tableId) {
        this.client = client;
        this.appToken = appToken;
        this.tableId = tableId;
    }

    @Override
    public void accept(Record<StorePayload> record) {
        lastResponse = client.insertRecord(appToken, tableId, record.payload().fields());
    }

    @Override
    public void acceptBatch(List<Record<StorePayload>> records) {
        List<Record<StorePayload>> ordered = new ArrayList<>(records);
        ordered.sort(null);
        List<StorePayload> payloads = new ArrayList<>(ordered.size());
        for (Record<StorePayload> r : ordered) payloads.add(r.payload());
        lastResponse = client.batchInsert(appToken, tableId, payloads);
    }

    /** data object of the most recent successful call, or null. */
    public JsonNode lastResponse() { return lastResponse; }
}
