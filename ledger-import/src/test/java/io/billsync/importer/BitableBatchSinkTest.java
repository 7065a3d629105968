package io.billsync.importer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.billsync.bitable.BitableClient;
import io.billsync.bitable.StorePayload;
import io.billsync.core.Record;
import io.billsync.metrics.Metrics;
import io.billsync.testing.StubFeishuServer;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BitableBatchSinkTest {
    private static final String BATCH_CREATE = "/bitable/v1/apps/app/tables/tbl/records/batch_create";
    private static final String CREATE = "/bitable/v1/apps/app/tables/tbl/records";

    @Test
    void batchIsSentInRecordOrder() throws Exception {
        try (StubFeishuServer server = StubFeishuServer.start()) {
            server.replyToken().reply("POST", BATCH_CREATE, 200, "{\"code\":0,\"msg\":\"success\",\"data\":{\"records\":[]}}");
            BitableBatchSink sink = new BitableBatchSink(client(server), "app", "tbl");

            sink.acceptBatch(List.of(
                    new Record<>(1, 0, new StorePayload(Map.of("id", "c"))),
                    new Record<>(0, 1, new StorePayload(Map.of("id", "b"))),
                    new Record<>(0, 0, new StorePayload(Map.of("id", "a")))));

            JsonNode records = new ObjectMapper().readTree(server.calls(BATCH_CREATE).get(0).body()).get("records");
            assertEquals("a", records.get(0).get("fields").get("id").asText());
            assertEquals("b", records.get(1).get("fields").get("id").asText());
            assertEquals("c", records.get(2).get("fields").get("id").asText());
            assertTrue(sink.lastResponse().get("records").isArray());
        }
    }

    @Test
    void singleRecordGoesThroughCreate() throws Exception {
        try (StubFeishuServer server = StubFeishuServer.start()) {
            server.replyToken().reply("POST", CREATE, 200,
                    "{\"code\":0,\"msg\":\"success\",\"data\":{\"record\":{\"record_id\":\"rec1\"}}}");
            BitableBatchSink sink = new BitableBatchSink(client(server), "app", "tbl");

            sink.accept(Record.of(0, new StorePayload(Map.of("id", "a"))));

            assertEquals(1, server.calls(CREATE).size());
            assertEquals("rec1", sink.lastResponse().get("record").get("record_id").asText());
        }
    }

    private static BitableClient client(StubFeishuServer server) {
        return new BitableClient(server.baseUrl(), "cli", "secret", HttpClient.newHttpClient(), new ObjectMapper(),
                null, Metrics.detached());
    }
}
