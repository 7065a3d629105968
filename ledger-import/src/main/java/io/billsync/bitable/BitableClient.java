package io.billsync.bitable;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.billsync.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Blocking client for the parts of the Feishu Open API the importer needs: tenant token exchange,
 * spreadsheet sheet listing, paginated record search, and single/batch record creation.
 * <p>
 * The tenant token is fetched on first use and reused for the lifetime of the instance; it is never
 * refreshed. Nothing is retried: every failure surfaces as a {@link BitableException} subtype.
 */
public class BitableClient {
    private static final Logger log = LoggerFactory.getLogger(BitableClient.class);

    public static final URI DEFAULT_BASE_URL = URI.create("https://open.feishu.cn/open-apis");
    public static final int DEFAULT_PAGE_SIZE = 100;

    static final String AUTH_PATH = "/auth/v3/tenant_access_token/internal";
    private static final String JSON_UTF8 = "application/json; charset=utf-8";

    private final HttpClient http;
    private final ObjectMapper json;
    private final String baseUrl;
    private final String appId;
    private final String appSecret;
    private final Duration requestTimeout; // null: transport default
    private final Metrics metrics;

    private final Object tokenLock = new Object();
    private String accessToken; // guarded by tokenLock

    public BitableClient(URI baseUrl, String appId, String appSecret) {
        this(baseUrl, appId, appSecret, HttpClient.newHttpClient(), new ObjectMapper(), null, Metrics.detached());
    }

    public BitableClient(URI baseUrl, String appId, String appSecret, HttpClient http, ObjectMapper json,
                         Duration requestTimeout, Metrics metrics) {
        String b = baseUrl.toString();
        this.baseUrl = b.endsWith("/") ? b.substring(0, b.length() - 1) : b;
        this.appId = appId;
        this.appSecret = appSecret;
        this.http = http;
        this.json = json;
        this.requestTimeout = requestTimeout;
        this.metrics = metrics;
    }

    /**
     * Tenant access token, exchanged on the first call and cached afterwards.
     *
     * @throws AuthException if the exchange fails or is rejected
     */
    public String tenantAccessToken() {
        synchronized (tokenLock) {
            if (accessToken == null) {
                accessToken = requestToken();
            }
            return accessToken;
        }
    }

    private String requestToken() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("app_id", appId);
        body.put("app_secret", appSecret);
        Exchange ex;
        try {
            ex = send(post(AUTH_PATH, body, null));
        } catch (IOException e) {
            throw new AuthException("tenant token request failed: " + e.getMessage(), AUTH_PATH, e);
        }
        if (!ex.isSuccess()) {
            throw new AuthException("tenant token request failed with HTTP " + ex.status() + ": " + ex.body(), AUTH_PATH);
        }
        ApiEnvelope env;
        try {
            env = ApiEnvelope.parse(json, ex.body());
        } catch (JsonProcessingException e) {
            throw new AuthException("tenant token response is not JSON: " + ex.body(), AUTH_PATH, e);
        }
        if (!env.ok()) {
            throw new AuthException("tenant token exchange rejected: " + env.msg() + " (code " + env.code() + ")", AUTH_PATH);
        }
        JsonNode token = env.root().get("tenant_access_token");
        if (token == null || !token.isTextual() || token.asText().isEmpty()) {
            throw new AuthException("tenant token response carries no tenant_access_token", AUTH_PATH);
        }
        log.debug("Acquired tenant access token for app {}", appId);
        return token.asText();
    }

    /**
     * Sheets of a spreadsheet in the order the API returns them.
     *
     * @throws SheetResolutionException if the describe call fails
     */
    public List<SheetInfo> listSheets(String appToken) {
        String path = "/bitable/v1/spreadsheets/" + appToken;
        ApiEnvelope env;
        try {
            Exchange ex = send(get(path, tenantAccessToken()));
            if (!ex.isSuccess()) {
                throw new SheetResolutionException("describing spreadsheet " + appToken + " failed with HTTP "
                        + ex.status() + ": " + ex.body(), path);
            }
            env = ApiEnvelope.parse(json, ex.body());
        } catch (IOException e) {
            throw new SheetResolutionException("describing spreadsheet " + appToken + " failed: " + e.getMessage(), path, e);
        }
        if (!env.ok()) {
            throw new SheetResolutionException("describing spreadsheet " + appToken + " rejected: " + env.msg()
                    + " (code " + env.code() + ")", path);
        }
        List<SheetInfo> sheets = new ArrayList<>();
        JsonNode arr = env.data().path("spreadsheet").path("sheets");
        if (arr.isArray()) {
            for (JsonNode n : arr) sheets.add(SheetInfo.from(n));
        }
        return sheets;
    }

    /**
     * Id of the first sheet of the spreadsheet. The API does not promise a stable order.
     *
     * @throws SheetResolutionException if the lookup fails or the spreadsheet has no sheets
     */
    public String resolveDefaultTable(String appToken) {
        List<SheetInfo> sheets = listSheets(appToken);
        String path = "/bitable/v1/spreadsheets/" + appToken;
        if (sheets.isEmpty()) {
            throw new SheetResolutionException("spreadsheet " + appToken + " has no sheets", path);
        }
        SheetInfo first = sheets.get(0);
        String id = first.sheetId();
        if (id == null || id.isEmpty()) {
            throw new SheetResolutionException("first sheet of spreadsheet " + appToken + " has no sheet_id", path);
        }
        log.info("No table given, using first sheet {} ({}) of {}", id, first.title(), appToken);
        return id;
    }

    public List<JsonNode> searchRecords(String appToken) {
        return searchRecords(appToken, null, null, DEFAULT_PAGE_SIZE);
    }

    public List<JsonNode> searchRecords(String appToken, String tableId) {
        return searchRecords(appToken, tableId, null, DEFAULT_PAGE_SIZE);
    }

    /**
     * All records of a table matching filter, fetched page by page and returned only once every
     * page has succeeded.
     *
     * @param tableId table to search; null or blank means the spreadsheet's first sheet
     * @param filter  Bitable filter object, sent as-is; null for none
     * @throws RecordFetchException     if any page fails
     * @throws SheetResolutionException if tableId had to be resolved and could not be
     */
    public List<JsonNode> searchRecords(String appToken, String tableId, Object filter, int pageSize) {
        String table = tableId == null || tableId.isBlank() ? resolveDefaultTable(appToken) : tableId;
        String path = tablePath(appToken, table) + "/records/search";
        String token = tenantAccessToken();

        List<JsonNode> all = new ArrayList<>();
        String pageToken = "";
        int page = 0;
        while (true) {
            page++;
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("page_size", pageSize);
            body.put("page_token", pageToken);
            if (filter != null) body.put("filter", filter);

            ApiEnvelope env;
            try {
                Exchange ex = send(post(path, body, token));
                if (!ex.isSuccess()) {
                    throw new RecordFetchException("searching " + appToken + "/" + table + " page " + page
                            + " failed with HTTP " + ex.status() + ": " + ex.body(), path, page);
                }
                env = ApiEnvelope.parse(json, ex.body());
            } catch (IOException e) {
                throw new RecordFetchException("searching " + appToken + "/" + table + " page " + page
                        + " failed: " + e.getMessage(), path, page, e);
            }
            if (!env.ok()) {
                throw new RecordFetchException("searching " + appToken + "/" + table + " page " + page
                        + " rejected: " + env.msg() + " (code " + env.code() + ")", path, page);
            }
            metrics.inc("bitable.search.pages");
            JsonNode items = env.data().path("items");
            if (items.isArray()) {
                for (JsonNode item : items) all.add(item);
            }
            JsonNode next = env.data().get("page_token");
            if (next == null || !next.isTextual() || next.asText().isEmpty()) break;
            pageToken = next.asText();
        }
        log.debug("Fetched {} records from {}/{} in {} pages", all.size(), appToken, table, page);
        return Collections.unmodifiableList(all);
    }

    /**
     * Creates one record.
     *
     * @return the response's data object
     * @throws InsertException unless the response is HTTP 200 with code 0
     */
    public JsonNode insertRecord(String appToken, String tableId, Map<String, Object> fields) {
        String path = tablePath(appToken, tableId) + "/records";
        Map<String, Object> body = Map.of("fields", fields);
        Exchange ex;
        try {
            ex = send(post(path, body, tenantAccessToken()));
        } catch (IOException e) {
            throw new InsertException("insert into " + appToken + "/" + tableId + " failed: " + e.getMessage(), path, e);
        }
        ApiEnvelope env = parseQuietly(ex.body());
        if (ex.status() != 200 || env == null || !env.ok()) {
            String msg = env == null ? null : env.msg();
            throw new InsertException("insert into " + appToken + "/" + tableId + " failed: " + msg
                    + ", status: " + ex.status() + ", response: " + ex.body(), path, ex.status(), msg, ex.body());
        }
        metrics.inc("bitable.records.inserted");
        return env.data();
    }

    /**
     * Creates all records in a single batch_create call. The call is all-or-nothing from the
     * caller's side; keeping the batch under the API's size limit is the caller's job.
     *
     * @return the response's data object
     * @throws BatchInsertException unless the response is HTTP 200 with code 0
     */
    public JsonNode batchInsert(String appToken, String tableId, List<StorePayload> records) {
        String path = tablePath(appToken, tableId) + "/records/batch_create";
        Map<String, Object> body = Map.of("records", records);
        Exchange ex;
        try {
            ex = send(post(path, body, tenantAccessToken()));
        } catch (IOException e) {
            throw new BatchInsertException("batch insert of " + records.size() + " records into " + appToken + "/"
                    + tableId + " failed: " + e.getMessage(), path, e);
        }
        ApiEnvelope env = parseQuietly(ex.body());
        if (ex.status() != 200 || env == null || !env.ok()) {
            String msg = env == null ? null : env.msg();
            throw new BatchInsertException("batch insert of " + records.size() + " records into " + appToken + "/"
                    + tableId + " failed: " + msg + ", status: " + ex.status() + ", response: " + ex.body(),
                    path, ex.status(), msg, ex.body());
        }
        metrics.inc("bitable.records.inserted", records.size());
        return env.data();
    }

    private static String tablePath(String appToken, String tableId) {
        return "/bitable/v1/apps/" + appToken + "/tables/" + tableId;
    }

    private ApiEnvelope parseQuietly(String body) {
        try {
            return ApiEnvelope.parse(json, body);
        } catch (JsonProcessingException e) {
            log.debug("Response body is not JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    private HttpRequest post(String path, Object body, String token) throws JsonProcessingException {
        String payload = json.writeValueAsString(body);
        if (!AUTH_PATH.equals(path)) {
            log.debug("POST {} body={}", path, payload);
        }
        HttpRequest.Builder b = request(path, token)
                .header("Content-Type", JSON_UTF8)
                .POST(HttpRequest.BodyPublishers.ofString(payload, StandardCharsets.UTF_8));
        return b.build();
    }

    private HttpRequest get(String path, String token) {
        return request(path, token).GET().build();
    }

    private HttpRequest.Builder request(String path, String token) {
        HttpRequest.Builder b = HttpRequest.newBuilder(URI.create(baseUrl + path));
        if (token != null) b.header("Authorization", "Bearer " + token);
        if (requestTimeout != null) b.timeout(requestTimeout);
        return b;
    }

    private Exchange send(HttpRequest req) throws IOException {
        metrics.inc("bitable.requests");
        try {
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            return new Exchange(resp.statusCode(), resp.body());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted calling " + req.uri().getPath());
        }
    }

    private record Exchange(int status, String body) {
        boolean isSuccess() { return status >= 200 && status < 300; }
    }
}
