package io.billsync.importer;

import io.billsync.bitable.BitableClient;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Importer settings. Each value is looked up as a system property, then an environment variable,
 * then a {@code .env} file entry.
 */
public record ImportConfig(
        String appId,
        String appSecret,
        String appToken,
        String billingTableId,
        String batchTableId,
        URI baseUrl,
        Duration connectTimeout,
        Duration requestTimeout,
        ZoneId zone
) {
    public static ImportConfig fromEnv() {
        return fromEnv(Path.of(".env"));
    }

    public static ImportConfig fromEnv(Path dotEnv) {
        return from(System.getProperties(), System.getenv(), readDotEnv(dotEnv));
    }

    static ImportConfig from(Properties props, Map<String, String> env, Map<String, String> dotEnv) {
        Lookup l = new Lookup(props, env, dotEnv);
        String base = l.get("feishu.baseUrl", "FEISHU_BASE_URL");
        String zone = l.get("ledger.zone", "LEDGER_ZONE");
        try {
            return new ImportConfig(
                    l.get("feishu.appId", "FEISHU_APP_ID"),
                    l.get("feishu.appSecret", "FEISHU_APP_SECRET"),
                    l.get("feishu.appToken", "FEISHU_APP_TOKEN"),
                    l.get("feishu.billingTable", "FEISHU_TABLE_ID_BILLING"),
                    l.get("feishu.batchTable", "FEISHU_TABLE_ID_BATCH_NUMBER"),
                    base == null ? BitableClient.DEFAULT_BASE_URL : URI.create(base),
                    Duration.ofMillis(l.getLong("feishu.connectTimeoutMs", "FEISHU_CONNECT_TIMEOUT_MS", 10_000)),
                    millisOrNull(l.getLong("feishu.requestTimeoutMs", "FEISHU_REQUEST_TIMEOUT_MS", 0)),
                    zone == null ? ZoneId.systemDefault() : ZoneId.of(zone));
        } catch (IllegalArgumentException | DateTimeException e) {
            throw new ConfigException("invalid configuration: " + e.getMessage(), e);
        }
    }

    /**
     * @throws ConfigException unless app id, app secret and app token are all set
     */
    public ImportConfig requireRemote() {
        List<String> missing = new ArrayList<>();
        if (isBlank(appId)) missing.add("FEISHU_APP_ID");
        if (isBlank(appSecret)) missing.add("FEISHU_APP_SECRET");
        if (isBlank(appToken)) missing.add("FEISHU_APP_TOKEN");
        if (!missing.isEmpty()) {
            throw new ConfigException("Feishu configuration incomplete, missing " + String.join(", ", missing));
        }
        return this;
    }

    /**
     * @throws ConfigException unless both the billing and the batch-number table ids are set
     */
    public ImportConfig requireTables() {
        List<String> missing = new ArrayList<>();
        if (isBlank(billingTableId)) missing.add("FEISHU_TABLE_ID_BILLING");
        if (isBlank(batchTableId)) missing.add("FEISHU_TABLE_ID_BATCH_NUMBER");
        if (!missing.isEmpty()) {
            throw new ConfigException("Feishu table ids missing: " + String.join(", ", missing));
        }
        return this;
    }

    /**
     * KEY=VALUE lines; blank lines, '#' comments and a leading "export " are allowed, surrounding quotes are
     * removed. A missing file yields no entries.
     */
    static Map<String, String> readDotEnv(Path file) {
        Map<String, String> out = new HashMap<>();
        if (file == null || !Files.isRegularFile(file)) return out;
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigException("cannot read " + file, e);
        }
        for (String raw : lines) {
            String line = raw.strip();
            if (line.isEmpty() || line.startsWith("#")) continue;
            if (line.startsWith("export ")) line = line.substring("export ".length()).strip();
            int eq = line.indexOf('=');
            if (eq <= 0) continue;
            String key = line.substring(0, eq).strip();
            String value = line.substring(eq + 1).strip();
            if (value.length() >= 2 && (value.startsWith("\"") && value.endsWith("\"")
                    || value.startsWith("'") && value.endsWith("'"))) {
                value = value.substring(1, value.length() - 1);
            }
            out.put(key, value);
        }
        return out;
    }

    private static Duration millisOrNull(long ms) {
        return ms <= 0 ? null : Duration.ofMillis(ms);
    }

    private static boolean isBlank(String s) { return s == null || s.isBlank(); }

    private record Lookup(Properties props, Map<String, String> env, Map<String, String> dotEnv) {
        String get(String property, String variable) {
            String v = props.getProperty(property);
            if (isBlank(v)) v = env.get(variable);
            if (isBlank(v)) v = dotEnv.get(variable);
            return isBlank(v) ? null : v.strip();
        }

        long getLong(String property, String variable, long def) {
            String v = get(property, variable);
            return v == null ? def : Long.parseLong(v);
        }
    }
}
