package io.billsync.testing;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process stand-in for the Feishu Open API. Replies are queued per "METHOD path"; the last queued
 * reply for a route keeps being served once the others are used up. Every request is recorded.
 */
public final class StubFeishuServer implements AutoCloseable {
    public static final String TOKEN_REPLY = "{\"code\":0,\"msg\":\"ok\",\"tenant_access_token\":\"t-123\",\"expire\":7200}";

    public record Call(String method, String path, String authorization, String body) {}

    private record Reply(int status, String body) {}

    private final HttpServer server;
    private final Map<String, Deque<Reply>> replies = new ConcurrentHashMap<>();
    private final List<Call> calls = new CopyOnWriteArrayList<>();

    private StubFeishuServer(HttpServer server) {
        this.server = server;
    }

    public static StubFeishuServer start() throws IOException {
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        StubFeishuServer stub = new StubFeishuServer(server);
        server.createContext("/", stub::handle);
        server.start();
        return stub;
    }

    public URI baseUrl() {
        return URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/open-apis");
    }

    /** Queues a reply; path is relative to {@link #baseUrl()}. */
    public StubFeishuServer reply(String method, String path, int status, String body) {
        replies.computeIfAbsent(method + " /open-apis" + path, k -> new ArrayDeque<>()).add(new Reply(status, body));
        return this;
    }

    public StubFeishuServer replyToken() {
        return reply("POST", "/auth/v3/tenant_access_token/internal", 200, TOKEN_REPLY);
    }

    public List<Call> calls() { return List.copyOf(calls); }

    public List<Call> calls(String path) {
        return calls.stream().filter(c -> c.path().equals("/open-apis" + path)).toList();
    }

    private void handle(HttpExchange exchange) throws IOException {
        String method = exchange.getRequestMethod();
        String path = exchange.getRequestURI().getPath();
        String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        calls.add(new Call(method, path, exchange.getRequestHeaders().getFirst("Authorization"), body));

        Reply reply;
        Deque<Reply> queue = replies.get(method + " " + path);
        if (queue == null || queue.isEmpty()) {
            reply = new Reply(404, "{\"code\":404,\"msg\":\"no stub for " + path + "\"}");
        } else {
            synchronized (queue) {
                reply = queue.size() > 1 ? queue.poll() : queue.peek();
            }
        }
        byte[] out = reply.body().getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(reply.status(), out.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(out);
        }
    }

    @Override
    public void close() {
        server.stop(0);
    }
}
