// file: server/src/test/java/io/otlite/server/WebServerTest.java
package io.otlite.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.otlite.core.DefaultTransformEngine;
import io.otlite.server.coordinator.CoordinatorOptions;
import io.otlite.server.coordinator.DocumentCoordinatorRegistry;
import io.otlite.server.coordinator.LoggingBroadcastSink;
import io.otlite.storage.InMemorySnapshotStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end specs for the HTTP adapter: happy paths and error mapping.
 *
 * Focus:
 *  - Submit/resync/open/reset/close round trips.
 *  - Invalid operation -> 400 with reason, unknown document -> 404,
 *    stale base -> 409 with versions.
 *  - Invalid JSON -> 400 "invalid JSON", too-large body -> 413.
 *  - X-Correlation-Id is echoed or generated.
 */
class WebServerTest {

    private static final int PORT = 18080; // test-only port
    private final ObjectMapper json = new ObjectMapper();
    private WebServer server;
    private HttpClient client;

    @BeforeEach
    void startServer() {
        var options = new CoordinatorOptions(2, 100, Duration.ofMinutes(1), false);
        var registry = new DocumentCoordinatorRegistry(
                new DefaultTransformEngine(), new InMemorySnapshotStore(), new LoggingBroadcastSink(), options);

        server = new WebServer(PORT, registry, Duration.ofSeconds(2));
        server.start();

        client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(2))
                .build();
    }

    @AfterEach
    void stopServer() {
        if (server != null) {
            server.stop();
        }
    }

    private String baseUrl() {
        return "http://localhost:" + PORT;
    }

    private HttpResponse<String> send(String method, String path, String body) throws Exception {
        var builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl() + path))
                .header("Content-Type", "application/json");
        var publisher = body == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(body);
        return client.send(builder.method(method, publisher).build(), HttpResponse.BodyHandlers.ofString());
    }

    private static String insert(long base, int pos, String text, String opId) {
        return """
                {
                  "baseVersion": %d,
                  "operation": {"kind": "INSERT", "position": %d, "content": "%s",
                                "authorId": "alice", "logicalTime": 1, "operationId": "%s"}
                }
                """.formatted(base, pos, text, opId);
    }

    @Test
    void open_submit_and_resync_round_trip() throws Exception {
        var open = send("PUT", "/docs/notes", "{\"content\": \"abc\"}");
        assertEquals(200, open.statusCode());
        assertEquals(0, json.readTree(open.body()).get("version").asLong());

        var submit = send("POST", "/docs/notes/ops", insert(0, 1, "X", "op-1"));
        assertEquals(200, submit.statusCode(), submit.body());
        JsonNode result = json.readTree(submit.body());
        assertEquals(1, result.get("version").asLong());
        assertEquals("INSERT", result.get("operation").get("kind").asText());
        assertEquals("op-1", result.get("operation").get("operationId").asText());

        var get = send("GET", "/docs/notes", null);
        assertEquals(200, get.statusCode());
        JsonNode snap = json.readTree(get.body());
        assertEquals("aXbc", snap.get("content").asText());
        assertEquals(1, snap.get("version").asLong());
    }

    @Test
    void invalid_operation_returns_400_with_reason() throws Exception {
        send("PUT", "/docs/notes", "{\"content\": \"abc\"}");

        String body = """
                {"baseVersion": 0,
                 "operation": {"kind": "DELETE", "position": 2, "length": 9, "authorId": "alice",
                               "logicalTime": 1, "operationId": "op-1"}}
                """;
        var resp = send("POST", "/docs/notes/ops", body);

        assertEquals(400, resp.statusCode());
        JsonNode err = json.readTree(resp.body());
        assertEquals("INVALID_OPERATION", err.get("error").asText());
        assertEquals("OUT_OF_BOUNDS", err.get("reason").asText());
    }

    @Test
    void operation_without_id_is_rejected_and_never_applied() throws Exception {
        send("PUT", "/docs/notes", "{\"content\": \"abc\"}");
        String body = """
                {"baseVersion": 0,
                 "operation": {"kind": "INSERT", "position": 0, "content": "z", "authorId": "alice", "logicalTime": 1}}
                """;

        var first = send("POST", "/docs/notes/ops", body);
        var retry = send("POST", "/docs/notes/ops", body);

        assertEquals(400, first.statusCode());
        assertEquals(400, retry.statusCode());
        assertEquals("MISSING_IDENTITY", json.readTree(first.body()).get("reason").asText());
        JsonNode snap = json.readTree(send("GET", "/docs/notes", null).body());
        assertEquals("abc", snap.get("content").asText());
        assertEquals(0, snap.get("version").asLong());
    }

    @Test
    void omitted_numbers_are_rejected_instead_of_read_as_zero() throws Exception {
        send("PUT", "/docs/notes", "{\"content\": \"abc\"}");

        var noPosition = send("POST", "/docs/notes/ops", """
                {"baseVersion": 0,
                 "operation": {"kind": "INSERT", "content": "z", "authorId": "alice", "logicalTime": 1, "operationId": "op-1"}}
                """);
        var noTime = send("POST", "/docs/notes/ops", """
                {"baseVersion": 0,
                 "operation": {"kind": "INSERT", "position": 3, "content": "z", "authorId": "alice", "operationId": "op-2"}}
                """);
        var deleteNoLength = send("POST", "/docs/notes/ops", """
                {"baseVersion": 0,
                 "operation": {"kind": "DELETE", "position": 0, "authorId": "alice", "logicalTime": 1, "operationId": "op-3"}}
                """);

        assertEquals(400, noPosition.statusCode());
        assertTrue(noPosition.body().contains("operation.position is required"));
        assertEquals(400, noTime.statusCode());
        assertTrue(noTime.body().contains("operation.logicalTime is required"));
        assertEquals(400, deleteNoLength.statusCode());
        assertTrue(deleteNoLength.body().contains("operation.length is required"));
        assertEquals("abc", json.readTree(send("GET", "/docs/notes", null).body()).get("content").asText());
    }

    @Test
    void unknown_kind_returns_400() throws Exception {
        send("PUT", "/docs/notes", "{}");
        var resp = send("POST", "/docs/notes/ops",
                "{\"baseVersion\": 0, \"operation\": {\"kind\": \"MOVE\", \"authorId\": \"a\"}}");
        assertEquals(400, resp.statusCode());
        assertTrue(resp.body().contains("unknown operation kind"));
    }

    @Test
    void unknown_document_returns_404() throws Exception {
        var resp = send("POST", "/docs/nope/ops", insert(0, 0, "x", "op-1"));
        assertEquals(404, resp.statusCode());
        assertEquals("UNKNOWN_DOCUMENT", json.readTree(resp.body()).get("error").asText());
    }

    @Test
    void stale_base_returns_409_with_versions() throws Exception {
        send("PUT", "/docs/notes", "{}");
        send("POST", "/docs/notes/ops", insert(0, 0, "a", "op-1"));
        send("POST", "/docs/notes/ops", insert(1, 1, "b", "op-2"));
        send("POST", "/docs/notes/ops", insert(2, 2, "c", "op-3"));

        var resp = send("POST", "/docs/notes/ops", insert(0, 0, "x", "op-late"));

        assertEquals(409, resp.statusCode());
        JsonNode err = json.readTree(resp.body());
        assertEquals("STALE_CLIENT", err.get("error").asText());
        assertEquals(3, err.get("currentVersion").asLong());
        assertEquals(1, err.get("oldestRebasableVersion").asLong());
    }

    @Test
    void missing_base_version_returns_400() throws Exception {
        send("PUT", "/docs/notes", "{}");
        var resp = send("POST", "/docs/notes/ops",
                "{\"operation\": {\"kind\": \"INSERT\", \"content\": \"x\", \"authorId\": \"a\"}}");
        assertEquals(400, resp.statusCode());
        assertTrue(resp.body().contains("baseVersion is required"));
    }

    @Test
    void invalid_json_returns_400() throws Exception {
        var resp = send("POST", "/docs/notes/ops", "{ invalid-json");
        assertEquals(400, resp.statusCode());
        assertTrue(resp.body().contains("invalid JSON"));
    }

    @Test
    void too_large_body_returns_413() throws Exception {
        // Build a body larger than MAX_BODY_BYTES (10 MiB).
        String big = "x".repeat(11 * 1024 * 1024);

        var resp = send("POST", "/docs/notes/ops", big);
        assertEquals(413, resp.statusCode());
        assertTrue(resp.body().contains("request body too large"));
    }

    @Test
    void correlation_id_is_echoed_or_generated() throws Exception {
        var given = client.send(HttpRequest.newBuilder()
                        .uri(URI.create(baseUrl() + "/admin/health"))
                        .header("X-Correlation-Id", "trace-42")
                        .GET()
                        .build(),
                HttpResponse.BodyHandlers.ofString());
        assertEquals("trace-42", given.headers().firstValue("X-Correlation-Id").orElseThrow());

        var generated = send("GET", "/admin/health", null);
        assertFalse(generated.headers().firstValue("X-Correlation-Id").orElse("").isBlank());
        assertEquals("ok", json.readTree(generated.body()).get("status").asText());
    }

    @Test
    void reset_and_close_endpoints() throws Exception {
        send("PUT", "/docs/notes", "{\"content\": \"abc\"}");

        var reset = send("POST", "/docs/notes/reset", null);
        assertEquals(200, reset.statusCode());
        assertEquals("abc", json.readTree(reset.body()).get("content").asText());

        var close = send("DELETE", "/docs/notes", null);
        assertEquals(200, close.statusCode());
        assertTrue(json.readTree(close.body()).get("closed").asBoolean());

        var health = send("GET", "/admin/health", null);
        assertEquals(0, json.readTree(health.body()).get("documents").asInt());
    }

    @Test
    void empty_document_id_and_bad_method() throws Exception {
        assertEquals(400, send("GET", "/docs/", null).statusCode());
        assertEquals(405, send("GET", "/docs/notes/ops", null).statusCode());
        assertEquals(404, send("GET", "/elsewhere", null).statusCode());
    }
}
