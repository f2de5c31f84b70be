// file: server/src/main/java/io/otlite/server/WebServer.java
package io.otlite.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.otlite.core.InternalInvariantViolationException;
import io.otlite.core.InvalidOperationException;
import io.otlite.core.Operation;
import io.otlite.core.StaleClientException;
import io.otlite.core.UnknownDocumentException;
import io.otlite.server.coordinator.DocumentCoordinatorRegistry;
import io.otlite.server.coordinator.SubmitTimeoutException;
import io.otlite.server.dto.OpenRequest;
import io.otlite.server.dto.SnapshotResponse;
import io.otlite.server.dto.SubmitRequest;
import io.otlite.server.dto.SubmitResponse;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Thin HTTP adapter over DocumentCoordinatorRegistry.
 *
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Decode JSON request bodies into DTOs.
 *  - Convert coordinator results back into JSON.
 *  - Map engine exceptions to HTTP status codes.
 *  - Echo or assign X-Correlation-Id and log every request with it.
 *
 * Path layout:
 *   - POST   /docs/{id}/ops     Submit an operation at a base version
 *   - GET    /docs/{id}         Resync: current content and version
 *   - PUT    /docs/{id}         Open (create) a document with initial content
 *   - POST   /docs/{id}/reset   Reset a poisoned document from its last snapshot
 *   - DELETE /docs/{id}         Persist and evict a live document
 *   - GET    /admin/health      Basic health check
 *
 * Error mapping:
 *   400 invalid operation / malformed request, 404 unknown document,
 *   409 stale client, 413 body too large, 503 submit timeout,
 *   500 internal invariant violation or anything unexpected.
 *
 * Coordinator calls can block on a document lock, so requests are
 * dispatched off the IO threads onto Undertow's worker pool.
 */
public final class WebServer {
    static final String CORRELATION_HEADER = "X-Correlation-Id";
    private static final HttpString CORRELATION_ID = new HttpString(CORRELATION_HEADER);
    private static final int MAX_BODY_BYTES = 10 * 1024 * 1024; // 10 MiB

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final DocumentCoordinatorRegistry registry;
    private final Duration submitTimeout;

    public WebServer(int port, DocumentCoordinatorRegistry registry, Duration submitTimeout) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.submitTimeout = Objects.requireNonNull(submitTimeout, "submitTimeout");
        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(this::route)
                .build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop(); // For tests to stop server
    }

    // ---------- routing ----------

    private void route(HttpServerExchange exchange) {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this::route);
            return;
        }
        var path = exchange.getRequestPath();
        var method = exchange.getRequestMethod().toString();
        var call = new Call(method, path, correlationId(exchange));
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        exchange.getResponseHeaders().put(CORRELATION_ID, call.correlationId);

        if (path.startsWith("/docs/")) {
            String[] parts = path.substring("/docs/".length()).split("/", -1);
            String docId = parts[0];
            if (docId.isBlank()) {
                reject(exchange, call, 400, "documentId must not be empty");
                return;
            }
            if (parts.length == 1) {
                switch (method) {
                    case "GET" -> handle(exchange, call, false, body -> handleSnapshot(call, docId));
                    case "PUT" -> handle(exchange, call, true, body -> handleOpen(call, docId, body));
                    case "DELETE" -> handle(exchange, call, false, body -> handleClose(call, docId));
                    default -> reject(exchange, call, 405, "method not allowed");
                }
            } else if (parts.length == 2 && "ops".equals(parts[1])) {
                if ("POST".equals(method)) {
                    handle(exchange, call, true, body -> handleSubmit(call, docId, body));
                } else {
                    reject(exchange, call, 405, "method not allowed");
                }
            } else if (parts.length == 2 && "reset".equals(parts[1])) {
                if ("POST".equals(method)) {
                    handle(exchange, call, false, body -> handleReset(call, docId));
                } else {
                    reject(exchange, call, 405, "method not allowed");
                }
            } else {
                reject(exchange, call, 404, "not found");
            }
        } else if ("/admin/health".equals(path) && "GET".equals(method)) {
            send(exchange, 200, Map.of("status", "ok", "documents", registry.size()));
            RequestLogger.logRequest(method, path, 200, 0, -1, call.correlationId, null);
        } else {
            reject(exchange, call, 404, "not found");
        }
    }

    // ---------- handlers ----------

    /** POST /docs/{id}/ops */
    private Object handleSubmit(Call call, String docId, byte[] body) throws Exception {
        var req = json.readValue(body, SubmitRequest.class);
        if (req == null || req.operation == null) {
            throw new IllegalArgumentException("operation is required");
        }
        if (req.baseVersion == null) {
            throw new IllegalArgumentException("baseVersion is required");
        }
        Operation op = req.operation.toOperation();
        long base = req.baseVersion;
        return SubmitResponse.from(call.timed(() -> registry.submit(docId, op, base, submitTimeout)));
    }

    /** GET /docs/{id} */
    private Object handleSnapshot(Call call, String docId) {
        return SnapshotResponse.from(call.timed(() -> registry.snapshot(docId)));
    }

    /** PUT /docs/{id} */
    private Object handleOpen(Call call, String docId, byte[] body) throws Exception {
        String content = null;
        if (body.length > 0) {
            var req = json.readValue(body, OpenRequest.class);
            content = req == null ? null : req.content;
        }
        String initial = content;
        return SnapshotResponse.from(call.timed(() -> registry.open(docId, initial)));
    }

    /** POST /docs/{id}/reset */
    private Object handleReset(Call call, String docId) {
        return SnapshotResponse.from(call.timed(() -> registry.reset(docId)));
    }

    /** DELETE /docs/{id} */
    private Object handleClose(Call call, String docId) {
        boolean closed = call.timed(() -> registry.close(docId));
        return Map.of("documentId", docId, "closed", closed);
    }

    // ---------- plumbing ----------

    @FunctionalInterface
    private interface Action {
        Object run(byte[] body) throws Exception;
    }

    /** Per-request bookkeeping for logging. */
    private static final class Call {
        final String method;
        final String path;
        final String correlationId;
        long coordinatorMillis = -1L;

        Call(String method, String path, String correlationId) {
            this.method = method;
            this.path = path;
            this.correlationId = correlationId;
        }

        <T> T timed(Supplier<T> coordinatorCall) {
            long start = System.nanoTime();
            try {
                return coordinatorCall.get();
            } finally {
                coordinatorMillis = (System.nanoTime() - start) / 1_000_000L;
            }
        }
    }

    private void handle(HttpServerExchange ex, Call call, boolean readsBody, Action action) {
        if (!readsBody) {
            respond(ex, call, new byte[0], action);
            return;
        }
        ex.getRequestReceiver().receiveFullBytes(
                (exchange, data) -> {
                    // The body may complete on an IO thread; hop back to a worker.
                    if (exchange.isInIoThread()) {
                        exchange.dispatch(() -> respond(exchange, call, data, action));
                    } else {
                        respond(exchange, call, data, action);
                    }
                },
                (exchange, ioEx) -> {
                    int status = 400;
                    send(exchange, status, Map.of("error", "invalid request body"));
                    RequestLogger.logRequest(call.method, call.path, status, 0, -1, call.correlationId, ioEx);
                }
        );
    }

    private void respond(HttpServerExchange exchange, Call call, byte[] data, Action action) {
        long start = System.nanoTime();
        int status;
        Throwable error = null;
        try {
            if (data.length > MAX_BODY_BYTES) {
                status = 413;
                send(exchange, status, Map.of("error", "request body too large"));
            } else {
                Object body = action.run(data);
                status = 200;
                send(exchange, status, body);
            }
        } catch (InvalidOperationException bad) {
            status = 400;
            error = bad;
            send(exchange, status, Map.of("error", bad.code(), "reason", bad.reason().name(), "message", bad.getMessage()));
        } catch (UnknownDocumentException unknown) {
            status = 404;
            error = unknown;
            send(exchange, status, Map.of("error", unknown.code(), "message", unknown.getMessage()));
        } catch (StaleClientException stale) {
            status = 409;
            error = stale;
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error", stale.code());
            body.put("message", stale.getMessage());
            body.put("currentVersion", stale.currentVersion());
            body.put("oldestRebasableVersion", stale.oldestRebasableVersion());
            send(exchange, status, body);
        } catch (SubmitTimeoutException busy) {
            status = 503;
            error = busy;
            send(exchange, status, Map.of("error", busy.code(), "message", busy.getMessage()));
        } catch (InternalInvariantViolationException broken) {
            status = 500;
            error = broken;
            send(exchange, status, Map.of("error", broken.code(), "message", broken.getMessage()));
        } catch (JsonProcessingException jsonEx) {
            status = 400;
            error = jsonEx;
            send(exchange, status, Map.of("error", "invalid JSON"));
        } catch (IllegalArgumentException bad) {
            status = 400;
            error = bad;
            send(exchange, status, Map.of("error", String.valueOf(bad.getMessage())));
        } catch (Exception e) {
            status = 500;
            error = e;
            send(exchange, status, Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage())));
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logRequest(call.method, call.path, exchange.getStatusCode(), totalMs,
                    call.coordinatorMillis, call.correlationId, error);
        }
    }

    private void reject(HttpServerExchange exchange, Call call, int status, String message) {
        send(exchange, status, Map.of("error", message));
        RequestLogger.logRequest(call.method, call.path, status, 0, -1, call.correlationId, null);
    }

    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            ex.getResponseSender().send(json.writeValueAsString(body), StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization failure\"}", StandardCharsets.UTF_8);
        }
    }

    private static String correlationId(HttpServerExchange ex) {
        String given = ex.getRequestHeaders().getFirst(CORRELATION_ID);
        return given == null || given.isBlank() ? UUID.randomUUID().toString() : given.trim();
    }
}
