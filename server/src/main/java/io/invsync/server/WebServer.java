package io.invsync.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.invsync.core.StoreException;
import io.invsync.core.wire.CommitRequest;
import io.invsync.core.wire.WireCodec;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.nio.charset.StandardCharsets;
import java.util.Deque;
import java.util.Map;

/**
 * Thin HTTP adapter over {@link DocumentService}.
 *
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Decode JSON request bodies into DTOs.
 *  - Convert service results back into JSON.
 *  - Map exceptions to HTTP status codes.
 *  - Log every request through {@link RequestLogger}.
 *
 * Path layout:
 *   - GET  /docs/{documentPath}                      one document (200 with exists=false when absent)
 *   - GET  /query/{collectionPath}?orderBy=&direction=&afterValue=&afterId=&limit=
 *   - POST /commit                                   atomic batch of writes
 *   - GET  /admin/health                             basic health check
 *
 * Status mapping:
 *   IllegalArgumentException, INVALID_ARGUMENT -> 400
 *   PERMISSION_DENIED -> 403, NOT_FOUND -> 404, TRANSIENT -> 503, anything else -> 500
 */
public final class WebServer {
    private static final int MAX_BODY_BYTES = 10 * 1024 * 1024; // 10 MiB

    private final Undertow server;
    private final ObjectMapper json = WireCodec.MAPPER;
    private final DocumentService docs;

    public WebServer(int port, DocumentService docs) {
        this(port, "0.0.0.0", docs);
    }

    public WebServer(int port, String host, DocumentService docs) {
        this.docs = docs;
        this.server = Undertow.builder()
                .addHttpListener(port, host)
                .setHandler(exchange -> {
                    var path = exchange.getRequestPath();
                    var method = exchange.getRequestMethod().toString();
                    exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

                    if (path.startsWith("/docs/")) {
                        if (!"GET".equals(method)) {
                            reject(exchange, method, path, 405, "method not allowed");
                        } else {
                            handleGet(exchange, path.substring("/docs/".length()));
                        }
                    } else if (path.startsWith("/query/")) {
                        if (!"GET".equals(method)) {
                            reject(exchange, method, path, 405, "method not allowed");
                        } else {
                            handleQuery(exchange, path.substring("/query/".length()));
                        }
                    } else if ("/commit".equals(path)) {
                        if (!"POST".equals(method)) {
                            reject(exchange, method, path, 405, "method not allowed");
                        } else {
                            handleCommit(exchange);
                        }
                    } else if ("/admin/health".equals(path)) {
                        send(exchange, 200, Map.of("status", "ok"));
                        RequestLogger.logRequest(method, path, 200, 0, -1, null);
                    } else {
                        reject(exchange, method, path, 404, "not found");
                    }
                }).build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    // ---------- handlers ----------

    /** GET /docs/{documentPath} */
    private void handleGet(HttpServerExchange ex, String documentPath) {
        long start = System.nanoTime();
        int status = 200;
        long storeMs = -1L;
        Throwable error = null;
        try {
            long sStart = System.nanoTime();
            var dto = docs.get(documentPath);
            storeMs = (System.nanoTime() - sStart) / 1_000_000L;
            send(ex, status, dto);
        } catch (Exception e) {
            status = statusFor(e);
            error = e;
            sendError(ex, status, e);
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logRequest("GET", ex.getRequestPath(), status, totalMs, storeMs, error);
        }
    }

    /** GET /query/{collectionPath} */
    private void handleQuery(HttpServerExchange ex, String collectionPath) {
        long start = System.nanoTime();
        int status = 200;
        long storeMs = -1L;
        Throwable error = null;
        try {
            long sStart = System.nanoTime();
            var dto = docs.query(
                    collectionPath,
                    param(ex, "orderBy"),
                    param(ex, "direction"),
                    param(ex, "afterValue"),
                    param(ex, "afterId"),
                    param(ex, "limit")
            );
            storeMs = (System.nanoTime() - sStart) / 1_000_000L;
            send(ex, status, dto);
        } catch (Exception e) {
            status = statusFor(e);
            error = e;
            sendError(ex, status, e);
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logRequest("GET", ex.getRequestPath(), status, totalMs, storeMs, error);
        }
    }

    /** POST /commit */
    private void handleCommit(HttpServerExchange ex) {
        ex.getRequestReceiver().receiveFullBytes(
                (exchange, data) -> {
                    String path = exchange.getRequestPath();
                    long start = System.nanoTime();
                    int status = 200;
                    long storeMs = -1L;
                    Throwable error = null;

                    try {
                        if (data.length > MAX_BODY_BYTES) {
                            status = 413;
                            send(exchange, status, Map.of("error", "request body too large"));
                        } else {
                            var req = json.readValue(data, CommitRequest.class);
                            long sStart = System.nanoTime();
                            docs.commit(req);
                            storeMs = (System.nanoTime() - sStart) / 1_000_000L;
                            send(exchange, status, Map.of("ok", true));
                        }
                    } catch (JsonProcessingException jsonEx) {
                        status = 400;
                        error = jsonEx;
                        send(exchange, status, Map.of("error", "invalid JSON"));
                    } catch (Exception e) {
                        status = statusFor(e);
                        error = e;
                        sendError(exchange, status, e);
                    } finally {
                        long totalMs = (System.nanoTime() - start) / 1_000_000L;
                        RequestLogger.logRequest("POST", path, status, totalMs, storeMs, error);
                    }
                },
                (exchange, ioEx) -> {
                    int status = 400;
                    send(exchange, status, Map.of("error", "invalid request body"));
                    RequestLogger.logRequest("POST", exchange.getRequestPath(), status, 0, -1, ioEx);
                }
        );
    }

    // ---------- helpers ----------

    static int statusFor(Throwable e) {
        if (e instanceof IllegalArgumentException) {
            return 400;
        }
        if (e instanceof StoreException se) {
            return switch (se.kind()) {
                case INVALID_ARGUMENT -> 400;
                case PERMISSION_DENIED -> 403;
                case NOT_FOUND -> 404;
                case TRANSIENT -> 503;
            };
        }
        return 500;
    }

    private static String param(HttpServerExchange ex, String name) {
        Deque<String> values = ex.getQueryParameters().get(name);
        return values == null ? null : values.peekFirst();
    }

    private void reject(HttpServerExchange ex, String method, String path, int status, String message) {
        send(ex, status, Map.of("error", message));
        RequestLogger.logRequest(method, path, status, 0, -1, null);
    }

    private void sendError(HttpServerExchange ex, int status, Exception e) {
        String kind = e instanceof StoreException se ? se.kind().name() : e.getClass().getSimpleName();
        String message = e.getMessage() == null ? "" : e.getMessage();
        send(ex, status, Map.of("error", kind, "message", message));
    }

    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
