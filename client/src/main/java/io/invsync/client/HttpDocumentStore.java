package io.invsync.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.invsync.core.Document;
import io.invsync.core.DocumentEvent;
import io.invsync.core.DocumentListener;
import io.invsync.core.DocumentRef;
import io.invsync.core.DocumentStore;
import io.invsync.core.PageQuery;
import io.invsync.core.StoreException;
import io.invsync.core.Subscription;
import io.invsync.core.WriteOp;
import io.invsync.core.wire.DocumentResponse;
import io.invsync.core.wire.QueryResponse;
import io.invsync.core.wire.WireCodec;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link DocumentStore} backed by a remote document server over HTTP.
 *
 * Talks to:
 *   GET  /docs/{documentPath}
 *   GET  /query/{collectionPath}?orderBy=&direction=&afterValue=&afterId=&limit=
 *   POST /commit
 *
 * HTTP statuses map back to {@link StoreException.Kind}: 400 -> INVALID_ARGUMENT,
 * 403 -> PERMISSION_DENIED, 404 -> NOT_FOUND, anything else and I/O errors -> TRANSIENT.
 * <p>
 * The server has no push channel, so subscriptions poll the document at a
 * fixed interval and emit an event when its existence or update time
 * changes. The first poll always emits.
 */
public final class HttpDocumentStore implements DocumentStore, AutoCloseable {
    private static final Logger log = Logger.getLogger(HttpDocumentStore.class.getName());

    private final URI baseUri;
    private final HttpClient client;
    private final Duration pollInterval;
    private final ScheduledExecutorService poller;

    public HttpDocumentStore(URI baseUri, Duration pollInterval) {
        Objects.requireNonNull(baseUri, "baseUri");
        // endpoints resolve relative to the base, keeping any path prefix
        String base = baseUri.toString();
        this.baseUri = base.endsWith("/") ? baseUri : URI.create(base + "/");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
        this.poller = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "doc-poller");
            t.setDaemon(true);
            return t;
        });
    }

    // ---------- reads ----------

    @Override
    public CompletableFuture<List<Document>> fetchPage(PageQuery query) {
        StringBuilder q = new StringBuilder()
                .append("orderBy=").append(encode(query.orderField()))
                .append("&direction=").append(query.direction() == PageQuery.Direction.DESCENDING ? "desc" : "asc")
                .append("&limit=").append(query.limit());
        if (query.after() != null) {
            q.append("&afterId=").append(encode(query.after().documentId()));
            if (!query.orderedById()) {
                q.append("&afterValue=").append(encode(WireCodec.encodeCursorValue(query.after().orderValue())));
            }
        }
        URI uri = endpoint("query/" + encodePath(query.collection().path()) + "?" + q);
        return send(HttpRequest.newBuilder(uri).GET().build())
                .thenApply(body -> {
                    QueryResponse dto = parse(body, QueryResponse.class);
                    List<Document> docs = new ArrayList<>(dto.documents == null ? 0 : dto.documents.size());
                    if (dto.documents != null) {
                        for (DocumentResponse d : dto.documents) {
                            docs.add(WireCodec.fromResponse(d));
                        }
                    }
                    return docs;
                });
    }

    @Override
    public CompletableFuture<Optional<Document>> get(DocumentRef ref) {
        return fetchDocument(ref).thenApply(dto -> dto.exists ? Optional.of(WireCodec.fromResponse(dto)) : Optional.empty());
    }

    private CompletableFuture<DocumentResponse> fetchDocument(DocumentRef ref) {
        URI uri = endpoint("docs/" + encodePath(ref.path()));
        return send(HttpRequest.newBuilder(uri).GET().build())
                .thenApply(body -> parse(body, DocumentResponse.class));
    }

    // ---------- writes ----------

    @Override
    public CompletableFuture<Void> commit(List<WriteOp> writes, String opId) {
        Objects.requireNonNull(writes, "writes");
        if (writes.size() > MAX_BATCH_OPERATIONS) {
            return CompletableFuture.failedFuture(new StoreException(
                    StoreException.Kind.INVALID_ARGUMENT,
                    "batch of " + writes.size() + " operations exceeds limit " + MAX_BATCH_OPERATIONS));
        }
        byte[] body;
        try {
            body = WireCodec.MAPPER.writeValueAsBytes(WireCodec.toRequest(writes, opId));
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(new StoreException(
                    StoreException.Kind.INVALID_ARGUMENT, "cannot encode commit", e));
        }
        HttpRequest req = HttpRequest.newBuilder(endpoint("commit"))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                .build();
        return send(req).thenApply(ignored -> null);
    }

    // ---------- subscriptions ----------

    @Override
    public Subscription subscribe(DocumentRef ref, DocumentListener listener) {
        Objects.requireNonNull(ref, "ref");
        Objects.requireNonNull(listener, "listener");
        var sub = new PollingSubscription(ref, listener);
        sub.task = poller.scheduleWithFixedDelay(sub::poll, 0, pollInterval.toMillis(), TimeUnit.MILLISECONDS);
        if (!sub.active) {
            sub.task.cancel(false);
        }
        return sub;
    }

    @Override
    public void close() {
        poller.shutdownNow();
    }

    private final class PollingSubscription implements Subscription {
        private final DocumentRef ref;
        private final DocumentListener listener;
        private volatile boolean active = true;
        private volatile ScheduledFuture<?> task;

        // touched only by the poll task, which never overlaps itself
        private boolean polled;
        private boolean lastExists;
        private String lastUpdateTime;

        PollingSubscription(DocumentRef ref, DocumentListener listener) {
            this.ref = ref;
            this.listener = listener;
        }

        void poll() {
            if (!active) {
                return;
            }
            DocumentResponse dto;
            try {
                dto = fetchDocument(ref).join();
            } catch (CompletionException e) {
                StoreException error = e.getCause() instanceof StoreException se
                        ? se
                        : new StoreException(StoreException.Kind.TRANSIENT, "poll of " + ref + " failed", e.getCause());
                if (active) {
                    try {
                        listener.onError(error);
                    } catch (RuntimeException listenerFailure) {
                        log.log(Level.WARNING, "error listener for " + ref + " failed", listenerFailure);
                    }
                }
                return;
            }
            boolean changed = !polled || dto.exists != lastExists || !Objects.equals(dto.updateTime, lastUpdateTime);
            polled = true;
            lastExists = dto.exists;
            lastUpdateTime = dto.updateTime;
            if (changed && active) {
                try {
                    DocumentEvent event = WireCodec.toEvent(dto);
                    listener.onEvent(event);
                } catch (RuntimeException e) {
                    log.log(Level.WARNING, "listener for " + ref + " failed", e);
                }
            }
        }

        @Override
        public void close() {
            active = false;
            ScheduledFuture<?> t = task;
            if (t != null) {
                t.cancel(false);
            }
        }
    }

    // ---------- HTTP plumbing ----------

    URI endpoint(String relative) {
        return baseUri.resolve(relative);
    }

    private CompletableFuture<String> send(HttpRequest req) {
        return client.sendAsync(req, HttpResponse.BodyHandlers.ofString())
                .handle((resp, err) -> {
                    if (err != null) {
                        Throwable cause = err instanceof CompletionException && err.getCause() != null ? err.getCause() : err;
                        throw new StoreException(StoreException.Kind.TRANSIENT,
                                req.method() + " " + req.uri() + " failed: " + cause.getMessage(), cause);
                    }
                    if (resp.statusCode() != 200) {
                        throw new StoreException(kindFor(resp.statusCode()),
                                req.method() + " " + req.uri().getPath() + " returned HTTP " + resp.statusCode() + ": " + resp.body());
                    }
                    return resp.body();
                });
    }

    static StoreException.Kind kindFor(int status) {
        return switch (status) {
            case 400, 413 -> StoreException.Kind.INVALID_ARGUMENT;
            case 403 -> StoreException.Kind.PERMISSION_DENIED;
            case 404 -> StoreException.Kind.NOT_FOUND;
            default -> StoreException.Kind.TRANSIENT;
        };
    }

    private static <T> T parse(String body, Class<T> type) {
        try {
            return WireCodec.MAPPER.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new StoreException(StoreException.Kind.TRANSIENT, "malformed response: " + e.getOriginalMessage(), e);
        }
    }

    private static String encodePath(String path) {
        String[] segments = path.split("/");
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < segments.length; i++) {
            if (i > 0) {
                out.append('/');
            }
            out.append(encode(segments[i]));
        }
        return out.toString();
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
