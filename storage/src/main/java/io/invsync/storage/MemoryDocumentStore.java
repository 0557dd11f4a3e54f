package io.invsync.storage;

import io.invsync.core.CollectionRef;
import io.invsync.core.Cursor;
import io.invsync.core.Document;
import io.invsync.core.DocumentEvent;
import io.invsync.core.DocumentListener;
import io.invsync.core.DocumentRef;
import io.invsync.core.DocumentStore;
import io.invsync.core.FieldValue;
import io.invsync.core.PageQuery;
import io.invsync.core.StoreException;
import io.invsync.core.Subscription;
import io.invsync.core.ValueOrdering;
import io.invsync.core.WriteOp;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-process document store.
 * <p>
 * Responsibilities:
 *  - Keep documents per collection path, keyed by id.
 *  - Answer ordered page queries with cursor continuation.
 *  - Apply commits atomically, resolving server timestamps to one commit
 *    instant and skipping commits whose opId was already applied.
 *  - Fan out per-document change events to subscribers.
 * <p>
 * Event delivery:
 *  - Events are dispatched on {@code eventExecutor}, never while the store
 *    lock is held, so listeners may call back into the store.
 *  - Every write carries a store-wide sequence number. A subscription only
 *    delivers events newer than the last one it delivered, which keeps the
 *    per-document stream monotonic even on a multi-threaded executor.
 *  - The first event of a subscription is the document state at subscribe
 *    time (exists=false if absent).
 */
public final class MemoryDocumentStore implements DocumentStore {
    private static final Logger log = Logger.getLogger(MemoryDocumentStore.class.getName());

    // guarded by this
    private final Map<String, TreeMap<String, Stored>> collections = new HashMap<>();
    private final Map<String, List<Registration>> registrations = new HashMap<>();
    private long sequence;
    private Instant lastCommitTime = Instant.EPOCH;

    private final OpIdDeduper dedupe;
    private final Executor eventExecutor;
    private final Clock clock;

    /**
     * Store with a daemon single-threaded event dispatcher.
     */
    public MemoryDocumentStore(OpIdDeduper dedupe) {
        this(dedupe, Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "store-events");
            t.setDaemon(true);
            return t;
        }), Clock.systemUTC());
    }

    public MemoryDocumentStore(OpIdDeduper dedupe, Executor eventExecutor, Clock clock) {
        this.dedupe = Objects.requireNonNull(dedupe, "dedupe");
        this.eventExecutor = Objects.requireNonNull(eventExecutor, "eventExecutor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    // ---------- reads ----------

    @Override
    public CompletableFuture<List<Document>> fetchPage(PageQuery query) {
        Objects.requireNonNull(query, "query");
        List<Document> candidates;
        synchronized (this) {
            TreeMap<String, Stored> docs = collections.get(query.collection().path());
            if (docs == null) {
                return CompletableFuture.completedFuture(List.of());
            }
            candidates = new ArrayList<>(docs.size());
            for (Stored s : docs.values()) {
                if (query.orderedById() || s.doc.contains(query.orderField())) {
                    candidates.add(s.doc);
                }
            }
        }

        Comparator<Document> order = comparator(query.orderField());
        if (query.direction() == PageQuery.Direction.DESCENDING) {
            order = order.reversed();
        }
        candidates.sort(order);

        List<Document> page = new ArrayList<>(Math.min(query.limit(), candidates.size()));
        Cursor after = query.after();
        boolean descending = query.direction() == PageQuery.Direction.DESCENDING;
        for (Document d : candidates) {
            if (after != null) {
                int c = compareToCursor(d, query.orderField(), after);
                if (descending ? c >= 0 : c <= 0) {
                    continue;
                }
            }
            page.add(d);
            if (page.size() == query.limit()) {
                break;
            }
        }
        return CompletableFuture.completedFuture(List.copyOf(page));
    }

    @Override
    public synchronized CompletableFuture<Optional<Document>> get(DocumentRef ref) {
        Objects.requireNonNull(ref, "ref");
        Stored s = lookup(ref);
        return CompletableFuture.completedFuture(Optional.ofNullable(s == null ? null : s.doc));
    }

    /** Number of documents currently in a collection. */
    public synchronized int count(CollectionRef collection) {
        TreeMap<String, Stored> docs = collections.get(collection.path());
        return docs == null ? 0 : docs.size();
    }

    /** Number of live subscriptions across all documents. */
    public synchronized int subscriptionCount() {
        return registrations.values().stream().mapToInt(List::size).sum();
    }

    // ---------- subscriptions ----------

    @Override
    public Subscription subscribe(DocumentRef ref, DocumentListener listener) {
        Objects.requireNonNull(ref, "ref");
        Objects.requireNonNull(listener, "listener");

        Registration reg = new Registration(ref, listener);
        DocumentEvent initial;
        long seq;
        synchronized (this) {
            registrations.computeIfAbsent(ref.path(), p -> new CopyOnWriteArrayList<>()).add(reg);
            Stored s = lookup(ref);
            initial = s == null ? DocumentEvent.missing(ref) : DocumentEvent.of(s.doc);
            seq = sequence;
        }
        dispatch(List.of(new Delivery(reg, initial, seq)));
        return reg;
    }

    // ---------- writes ----------

    @Override
    public CompletableFuture<Void> commit(List<WriteOp> writes, String opId) {
        Objects.requireNonNull(writes, "writes");
        Objects.requireNonNull(opId, "opId");
        if (writes.size() > MAX_BATCH_OPERATIONS) {
            return CompletableFuture.failedFuture(new StoreException(
                    StoreException.Kind.INVALID_ARGUMENT,
                    "batch of " + writes.size() + " operations exceeds limit " + MAX_BATCH_OPERATIONS));
        }

        List<Delivery> deliveries = new ArrayList<>();
        synchronized (this) {
            if (!dedupe.firstTime(opId)) {
                log.log(Level.FINE, "commit {0} already applied, acknowledging", opId);
                return CompletableFuture.completedFuture(null);
            }

            Instant now = clock.instant();
            if (!now.isAfter(lastCommitTime)) {
                now = lastCommitTime.plusNanos(1_000);
            }
            lastCommitTime = now;
            long seq = ++sequence;

            for (WriteOp op : writes) {
                DocumentEvent event = apply(op, now, seq);
                if (event == null) {
                    continue;
                }
                List<Registration> regs = registrations.get(op.ref().path());
                if (regs != null) {
                    for (Registration r : regs) {
                        deliveries.add(new Delivery(r, event, seq));
                    }
                }
            }
        }
        dispatch(deliveries);
        return CompletableFuture.completedFuture(null);
    }

    /** Apply one write under the store lock; returns the event to publish, or null. */
    private DocumentEvent apply(WriteOp op, Instant now, long seq) {
        DocumentRef ref = op.ref();
        if (op instanceof WriteOp.Delete) {
            TreeMap<String, Stored> docs = collections.get(ref.parent().path());
            if (docs == null || docs.remove(ref.id()) == null) {
                return null;
            }
            if (docs.isEmpty()) {
                collections.remove(ref.parent().path());
            }
            return DocumentEvent.missing(ref);
        }

        WriteOp.Set set = (WriteOp.Set) op;
        Map<String, Object> fields = new LinkedHashMap<>();
        Stored existing = lookup(ref);
        if (set.merge() && existing != null) {
            fields.putAll(existing.doc.fields());
        }
        set.fields().forEach((k, v) -> fields.put(k, v == FieldValue.SERVER_TIMESTAMP ? now : v));

        Document doc = new Document(ref, fields, now);
        collections.computeIfAbsent(ref.parent().path(), p -> new TreeMap<>()).put(ref.id(), new Stored(doc, seq));
        return DocumentEvent.of(doc);
    }

    private Stored lookup(DocumentRef ref) {
        TreeMap<String, Stored> docs = collections.get(ref.parent().path());
        return docs == null ? null : docs.get(ref.id());
    }

    private void dispatch(List<Delivery> deliveries) {
        for (Delivery d : deliveries) {
            eventExecutor.execute(() -> d.registration.deliver(d.event, d.sequence));
        }
    }

    private synchronized void unregister(Registration reg) {
        List<Registration> regs = registrations.get(reg.ref.path());
        if (regs != null) {
            regs.remove(reg);
            if (regs.isEmpty()) {
                registrations.remove(reg.ref.path());
            }
        }
    }

    // ---------- ordering ----------

    private static Comparator<Document> comparator(String orderField) {
        Comparator<Document> byId = Comparator.comparing(Document::id);
        if (PageQuery.DOCUMENT_ID.equals(orderField)) {
            return byId;
        }
        return Comparator.<Document, Object>comparing(d -> d.get(orderField), ValueOrdering.INSTANCE).thenComparing(byId);
    }

    private static int compareToCursor(Document d, String orderField, Cursor cursor) {
        if (!PageQuery.DOCUMENT_ID.equals(orderField)) {
            int c = ValueOrdering.INSTANCE.compare(d.get(orderField), cursor.orderValue());
            if (c != 0) {
                return c;
            }
        }
        return d.id().compareTo(cursor.documentId());
    }

    // ---------- internals ----------

    private record Stored(Document doc, long sequence) {}

    private record Delivery(Registration registration, DocumentEvent event, long sequence) {}

    private final class Registration implements Subscription {
        private final DocumentRef ref;
        private final DocumentListener listener;
        private volatile boolean active = true;
        private long lastDelivered = -1; // guarded by this registration

        Registration(DocumentRef ref, DocumentListener listener) {
            this.ref = ref;
            this.listener = listener;
        }

        void deliver(DocumentEvent event, long seq) {
            synchronized (this) {
                if (!active || seq <= lastDelivered) {
                    return;
                }
                lastDelivered = seq;
                try {
                    listener.onEvent(event);
                } catch (RuntimeException e) {
                    log.log(Level.WARNING, "listener for " + ref + " failed", e);
                }
            }
        }

        @Override
        public void close() {
            if (active) {
                active = false;
                unregister(this);
            }
        }
    }
}
