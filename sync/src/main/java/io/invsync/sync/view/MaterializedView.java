package io.invsync.sync.view;

import io.invsync.core.CollectionRef;
import io.invsync.core.Cursor;
import io.invsync.core.Document;
import io.invsync.core.DocumentEvent;
import io.invsync.core.DocumentRef;
import io.invsync.core.DocumentStore;
import io.invsync.core.StoreException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Ordered, deduplicated in-memory projection of one remote collection.
 * <p>
 * Two sources write into the view:
 *  - page ingestion (cursor-paginated bulk fetch), which appends new ids at
 *    the tail in fetch order and opens one subscription per new id;
 *  - per-document subscription events, which replace fields in place,
 *    append unknown ids at the tail, or remove deleted ids.
 * <p>
 * Merge rules:
 *  - each id appears at most once; position is insertion order, never re-sorted;
 *  - page data for an id that already has an open subscription is ignored,
 *    because the subscription is the authoritative (newer) source;
 *  - a deleted document loses its entry and its subscription;
 *  - an entry whose subscribe call failed keeps its page data, and the
 *    subscribe is retried on every later page.
 * <p>
 * Serialization:
 *  - every change runs under one lock; a change requested while another is
 *    being applied on the same thread (a listener calling back in) is queued
 *    and applied right after, so changes never interleave;
 *  - after each applied change the snapshot listener receives an immutable
 *    copy of the ordered entries.
 * <p>
 * Generations: reset() bumps the generation, and page results fetched for an
 * older generation are discarded. After dispose() every change is discarded.
 */
public final class MaterializedView {
    private static final Logger log = Logger.getLogger(MaterializedView.class.getName());

    private final CollectionRef collection;
    private final String orderField;
    private final SubscriptionRegistry registry;
    private final Consumer<List<ViewEntry>> snapshotListener;

    private final Object lock = new Object();

    // guarded by lock
    private final Map<String, ViewEntry> entries = new LinkedHashMap<>();
    private final ArrayDeque<Runnable> pending = new ArrayDeque<>();
    private final Set<String> unsubscribed = new LinkedHashSet<>();
    private boolean applying;
    private Cursor cursor;
    private boolean reachedEnd;
    private long generation;
    private boolean disposed;

    private volatile List<ViewEntry> snapshot = List.of();

    /**
     * @param collection       collection whose documents this view projects
     * @param orderField       order field of the page queries, used to derive cursors
     * @param store            store used to open per-document subscriptions
     * @param snapshotListener receives every published snapshot; called under the
     *                         view lock, so it must not block
     */
    public MaterializedView(
            CollectionRef collection,
            String orderField,
            DocumentStore store,
            Consumer<List<ViewEntry>> snapshotListener
    ) {
        this.collection = Objects.requireNonNull(collection, "collection");
        this.orderField = Objects.requireNonNull(orderField, "orderField");
        this.snapshotListener = Objects.requireNonNull(snapshotListener, "snapshotListener");
        this.registry = new SubscriptionRegistry(store, new SubscriptionRegistry.EventSink() {
            @Override
            public void onEvent(SubscriptionRegistry.Handle handle, DocumentEvent event) {
                onSubscriptionEvent(handle, event);
            }

            @Override
            public void onError(SubscriptionRegistry.Handle handle, StoreException error) {
                // Subscription stays open; the store re-delivers once the stream recovers.
                log.log(Level.FINE, "stream error on " + handle.ref() + ", keeping subscription", error);
            }
        });
    }

    // ---------- reads ----------

    /** Current ordered snapshot; immutable. */
    public List<ViewEntry> snapshot() {
        return snapshot;
    }

    public CollectionRef collection() {
        return collection;
    }

    public Cursor cursor() {
        synchronized (lock) {
            return cursor;
        }
    }

    public boolean reachedEnd() {
        synchronized (lock) {
            return reachedEnd;
        }
    }

    public long generation() {
        synchronized (lock) {
            return generation;
        }
    }

    public boolean disposed() {
        synchronized (lock) {
            return disposed;
        }
    }

    /** Ids with an open subscription. */
    public Set<String> subscribedIds() {
        return registry.openIds();
    }

    // ---------- state transitions ----------

    /**
     * Merge one fetched page.
     *
     * @param pageGeneration generation observed when the page was requested
     * @return future completing with true if the page was applied, false if it
     *         was discarded (view reset or disposed since the request)
     */
    public CompletableFuture<Boolean> ingestPage(long pageGeneration, List<Document> documents) {
        Objects.requireNonNull(documents, "documents");
        CompletableFuture<Boolean> applied = new CompletableFuture<>();
        mutate(() -> {
            if (disposed || pageGeneration != generation) {
                log.log(Level.FINE, "discarding stale page for {0} (generation {1}, current {2})",
                        new Object[]{collection, pageGeneration, generation});
                applied.complete(false);
                return false;
            }
            retryUnsubscribed();
            if (documents.isEmpty()) {
                reachedEnd = true;
                applied.complete(true);
                return true;
            }
            for (Document doc : documents) {
                String id = doc.id();
                ViewEntry existing = entries.get(id);
                if (existing == null) {
                    entries.put(id, new ViewEntry(id, doc.fields(), ViewEntry.Source.PAGE));
                    openSubscription(doc.ref());
                } else if (!registry.isOpen(id)) {
                    entries.put(id, new ViewEntry(id, doc.fields(), ViewEntry.Source.PAGE));
                }
            }
            cursor = Cursor.after(documents.get(documents.size() - 1), orderField);
            applied.complete(true);
            return true;
        });
        return applied;
    }

    /**
     * Full reload: drop entries, close all subscriptions, forget the cursor
     * and the end flag. Pages requested before the reset are discarded.
     */
    public void reset() {
        mutate(() -> {
            if (disposed) {
                return false;
            }
            generation++;
            int closed = registry.closeAll();
            entries.clear();
            unsubscribed.clear();
            cursor = null;
            reachedEnd = false;
            log.log(Level.FINE, "reset view of {0}, closed {1} subscriptions", new Object[]{collection, closed});
            return true;
        });
    }

    /**
     * Terminal teardown. When this returns every subscription is closed and
     * no later page or event is applied.
     */
    public void dispose() {
        mutate(() -> {
            if (disposed) {
                return false;
            }
            disposed = true;
            generation++;
            int closed = registry.closeAll();
            entries.clear();
            unsubscribed.clear();
            log.log(Level.FINE, "disposed view of {0}, closed {1} subscriptions", new Object[]{collection, closed});
            return true;
        });
    }

    private void onSubscriptionEvent(SubscriptionRegistry.Handle handle, DocumentEvent event) {
        mutate(() -> {
            if (disposed || !registry.isCurrent(handle)) {
                return false;
            }
            String id = handle.id();
            if (event.exists()) {
                // Replacing an existing key keeps its position; unknown ids land at the tail.
                entries.put(id, new ViewEntry(id, event.fields(), ViewEntry.Source.SUBSCRIPTION));
            } else {
                entries.remove(id);
                registry.close(id);
            }
            return true;
        });
    }

    private void openSubscription(DocumentRef ref) {
        try {
            registry.open(ref);
            unsubscribed.remove(ref.id());
        } catch (RuntimeException e) {
            unsubscribed.add(ref.id());
            log.log(Level.WARNING, "could not subscribe to " + ref + ", retrying with the next page", e);
        }
    }

    private void retryUnsubscribed() {
        for (String id : new ArrayList<>(unsubscribed)) {
            if (entries.containsKey(id)) {
                openSubscription(collection.document(id));
            } else {
                unsubscribed.remove(id);
            }
        }
    }

    // ---------- serialization ----------

    /** A change returns true if it modified state and a snapshot must be published. */
    @FunctionalInterface
    private interface Change {
        boolean apply();
    }

    private void mutate(Change change) {
        synchronized (lock) {
            if (applying) {
                pending.add(() -> applyAndPublish(change));
                return;
            }
            applying = true;
            try {
                applyAndPublish(change);
                Runnable next;
                while ((next = pending.poll()) != null) {
                    next.run();
                }
            } finally {
                applying = false;
            }
        }
    }

    private void applyAndPublish(Change change) {
        if (!change.apply()) {
            return;
        }
        List<ViewEntry> published = List.copyOf(entries.values());
        snapshot = published;
        try {
            snapshotListener.accept(published);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "snapshot listener failed for " + collection, e);
        }
    }
}
