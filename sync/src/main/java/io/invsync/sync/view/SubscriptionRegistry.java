package io.invsync.sync.view;

import io.invsync.core.DocumentEvent;
import io.invsync.core.DocumentListener;
import io.invsync.core.DocumentRef;
import io.invsync.core.DocumentStore;
import io.invsync.core.StoreException;
import io.invsync.core.Subscription;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Owns the live per-document subscriptions of one view.
 * <p>
 * Invariants:
 *  - at most one open handle per document id; open() is idempotent;
 *  - the key set of the handle map equals the set of open subscriptions;
 *  - a handle that was closed (directly or via closeAll) never forwards
 *    another event, even if the store still delivers one.
 * <p>
 * Events are forwarded to an {@link EventSink} together with the handle that
 * received them, so the sink can check {@link #isCurrent(Handle)} under its
 * own lock before applying the event.
 */
public final class SubscriptionRegistry {

    /** Receiver of events from every handle of this registry. */
    public interface EventSink {
        void onEvent(Handle handle, DocumentEvent event);

        void onError(Handle handle, StoreException error);
    }

    private final DocumentStore store;
    private final EventSink sink;
    private final Map<String, Handle> handles = new LinkedHashMap<>(); // guarded by this

    public SubscriptionRegistry(DocumentStore store, EventSink sink) {
        this.store = Objects.requireNonNull(store, "store");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Open a subscription for {@code ref}, or return the handle already open
     * for its id.
     */
    public synchronized Handle open(DocumentRef ref) {
        Objects.requireNonNull(ref, "ref");
        Handle existing = handles.get(ref.id());
        if (existing != null) {
            return existing;
        }
        Handle h = new Handle(ref);
        handles.put(ref.id(), h);
        try {
            h.attach(store.subscribe(ref, h));
        } catch (RuntimeException e) {
            handles.remove(ref.id());
            h.close();
            throw e;
        }
        return h;
    }

    /** Close the subscription for {@code id}; returns false if none was open. */
    public synchronized boolean close(String id) {
        Handle h = handles.remove(id);
        if (h == null) {
            return false;
        }
        h.close();
        return true;
    }

    /** Close every open subscription; returns how many were closed. */
    public synchronized int closeAll() {
        List<Handle> all = new ArrayList<>(handles.values());
        handles.clear();
        for (Handle h : all) {
            h.close();
        }
        return all.size();
    }

    public synchronized boolean isOpen(String id) {
        return handles.containsKey(id);
    }

    /** True if {@code h} is the open handle for its id. */
    public synchronized boolean isCurrent(Handle h) {
        return h.active && handles.get(h.ref.id()) == h;
    }

    public synchronized Set<String> openIds() {
        return Set.copyOf(handles.keySet());
    }

    public synchronized int size() {
        return handles.size();
    }

    /** One open subscription. */
    public final class Handle implements DocumentListener {
        private final DocumentRef ref;
        private volatile boolean active = true;
        private Subscription subscription; // guarded by the registry

        private Handle(DocumentRef ref) {
            this.ref = ref;
        }

        public DocumentRef ref() {
            return ref;
        }

        public String id() {
            return ref.id();
        }

        @Override
        public void onEvent(DocumentEvent event) {
            if (active) {
                sink.onEvent(this, event);
            }
        }

        @Override
        public void onError(StoreException error) {
            if (active) {
                sink.onError(this, error);
            }
        }

        private void attach(Subscription s) {
            if (active) {
                subscription = s;
            } else {
                s.close();
            }
        }

        private void close() {
            active = false;
            if (subscription != null) {
                subscription.close();
                subscription = null;
            }
        }
    }
}
