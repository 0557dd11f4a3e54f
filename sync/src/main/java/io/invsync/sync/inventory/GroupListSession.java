package io.invsync.sync.inventory;

import io.invsync.core.DocumentEvent;
import io.invsync.core.DocumentStore;
import io.invsync.core.GroupRole;
import io.invsync.core.StoreException;
import io.invsync.sync.view.PageOutcome;
import io.invsync.sync.view.PagedSession;
import io.invsync.sync.view.SubscriptionRegistry;
import io.invsync.sync.view.ViewSession;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A user's group list: the user's group index joined with each group's root
 * document.
 * <p>
 * Every index entry gets one live subscription to its {@code groups/{groupId}}
 * root. A row is listed only while that root exists, so index records left
 * behind by an interrupted deletion stay hidden, and a renamed group is
 * updated in place. Rows follow {@link GroupSummary#LIST_ORDER}.
 * <p>
 * Page futures complete once every group listed so far has reported its root
 * at least once, or failed to.
 * <p>
 * Lock order: index view, then this session, then the root registry.
 */
public final class GroupListSession implements PagedSession<GroupSummary> {
    private static final Logger log = Logger.getLogger(GroupListSession.class.getName());

    private final ViewSession<GroupMembership> index;
    private final SubscriptionRegistry roots;
    private final Consumer<List<GroupSummary>> listener;

    private final Object lock = new Object();

    // guarded by lock
    private final Map<String, GroupRole> roles = new HashMap<>();
    private final Map<String, GroupSummary> rows = new HashMap<>();
    private final Map<String, CompletableFuture<Void>> unresolved = new HashMap<>();
    private boolean ended;

    private volatile List<GroupSummary> snapshot = List.of();

    /**
     * @param indexSession builds the index session, given the listener it must report to
     * @param listener     receives the sorted rows after every change; must not block
     */
    GroupListSession(
            DocumentStore store,
            Function<Consumer<List<GroupMembership>>, ViewSession<GroupMembership>> indexSession,
            Consumer<List<GroupSummary>> listener
    ) {
        Objects.requireNonNull(store, "store");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.roots = new SubscriptionRegistry(store, new SubscriptionRegistry.EventSink() {
            @Override
            public void onEvent(SubscriptionRegistry.Handle handle, DocumentEvent event) {
                onRootEvent(handle, event);
            }

            @Override
            public void onError(SubscriptionRegistry.Handle handle, StoreException error) {
                onRootError(handle, error);
            }
        });
        this.index = indexSession.apply(this::onIndexChanged);
    }

    @Override
    public CompletableFuture<PageOutcome> startSession() {
        return index.startSession().thenCompose(this::afterRootsResolved);
    }

    @Override
    public CompletableFuture<PageOutcome> onNextPageNeeded() {
        return index.onNextPageNeeded().thenCompose(this::afterRootsResolved);
    }

    @Override
    public List<GroupSummary> currentSnapshot() {
        return snapshot;
    }

    @Override
    public void endSession() {
        index.endSession();
        List<CompletableFuture<Void>> waiting;
        synchronized (lock) {
            if (ended) {
                return;
            }
            ended = true;
            roots.closeAll();
            roles.clear();
            rows.clear();
            snapshot = List.of();
            waiting = new ArrayList<>(unresolved.values());
            unresolved.clear();
        }
        waiting.forEach(GroupListSession::complete);
    }

    /** Group ids with an open root subscription. */
    public Set<String> subscribedGroupIds() {
        return roots.openIds();
    }

    private CompletableFuture<PageOutcome> afterRootsResolved(PageOutcome outcome) {
        CompletableFuture<?>[] waiting;
        synchronized (lock) {
            waiting = unresolved.values().toArray(new CompletableFuture<?>[0]);
        }
        return CompletableFuture.allOf(waiting).thenApply(v -> outcome);
    }

    private void onIndexChanged(List<GroupMembership> memberships) {
        List<CompletableFuture<Void>> dropped = new ArrayList<>();
        synchronized (lock) {
            if (ended) {
                return;
            }
            boolean changed = false;
            Set<String> listed = new HashSet<>();
            for (GroupMembership m : memberships) {
                String id = m.groupId();
                listed.add(id);
                GroupRole previous = roles.put(id, m.role());
                if (previous == null) {
                    openRoot(id);
                } else if (previous != m.role()) {
                    GroupSummary row = rows.get(id);
                    if (row != null) {
                        rows.put(id, row.withRole(m.role()));
                        changed = true;
                    }
                }
            }
            for (String id : new ArrayList<>(roles.keySet())) {
                if (!listed.contains(id)) {
                    roles.remove(id);
                    roots.close(id);
                    changed |= rows.remove(id) != null;
                    CompletableFuture<Void> first = unresolved.remove(id);
                    if (first != null) {
                        dropped.add(first);
                    }
                }
            }
            if (changed) {
                publish();
            }
        }
        dropped.forEach(GroupListSession::complete);
    }

    /** Called under lock. */
    private void openRoot(String groupId) {
        // registered first: the store may deliver the initial event from inside open()
        unresolved.put(groupId, new CompletableFuture<>());
        try {
            roots.open(InventorySchema.group(groupId));
        } catch (RuntimeException e) {
            // forgotten, so the next index change tries again
            roles.remove(groupId);
            unresolved.remove(groupId).complete(null);
            log.log(Level.WARNING, "could not subscribe to group " + groupId, e);
        }
    }

    private void onRootEvent(SubscriptionRegistry.Handle handle, DocumentEvent event) {
        CompletableFuture<Void> first;
        synchronized (lock) {
            if (ended || !roots.isCurrent(handle)) {
                return;
            }
            String id = handle.id();
            first = unresolved.remove(id);
            applyRootEvent(id, event);
        }
        complete(first);
    }

    private void onRootError(SubscriptionRegistry.Handle handle, StoreException error) {
        log.log(Level.FINE, "stream error on " + handle.ref() + ", keeping subscription", error);
        CompletableFuture<Void> first;
        synchronized (lock) {
            first = roots.isCurrent(handle) ? unresolved.remove(handle.id()) : null;
        }
        complete(first);
    }

    /** Called under lock. */
    private void applyRootEvent(String id, DocumentEvent event) {
        GroupRole role = roles.get(id);
        if (role == null) {
            return;
        }
        if (event.exists()) {
            Object name = event.fields().get(InventorySchema.NAME);
            Object description = event.fields().get(InventorySchema.DESCRIPTION);
            rows.put(id, new GroupSummary(
                    id,
                    name instanceof String s && !s.isBlank() ? s : GroupSummary.DEFAULT_NAME,
                    description instanceof String d ? d : null,
                    role));
        } else {
            log.log(Level.FINE, "group {0} is indexed but has no root, hiding it", id);
            if (rows.remove(id) == null) {
                return;
            }
        }
        publish();
    }

    private static void complete(CompletableFuture<Void> future) {
        if (future != null) {
            future.complete(null);
        }
    }

    private void publish() {
        List<GroupSummary> sorted = rows.values().stream().sorted(GroupSummary.LIST_ORDER).toList();
        snapshot = sorted;
        try {
            listener.accept(sorted);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "group list listener failed", e);
        }
    }
}
