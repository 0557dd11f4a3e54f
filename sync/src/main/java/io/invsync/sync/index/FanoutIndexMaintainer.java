package io.invsync.sync.index;

import io.invsync.core.DocumentRef;
import io.invsync.core.DocumentStore;
import io.invsync.core.FieldValue;
import io.invsync.core.GroupRole;
import io.invsync.sync.Futures;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Best-effort maintenance of fan-out index records.
 * <p>
 * Both operations report failure through their result and never complete
 * exceptionally; the primary write they accompany has already succeeded.
 * Removing index records is the job of the cascading deleter.
 */
public final class FanoutIndexMaintainer {
    private static final Logger log = Logger.getLogger(FanoutIndexMaintainer.class.getName());

    public static final String ROLE = "role";
    public static final String UPDATED_AT = "updatedAt";
    public static final String CREATED_AT = "createdAt";

    private final DocumentStore store;
    private final IndexLayout layout;

    public FanoutIndexMaintainer(DocumentStore store, IndexLayout layout) {
        this.store = Objects.requireNonNull(store, "store");
        this.layout = Objects.requireNonNull(layout, "layout");
    }

    public IndexLayout layout() {
        return layout;
    }

    /**
     * Merge-write {@code {role, updatedAt}} into the member's index record.
     *
     * @return true if written, false if the write failed
     */
    public CompletableFuture<Boolean> upsert(String memberId, String rootId, GroupRole role) {
        Objects.requireNonNull(role, "role");
        DocumentRef ref;
        try {
            ref = layout.indexRecord(memberId, rootId);
        } catch (IllegalArgumentException e) {
            log.log(Level.WARNING, "index upsert skipped for member " + memberId + " of " + rootId, e);
            return CompletableFuture.completedFuture(false);
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(ROLE, role.storedName());
        fields.put(UPDATED_AT, FieldValue.SERVER_TIMESTAMP);
        return store.set(ref, fields, true).handle((ok, err) -> {
            if (err != null) {
                log.log(Level.WARNING, "index upsert failed for " + ref, Futures.unwrap(err));
                return false;
            }
            return true;
        });
    }

    /**
     * Create the owner's own index record if it is missing and the root exists.
     */
    public CompletableFuture<IndexRepair> ensureOwnerIndexed(String ownerId, String rootId) {
        DocumentRef indexRef;
        DocumentRef rootRef;
        try {
            indexRef = layout.indexRecord(ownerId, rootId);
            rootRef = layout.root(rootId);
        } catch (IllegalArgumentException e) {
            log.log(Level.WARNING, "owner index check skipped for " + ownerId + " of " + rootId, e);
            return CompletableFuture.completedFuture(IndexRepair.FAILED);
        }
        return store.get(indexRef)
                .thenCompose(index -> {
                    if (index.isPresent()) {
                        return CompletableFuture.completedFuture(IndexRepair.ALREADY_PRESENT);
                    }
                    return store.get(rootRef).thenCompose(root -> {
                        if (root.isEmpty()) {
                            return CompletableFuture.completedFuture(IndexRepair.ROOT_MISSING);
                        }
                        Map<String, Object> fields = new LinkedHashMap<>();
                        fields.put(ROLE, GroupRole.OWNER.storedName());
                        fields.put(CREATED_AT, FieldValue.SERVER_TIMESTAMP);
                        return store.set(indexRef, fields, true).thenApply(ok -> {
                            log.log(Level.INFO, "restored missing owner index {0}", indexRef);
                            return IndexRepair.CREATED;
                        });
                    });
                })
                .exceptionally(err -> {
                    log.log(Level.WARNING, "owner index check failed for " + indexRef, Futures.unwrap(err));
                    return IndexRepair.FAILED;
                });
    }
}
