package io.invsync.sync.inventory;

import io.invsync.core.CollectionRef;
import io.invsync.core.DocumentRef;
import io.invsync.core.DocumentStore;
import io.invsync.core.FieldValue;
import io.invsync.core.GroupRole;
import io.invsync.core.StoreException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Item writes for personal and group inventories. Every save stamps
 * {@code updatedAt} with the commit time.
 */
public final class ItemService {

    private final DocumentStore store;

    public ItemService(DocumentStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * Create ({@code itemId == null}) or update a personal item.
     *
     * @return ref of the saved item
     */
    public CompletableFuture<DocumentRef> saveUserItem(String uid, String itemId, String name, String description, long quantity) {
        return save(InventorySchema.userItems(uid), itemId, name, description, quantity);
    }

    /** Create or update a group item; only owners and admins may edit. */
    public CompletableFuture<DocumentRef> saveGroupItem(
            String groupId, GroupRole actingRole, String itemId, String name, String description, long quantity) {
        if (!actingRole.canEditItems()) {
            return CompletableFuture.failedFuture(new StoreException(
                    StoreException.Kind.PERMISSION_DENIED, actingRole.storedName() + " cannot edit group items"));
        }
        return save(InventorySchema.groupItems(groupId), itemId, name, description, quantity);
    }

    public CompletableFuture<Void> deleteUserItem(String uid, String itemId) {
        return store.delete(InventorySchema.userItems(uid).document(itemId));
    }

    public CompletableFuture<Void> deleteGroupItem(String groupId, GroupRole actingRole, String itemId) {
        if (!actingRole.canEditItems()) {
            return CompletableFuture.failedFuture(new StoreException(
                    StoreException.Kind.PERMISSION_DENIED, actingRole.storedName() + " cannot edit group items"));
        }
        return store.delete(InventorySchema.groupItems(groupId).document(itemId));
    }

    private CompletableFuture<DocumentRef> save(
            CollectionRef items, String itemId, String name, String description, long quantity) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("item name must not be blank");
        }
        if (quantity < 0) {
            throw new IllegalArgumentException("quantity must be >= 0, got " + quantity);
        }
        boolean creating = itemId == null;
        DocumentRef ref = items.document(creating ? UUID.randomUUID().toString() : itemId);

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(InventorySchema.NAME, name.trim());
        fields.put(InventorySchema.DESCRIPTION, description == null || description.isBlank() ? null : description.trim());
        fields.put(InventorySchema.QUANTITY, quantity);
        fields.put(InventorySchema.UPDATED_AT, FieldValue.SERVER_TIMESTAMP);
        return store.set(ref, fields, !creating).thenApply(ok -> ref);
    }
}
