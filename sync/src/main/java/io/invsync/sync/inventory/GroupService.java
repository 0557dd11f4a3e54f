package io.invsync.sync.inventory;

import io.invsync.core.DocumentRef;
import io.invsync.core.DocumentStore;
import io.invsync.core.FieldValue;
import io.invsync.core.GroupRole;
import io.invsync.core.StoreException;
import io.invsync.core.WriteOp;
import io.invsync.sync.delete.CascadingDeleter;
import io.invsync.sync.delete.DeletionResult;
import io.invsync.sync.index.FanoutIndexMaintainer;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Group lifecycle and membership writes.
 * <p>
 * Member ids are user ids resolved by the caller. The group id is always
 * the owner's uid, so the owner is recognisable without a read.
 */
public final class GroupService {
    private static final Logger log = Logger.getLogger(GroupService.class.getName());

    private final DocumentStore store;
    private final CascadingDeleter deleter;
    private final FanoutIndexMaintainer index;

    public GroupService(DocumentStore store, CascadingDeleter deleter, FanoutIndexMaintainer index) {
        this.store = Objects.requireNonNull(store, "store");
        this.deleter = Objects.requireNonNull(deleter, "deleter");
        this.index = Objects.requireNonNull(index, "index");
    }

    /**
     * Create the group owned by {@code ownerUid}: group root, owner member
     * record and owner index record in one commit. Fails with
     * {@link IllegalStateException} if the owner already has a group.
     *
     * @param ownerEmail may be null
     */
    public CompletableFuture<DocumentRef> createGroup(String ownerUid, String ownerEmail, String name, String description) {
        requireText(ownerUid, "ownerUid");
        requireText(name, "name");
        DocumentRef groupRef = InventorySchema.group(ownerUid);
        return store.get(groupRef).thenCompose(existing -> {
            if (existing.isPresent()) {
                throw new IllegalStateException("user " + ownerUid + " already owns group " + groupRef);
            }
            Map<String, Object> group = new LinkedHashMap<>();
            group.put(InventorySchema.NAME, name.trim());
            group.put(InventorySchema.DESCRIPTION, description);
            group.put(InventorySchema.OWNER_UID, ownerUid);
            group.put(InventorySchema.CREATED_AT, FieldValue.SERVER_TIMESTAMP);

            Map<String, Object> owner = new LinkedHashMap<>();
            owner.put(InventorySchema.ROLE, GroupRole.OWNER.storedName());
            owner.put(InventorySchema.EMAIL, ownerEmail == null ? "" : ownerEmail);

            Map<String, Object> ownerIndex = new LinkedHashMap<>();
            ownerIndex.put(InventorySchema.ROLE, GroupRole.OWNER.storedName());
            ownerIndex.put(InventorySchema.CREATED_AT, FieldValue.SERVER_TIMESTAMP);

            return store.commit(List.of(
                    WriteOp.set(groupRef, group),
                    WriteOp.set(InventorySchema.member(ownerUid, ownerUid), owner),
                    WriteOp.set(InventorySchema.userGroupIndex(ownerUid, ownerUid), ownerIndex)
            )).thenApply(ok -> {
                log.log(Level.INFO, "created group {0}", groupRef);
                return groupRef;
            });
        });
    }

    /**
     * Add {@code userId} as a MEMBER. The member record is written first; the
     * index record follows best-effort.
     *
     * @return true if the index record was written too
     */
    public CompletableFuture<Boolean> addMember(String groupId, String userId, String email) {
        requireText(groupId, "groupId");
        requireText(userId, "userId");
        if (groupId.equals(userId)) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("the owner is already a member"));
        }
        Map<String, Object> member = new LinkedHashMap<>();
        member.put(InventorySchema.ROLE, GroupRole.MEMBER.storedName());
        member.put(InventorySchema.EMAIL, email == null ? "" : email.trim().toLowerCase(Locale.ROOT));
        return store.set(InventorySchema.member(groupId, userId), member, false)
                .thenCompose(ok -> index.upsert(userId, groupId, GroupRole.MEMBER));
    }

    /** Change a member's role in the member record and the index record together. */
    public CompletableFuture<Void> changeRole(String groupId, String userId, GroupRole role) {
        Objects.requireNonNull(role, "role");
        if (role == GroupRole.OWNER) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("ownership cannot be assigned"));
        }
        if (groupId.equals(userId)) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("the owner's role cannot change"));
        }
        Map<String, Object> memberPatch = Map.of(InventorySchema.ROLE, role.storedName());
        Map<String, Object> indexPatch = new LinkedHashMap<>();
        indexPatch.put(InventorySchema.ROLE, role.storedName());
        indexPatch.put(FanoutIndexMaintainer.UPDATED_AT, FieldValue.SERVER_TIMESTAMP);
        return store.commit(List.of(
                WriteOp.merge(InventorySchema.member(groupId, userId), memberPatch),
                WriteOp.merge(InventorySchema.userGroupIndex(userId, groupId), indexPatch)
        ));
    }

    /** Remove a member and its index record in one commit. The owner cannot be removed. */
    public CompletableFuture<Void> removeMember(String groupId, String userId) {
        requireText(userId, "userId");
        return store.get(InventorySchema.group(groupId)).thenCompose(group -> {
            if (group.isEmpty()) {
                throw new StoreException(StoreException.Kind.NOT_FOUND, "group " + groupId + " does not exist");
            }
            if (userId.equals(group.get().getString(InventorySchema.OWNER_UID))) {
                throw new IllegalArgumentException("the owner cannot be removed; delete the group instead");
            }
            return store.commit(List.of(
                    WriteOp.delete(InventorySchema.member(groupId, userId)),
                    WriteOp.delete(InventorySchema.userGroupIndex(userId, groupId))
            ));
        });
    }

    /** Delete the group with its items, members and index records. */
    public CompletableFuture<DeletionResult> deleteGroup(String groupId) {
        requireText(groupId, "groupId");
        return deleter.deleteCascade(InventorySchema.groupDeletionPlan(groupId));
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
