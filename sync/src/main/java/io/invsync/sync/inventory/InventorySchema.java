package io.invsync.sync.inventory;

import io.invsync.core.CollectionRef;
import io.invsync.core.DocumentRef;
import io.invsync.core.GroupRole;
import io.invsync.sync.delete.DeletionPlan;
import io.invsync.sync.index.IndexLayout;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Document layout of the inventory app.
 * <pre>
 *   users/{uid}/items/{itemId}        personal items
 *   users/{uid}/groups/{groupId}      fan-out index: groups uid belongs to
 *   groups/{groupId}                  group root (name, description, ownerUid)
 *   groups/{groupId}/items/{itemId}   shared items
 *   groups/{groupId}/members/{uid}    membership (role, email)
 * </pre>
 * A user owns at most one group, whose id is the owner's uid.
 */
public final class InventorySchema {
    private static final Logger log = Logger.getLogger(InventorySchema.class.getName());

    public static final String USERS = "users";
    public static final String GROUPS = "groups";
    public static final String ITEMS = "items";
    public static final String MEMBERS = "members";

    // item fields
    public static final String NAME = "name";
    public static final String DESCRIPTION = "description";
    public static final String QUANTITY = "quantity";
    public static final String UPDATED_AT = "updatedAt";

    // group / member / index fields
    public static final String OWNER_UID = "ownerUid";
    public static final String CREATED_AT = "createdAt";
    public static final String ROLE = "role";
    public static final String EMAIL = "email";

    /** users/{uid}/groups/{groupId} index records. */
    public static final IndexLayout GROUP_INDEX = new IndexLayout() {
        @Override
        public DocumentRef indexRecord(String memberId, String rootId) {
            return userGroupIndex(memberId, rootId);
        }

        @Override
        public DocumentRef root(String rootId) {
            return group(rootId);
        }
    };

    private InventorySchema() {
        // constants
    }

    public static CollectionRef userItems(String uid) {
        return CollectionRef.of(USERS, uid, ITEMS);
    }

    public static CollectionRef userGroups(String uid) {
        return CollectionRef.of(USERS, uid, GROUPS);
    }

    public static DocumentRef userGroupIndex(String uid, String groupId) {
        return userGroups(uid).document(groupId);
    }

    public static DocumentRef group(String groupId) {
        return CollectionRef.of(GROUPS).document(groupId);
    }

    public static CollectionRef groupItems(String groupId) {
        return group(groupId).collection(ITEMS);
    }

    public static CollectionRef members(String groupId) {
        return group(groupId).collection(MEMBERS);
    }

    public static DocumentRef member(String groupId, String uid) {
        return members(groupId).document(uid);
    }

    /**
     * Everything a group owns: its items, its members with their index
     * records, the owner's index record, then the group itself.
     */
    public static DeletionPlan groupDeletionPlan(String groupId) {
        return DeletionPlan.builder(group(groupId))
                .dependent(ITEMS, root -> groupItems(groupId))
                .dependent(MEMBERS, root -> members(groupId),
                        (root, member) -> List.of(userGroupIndex(member.id(), groupId)))
                .auxiliary(root -> {
                    String owner = root.getString(OWNER_UID);
                    if (owner == null || owner.isBlank()) {
                        throw new IllegalStateException("group " + groupId + " has no " + OWNER_UID);
                    }
                    return List.of(userGroupIndex(owner, groupId));
                })
                .build();
    }

    /** Decode a stored role; unknown or missing values read as MEMBER. */
    public static GroupRole decodeRole(String raw, String context) {
        return GroupRole.parse(raw).orElseGet(() -> {
            log.log(Level.WARNING, "unknown role ''{0}'' on {1}, treating as member", new Object[]{raw, context});
            return GroupRole.MEMBER;
        });
    }
}
