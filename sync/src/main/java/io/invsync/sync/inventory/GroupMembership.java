package io.invsync.sync.inventory;

import io.invsync.core.GroupRole;
import io.invsync.sync.view.ViewEntry;

/** One entry of a user's group index. */
public record GroupMembership(String groupId, GroupRole role) {

    public static GroupMembership from(ViewEntry e) {
        return new GroupMembership(
                e.id(),
                InventorySchema.decodeRole(e.getString(InventorySchema.ROLE), "group index " + e.id())
        );
    }
}
