package io.invsync.sync.inventory;

import io.invsync.core.GroupRole;
import io.invsync.sync.view.ViewEntry;

public record MemberRow(String userId, String email, GroupRole role) {

    public static MemberRow from(ViewEntry e) {
        String email = e.getString(InventorySchema.EMAIL);
        return new MemberRow(
                e.id(),
                email == null ? "" : email,
                InventorySchema.decodeRole(e.getString(InventorySchema.ROLE), "member " + e.id())
        );
    }
}
