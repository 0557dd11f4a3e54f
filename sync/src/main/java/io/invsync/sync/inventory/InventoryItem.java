package io.invsync.sync.inventory;

import io.invsync.sync.view.ViewEntry;

/** Item row as shown in item lists. Description may be null. */
public record InventoryItem(String id, String name, String description, long quantity) {

    public static InventoryItem from(ViewEntry e) {
        String name = e.getString(InventorySchema.NAME);
        Long quantity = e.getLong(InventorySchema.QUANTITY);
        return new InventoryItem(
                e.id(),
                name == null ? "" : name,
                e.getString(InventorySchema.DESCRIPTION),
                quantity == null ? 0L : quantity
        );
    }
}
