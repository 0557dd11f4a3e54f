package io.invsync.sync.inventory;

import io.invsync.core.DocumentStore;
import io.invsync.core.PageQuery;
import io.invsync.sync.SyncConfig;
import io.invsync.sync.index.FanoutIndexMaintainer;
import io.invsync.sync.view.ViewSession;
import io.invsync.sync.view.ViewDefinition;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Factory for the app's list screens. Each call returns a fresh, unstarted
 * session owned by the caller.
 */
public final class InventoryViews {

    private final DocumentStore store;
    private final SyncConfig config;
    private final FanoutIndexMaintainer index;

    public InventoryViews(DocumentStore store, SyncConfig config, FanoutIndexMaintainer index) {
        this.store = Objects.requireNonNull(store, "store");
        this.config = Objects.requireNonNull(config, "config");
        this.index = Objects.requireNonNull(index, "index");
    }

    /** Personal items, most recently updated first. */
    public ViewSession<InventoryItem> userItems(String uid, Consumer<List<InventoryItem>> listener) {
        ViewDefinition<InventoryItem> definition = new ViewDefinition<>(
                InventorySchema.userItems(uid), InventorySchema.UPDATED_AT,
                PageQuery.Direction.DESCENDING, InventoryItem::from);
        return new ViewSession<>(store, definition, config, listener);
    }

    /** Shared items of a group, by name. */
    public ViewSession<InventoryItem> groupItems(String groupId, Consumer<List<InventoryItem>> listener) {
        ViewDefinition<InventoryItem> definition = ViewDefinition.ascending(
                InventorySchema.groupItems(groupId), InventorySchema.NAME, InventoryItem::from);
        return new ViewSession<>(store, definition, config, listener);
    }

    public ViewSession<MemberRow> members(String groupId, Consumer<List<MemberRow>> listener) {
        ViewDefinition<MemberRow> definition = ViewDefinition.ascending(
                InventorySchema.members(groupId), PageQuery.DOCUMENT_ID, MemberRow::from);
        return new ViewSession<>(store, definition, config, listener);
    }

    /**
     * Raw index of the groups {@code uid} belongs to. Before the first page
     * the user's own group index is repaired if the group exists but its index is missing.
     */
    public ViewSession<GroupMembership> userGroups(String uid, Consumer<List<GroupMembership>> listener) {
        ViewDefinition<GroupMembership> definition = ViewDefinition.ascending(
                InventorySchema.userGroups(uid), PageQuery.DOCUMENT_ID, GroupMembership::from);
        return new ViewSession<>(store, definition, config, listener, () -> index.ensureOwnerIndexed(uid, uid));
    }

    /**
     * Groups {@code uid} belongs to, with each group's current name and
     * description. Index entries whose group no longer exists are hidden.
     */
    public GroupListSession groupList(String uid, Consumer<List<GroupSummary>> listener) {
        return new GroupListSession(store, rows -> userGroups(uid, rows), listener);
    }
}
