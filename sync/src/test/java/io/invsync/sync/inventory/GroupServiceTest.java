package io.invsync.sync.inventory;

import io.invsync.core.Document;
import io.invsync.core.DocumentRef;
import io.invsync.core.GroupRole;
import io.invsync.core.StoreException;
import io.invsync.sync.InstrumentedStore;
import io.invsync.sync.SyncConfig;
import io.invsync.sync.delete.CascadingDeleter;
import io.invsync.sync.delete.DeletionResult;
import io.invsync.sync.index.FanoutIndexMaintainer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class GroupServiceTest {

    private final InstrumentedStore store = new InstrumentedStore();
    private final ExecutorService executor = Executors.newSingleThreadExecutor();
    private final GroupService groups = new GroupService(
            store,
            new CascadingDeleter(store, SyncConfig.defaults(), executor),
            new FanoutIndexMaintainer(store, InventorySchema.GROUP_INDEX));
    private final ItemService items = new ItemService(store);

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    private Optional<Document> doc(DocumentRef ref) {
        return store.memory.get(ref).join();
    }

    @Test
    void create_writes_group_owner_and_owner_index_in_one_commit() {
        DocumentRef ref = groups.createGroup("alice", "alice@example.com", " Pantry ", "shared").join();

        assertEquals(InventorySchema.group("alice"), ref);
        assertEquals(List.of(3), store.commitSizes);
        Document group = doc(ref).orElseThrow();
        assertEquals("Pantry", group.getString(InventorySchema.NAME));
        assertEquals("alice", group.getString(InventorySchema.OWNER_UID));
        assertEquals("owner", doc(InventorySchema.member("alice", "alice")).orElseThrow().getString("role"));
        assertEquals("owner", doc(InventorySchema.userGroupIndex("alice", "alice")).orElseThrow().getString("role"));
    }

    @Test
    void a_user_owns_at_most_one_group() {
        groups.createGroup("alice", null, "Pantry", null).join();

        CompletionException e = assertThrows(CompletionException.class,
                () -> groups.createGroup("alice", null, "Garage", null).join());
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    void add_member_writes_member_then_index() {
        groups.createGroup("alice", null, "Pantry", null).join();

        assertTrue(groups.addMember("alice", "bob", " Bob@Example.com ").join());

        Document member = doc(InventorySchema.member("alice", "bob")).orElseThrow();
        assertEquals("member", member.getString("role"));
        assertEquals("bob@example.com", member.getString("email"));
        Document index = doc(InventorySchema.userGroupIndex("bob", "alice")).orElseThrow();
        assertEquals("member", index.getString("role"));
        assertNotNull(index.getTimestamp("updatedAt"));
    }

    @Test
    void member_survives_a_failed_index_write() {
        groups.createGroup("alice", null, "Pantry", null).join();
        store.resetCounters();
        store.failCommitAttempt(2);

        assertFalse(groups.addMember("alice", "bob", "bob@example.com").join());
        assertTrue(doc(InventorySchema.member("alice", "bob")).isPresent());
        assertTrue(doc(InventorySchema.userGroupIndex("bob", "alice")).isEmpty());
    }

    @Test
    void role_change_updates_member_and_index_together() {
        groups.createGroup("alice", null, "Pantry", null).join();
        groups.addMember("alice", "bob", "bob@example.com").join();
        store.resetCounters();

        groups.changeRole("alice", "bob", GroupRole.ADMIN).join();

        assertEquals(List.of(2), store.commitSizes);
        assertEquals("admin", doc(InventorySchema.member("alice", "bob")).orElseThrow().getString("role"));
        assertEquals("bob@example.com", doc(InventorySchema.member("alice", "bob")).orElseThrow().getString("email"));
        assertEquals("admin", doc(InventorySchema.userGroupIndex("bob", "alice")).orElseThrow().getString("role"));
    }

    @Test
    void ownership_cannot_be_assigned_or_taken_away() {
        groups.createGroup("alice", null, "Pantry", null).join();
        groups.addMember("alice", "bob", "bob@example.com").join();

        CompletionException assign = assertThrows(CompletionException.class,
                () -> groups.changeRole("alice", "bob", GroupRole.OWNER).join());
        CompletionException demote = assertThrows(CompletionException.class,
                () -> groups.changeRole("alice", "alice", GroupRole.MEMBER).join());
        CompletionException remove = assertThrows(CompletionException.class,
                () -> groups.removeMember("alice", "alice").join());

        assertInstanceOf(IllegalArgumentException.class, assign.getCause());
        assertInstanceOf(IllegalArgumentException.class, demote.getCause());
        assertInstanceOf(IllegalArgumentException.class, remove.getCause());
        assertTrue(doc(InventorySchema.member("alice", "alice")).isPresent());
    }

    @Test
    void remove_member_deletes_member_and_index() {
        groups.createGroup("alice", null, "Pantry", null).join();
        groups.addMember("alice", "bob", "bob@example.com").join();

        groups.removeMember("alice", "bob").join();

        assertTrue(doc(InventorySchema.member("alice", "bob")).isEmpty());
        assertTrue(doc(InventorySchema.userGroupIndex("bob", "alice")).isEmpty());
    }

    @Test
    void removing_from_a_missing_group_is_not_found() {
        CompletionException e = assertThrows(CompletionException.class,
                () -> groups.removeMember("nobody", "bob").join());

        assertEquals(StoreException.Kind.NOT_FOUND, ((StoreException) e.getCause()).kind());
    }

    @Test
    void delete_group_removes_items_members_and_every_index_record() {
        groups.createGroup("alice", null, "Pantry", null).join();
        groups.addMember("alice", "bob", "bob@example.com").join();
        groups.addMember("alice", "carol", "carol@example.com").join();
        for (int i = 0; i < 3; i++) {
            items.saveGroupItem("alice", GroupRole.OWNER, null, "item " + i, null, i).join();
        }
        store.resetCounters();

        DeletionResult result = groups.deleteGroup("alice").join();

        // 3 items + 3 members + 3 member indexes (owner's included) + group
        assertEquals(new DeletionResult.Deleted(1, 10), result);
        assertEquals(0, store.memory.count(InventorySchema.groupItems("alice")));
        assertEquals(0, store.memory.count(InventorySchema.members("alice")));
        for (String uid : List.of("alice", "bob", "carol")) {
            assertTrue(doc(InventorySchema.userGroupIndex(uid, "alice")).isEmpty(), uid);
        }
        assertTrue(doc(InventorySchema.group("alice")).isEmpty());
        assertInstanceOf(DeletionResult.AlreadyAbsent.class, groups.deleteGroup("alice").join());
    }

    @Test
    void group_without_owner_field_is_not_deleted() {
        store.memory.set(InventorySchema.group("g1"), Map.of("name", "legacy"), false).join();
        items.saveGroupItem("g1", GroupRole.ADMIN, null, "jar", null, 1).join();

        DeletionResult result = groups.deleteGroup("g1").join();

        assertFalse(result.succeeded());
        assertEquals(1, store.memory.count(InventorySchema.groupItems("g1")));
        assertTrue(doc(InventorySchema.group("g1")).isPresent());
    }
}
