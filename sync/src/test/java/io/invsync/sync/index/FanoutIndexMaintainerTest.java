package io.invsync.sync.index;

import io.invsync.core.CollectionRef;
import io.invsync.core.Document;
import io.invsync.core.DocumentRef;
import io.invsync.core.GroupRole;
import io.invsync.core.StoreException;
import io.invsync.sync.InstrumentedStore;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FanoutIndexMaintainerTest {

    /** teams/{root} with members/{m}/teams/{root} index records. */
    private static final IndexLayout LAYOUT = new IndexLayout() {
        @Override
        public DocumentRef indexRecord(String memberId, String rootId) {
            return CollectionRef.of("members", memberId, "teams").document(rootId);
        }

        @Override
        public DocumentRef root(String rootId) {
            return CollectionRef.of("teams").document(rootId);
        }
    };

    private final InstrumentedStore store = new InstrumentedStore();
    private final FanoutIndexMaintainer maintainer = new FanoutIndexMaintainer(store, LAYOUT);

    @Test
    void upsert_merges_role_and_stamps_update_time() {
        DocumentRef ref = LAYOUT.indexRecord("m1", "t1");
        store.memory.set(ref, Map.of("pinned", "yes"), false).join();

        assertTrue(maintainer.upsert("m1", "t1", GroupRole.ADMIN).join());

        Document doc = store.memory.get(ref).join().orElseThrow();
        assertEquals("admin", doc.getString("role"));
        assertEquals("yes", doc.getString("pinned"));
        assertNotNull(doc.getTimestamp("updatedAt"));
    }

    @Test
    void upsert_failure_is_reported_not_thrown() {
        store.failCommitAttempt(1);

        assertFalse(maintainer.upsert("m1", "t1", GroupRole.MEMBER).join());
        assertTrue(store.memory.get(LAYOUT.indexRecord("m1", "t1")).join().isEmpty());
    }

    @Test
    void owner_index_is_created_only_when_missing_and_root_exists() {
        assertEquals(IndexRepair.ROOT_MISSING, maintainer.ensureOwnerIndexed("o1", "t1").join());
        assertTrue(store.memory.get(LAYOUT.indexRecord("o1", "t1")).join().isEmpty());

        store.memory.set(LAYOUT.root("t1"), Map.of("name", "team"), false).join();
        assertEquals(IndexRepair.CREATED, maintainer.ensureOwnerIndexed("o1", "t1").join());

        Document index = store.memory.get(LAYOUT.indexRecord("o1", "t1")).join().orElseThrow();
        assertEquals("owner", index.getString("role"));
        assertNotNull(index.getTimestamp("createdAt"));

        assertEquals(IndexRepair.ALREADY_PRESENT, maintainer.ensureOwnerIndexed("o1", "t1").join());
    }

    @Test
    void unreadable_index_reports_failure() {
        store.failGets(new StoreException(StoreException.Kind.TRANSIENT, "offline"));

        assertEquals(IndexRepair.FAILED, maintainer.ensureOwnerIndexed("o1", "t1").join());
    }

    @Test
    void invalid_ids_are_reported_through_the_result() {
        assertFalse(maintainer.upsert("m/1", "t1", GroupRole.MEMBER).join());
        assertEquals(IndexRepair.FAILED, maintainer.ensureOwnerIndexed("o1", " ").join());
        assertEquals(0, store.commitSizes.size());
    }
}
