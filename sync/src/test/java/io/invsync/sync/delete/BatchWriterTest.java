package io.invsync.sync.delete;

import io.invsync.core.CollectionRef;
import io.invsync.core.StoreException;
import io.invsync.sync.InstrumentedStore;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BatchWriterTest {

    private static final CollectionRef ITEMS = CollectionRef.of("users", "u1", "items");

    private final InstrumentedStore store = new InstrumentedStore();

    @Test
    void threshold_must_stay_below_the_hard_limit() {
        assertThrows(IllegalArgumentException.class, () -> new BatchWriter(store, 500, 500));
        assertThrows(IllegalArgumentException.class, () -> new BatchWriter(store, 0, 500));
    }

    @Test
    void commits_when_threshold_is_reached_and_on_flush() {
        BatchWriter writer = new BatchWriter(store, 3, 5);
        for (int i = 0; i < 4; i++) {
            writer.delete(ITEMS.document("i" + i));
        }
        assertEquals(List.of(3), store.commitSizes);
        assertEquals(1, writer.pendingCount());

        writer.flush();
        writer.flush();

        assertEquals(List.of(3, 1), store.commitSizes);
        assertEquals(2, writer.commits());
        assertEquals(4, writer.operations());
    }

    @Test
    void failed_flush_keeps_the_queued_writes() {
        BatchWriter writer = new BatchWriter(store, 10, 20);
        writer.delete(ITEMS.document("a"));
        store.failCommitAttempt(1);

        assertThrows(StoreException.class, writer::flush);
        assertEquals(1, writer.pendingCount());
        assertEquals(0, writer.commits());

        writer.flush();
        assertEquals(1, writer.commits());
    }

    @Test
    void duplicate_delete_in_one_batch_is_dropped() {
        BatchWriter writer = new BatchWriter(store, 10, 20);

        assertTrue(writer.delete(ITEMS.document("a")));
        assertFalse(writer.delete(ITEMS.document("a")));
        writer.flush();

        assertEquals(List.of(1), store.commitSizes);
        assertTrue(writer.delete(ITEMS.document("a")), "a new batch accepts it again");
    }
}
