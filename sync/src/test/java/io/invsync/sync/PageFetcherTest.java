package io.invsync.sync;

import io.invsync.core.CollectionRef;
import io.invsync.core.Cursor;
import io.invsync.core.Document;
import io.invsync.core.PageQuery;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PageFetcherTest {

    private static final CollectionRef ITEMS = CollectionRef.of("users", "u1", "items");

    private final InstrumentedStore store = new InstrumentedStore();
    private final PageFetcher fetcher = new PageFetcher(store, 10);

    @Test
    void limit_outside_the_allowed_range_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> fetcher.fetchPage(ITEMS, "name", null, 0));
        assertThrows(IllegalArgumentException.class, () -> fetcher.fetchPage(ITEMS, "name", null, 11));
        assertEquals(0, store.fetches.get());
    }

    @Test
    void caller_cursor_drives_continuation() {
        for (String id : List.of("a", "b", "c")) {
            store.memory.set(ITEMS.document(id), Map.of("name", id), false).join();
        }

        List<Document> first = fetcher.fetchPage(ITEMS, "name", null, 2).join();
        List<Document> second = fetcher.fetchPage(ITEMS, "name", Cursor.after(first.get(1), "name"), 2).join();
        List<Document> descending = fetcher.fetchPage(ITEMS, "name", PageQuery.Direction.DESCENDING, null, 1).join();

        assertEquals(List.of("a", "b"), first.stream().map(Document::id).toList());
        assertEquals(List.of("c"), second.stream().map(Document::id).toList());
        assertEquals("c", descending.get(0).id());
    }
}
