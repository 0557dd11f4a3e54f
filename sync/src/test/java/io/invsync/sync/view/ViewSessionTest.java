package io.invsync.sync.view;

import io.invsync.core.CollectionRef;
import io.invsync.core.StoreException;
import io.invsync.sync.InstrumentedStore;
import io.invsync.sync.SyncConfig;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class ViewSessionTest {

    private static final CollectionRef ITEMS = CollectionRef.of("users", "u1", "items");

    private final InstrumentedStore store = new InstrumentedStore();
    private final SyncConfig config = SyncConfig.defaults().withViewPageSize(2);
    private final List<List<String>> published = new CopyOnWriteArrayList<>();

    private ViewSession<String> session() {
        return new ViewSession<>(store, ViewDefinition.ascending(ITEMS, "name", ViewEntry::id), config, published::add);
    }

    private void seed(String... ids) {
        for (String id : ids) {
            store.memory.set(ITEMS.document(id), Map.of("name", id), false).join();
        }
    }

    @Test
    void paging_before_start_is_rejected() {
        assertThrows(IllegalStateException.class, () -> session().onNextPageNeeded());
    }

    @Test
    void pages_until_the_end_then_stops_fetching() {
        seed("a", "b", "c");
        ViewSession<String> s = session();

        assertEquals(PageOutcome.LOADED, s.startSession().join());
        assertEquals(List.of("a", "b"), s.currentSnapshot());
        assertEquals(PageOutcome.LOADED, s.onNextPageNeeded().join());
        assertEquals(List.of("a", "b", "c"), s.currentSnapshot());
        assertEquals(PageOutcome.REACHED_END, s.onNextPageNeeded().join());
        assertTrue(s.reachedEnd());

        int fetches = store.fetches.get();
        assertEquals(PageOutcome.REACHED_END, s.onNextPageNeeded().join());
        assertEquals(fetches, store.fetches.get());
        assertEquals(List.of("a", "b", "c"), published.get(published.size() - 1));
    }

    @Test
    void only_one_page_in_flight() {
        seed("a", "b", "c");
        store.holdFetches(true);
        ViewSession<String> s = session();

        CompletableFuture<PageOutcome> first = s.startSession();
        assertEquals(PageOutcome.ALREADY_LOADING, s.onNextPageNeeded().join());
        assertEquals(1, store.heldFetches());

        store.releaseFetches();
        assertEquals(PageOutcome.LOADED, first.join());

        store.holdFetches(false);
        assertEquals(PageOutcome.LOADED, s.onNextPageNeeded().join());
        assertEquals(List.of("a", "b", "c"), s.currentSnapshot());
    }

    @Test
    void failed_fetch_leaves_state_untouched_and_can_be_retried() {
        seed("a", "b", "c", "d");
        ViewSession<String> s = session();
        s.startSession().join();
        var cursorBefore = s.view().cursor();

        store.failNextFetch(new StoreException(StoreException.Kind.TRANSIENT, "offline"));
        CompletionException e = assertThrows(CompletionException.class, () -> s.onNextPageNeeded().join());

        assertInstanceOf(StoreException.class, e.getCause());
        assertEquals(cursorBefore, s.view().cursor());
        assertEquals(List.of("a", "b"), s.currentSnapshot());

        assertEquals(PageOutcome.LOADED, s.onNextPageNeeded().join());
        assertEquals(List.of("a", "b", "c", "d"), s.currentSnapshot());
    }

    @Test
    void reload_discards_the_page_in_flight() {
        seed("a", "b", "c");
        ViewSession<String> s = session();
        s.startSession().join();
        assertEquals(List.of("a", "b"), s.currentSnapshot());

        store.holdFetches(true);
        CompletableFuture<PageOutcome> stale = s.onNextPageNeeded();
        CompletableFuture<PageOutcome> fresh = s.reload();
        assertTrue(s.currentSnapshot().isEmpty());

        store.releaseFetches();

        assertEquals(PageOutcome.DISCARDED, stale.join());
        assertEquals(PageOutcome.LOADED, fresh.join());
        assertEquals(List.of("a", "b"), s.currentSnapshot());
        assertEquals(2, store.memory.subscriptionCount());
    }

    @Test
    void end_session_is_terminal() {
        seed("a", "b");
        store.holdFetches(true);
        ViewSession<String> s = session();
        CompletableFuture<PageOutcome> inFlight = s.startSession();

        s.endSession();
        store.releaseFetches();

        assertEquals(PageOutcome.DISCARDED, inFlight.join());
        assertEquals(PageOutcome.DISCARDED, s.onNextPageNeeded().join());
        assertTrue(s.currentSnapshot().isEmpty());
        assertEquals(0, store.memory.subscriptionCount());
        assertEquals(ViewSession.State.ENDED, s.state());
        s.endSession();
        assertThrows(IllegalStateException.class, s::reload);
    }

    @Test
    void ending_an_active_session_closes_its_subscriptions() {
        seed("a", "b");
        ViewSession<String> s = session();
        s.startSession().join();
        assertEquals(2, store.memory.subscriptionCount());

        s.endSession();

        assertEquals(0, store.memory.subscriptionCount());
        store.memory.set(ITEMS.document("a"), Map.of("name", "a2"), false).join();
        assertTrue(s.currentSnapshot().isEmpty());
    }

    @Test
    void failing_start_hook_does_not_block_the_first_page() {
        seed("a");
        ViewSession<String> s = new ViewSession<>(
                store,
                ViewDefinition.ascending(ITEMS, "name", ViewEntry::id),
                config,
                published::add,
                () -> CompletableFuture.failedFuture(new StoreException(StoreException.Kind.PERMISSION_DENIED, "no")));

        assertEquals(PageOutcome.LOADED, s.startSession().join());
        assertEquals(List.of("a"), s.currentSnapshot());
        assertThrows(IllegalStateException.class, s::startSession);
    }
}
