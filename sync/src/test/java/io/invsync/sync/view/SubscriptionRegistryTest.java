package io.invsync.sync.view;

import io.invsync.core.CollectionRef;
import io.invsync.core.DocumentEvent;
import io.invsync.core.DocumentRef;
import io.invsync.core.StoreException;
import io.invsync.sync.InstrumentedStore;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class SubscriptionRegistryTest {

    private static final CollectionRef ITEMS = CollectionRef.of("users", "u1", "items");

    private final InstrumentedStore store = new InstrumentedStore();
    private final List<DocumentEvent> events = new CopyOnWriteArrayList<>();
    private final SubscriptionRegistry registry = new SubscriptionRegistry(store, new SubscriptionRegistry.EventSink() {
        @Override
        public void onEvent(SubscriptionRegistry.Handle handle, DocumentEvent event) {
            events.add(event);
        }

        @Override
        public void onError(SubscriptionRegistry.Handle handle, StoreException error) {
            fail("unexpected stream error: " + error);
        }
    });

    @Test
    void open_is_idempotent_per_id() {
        DocumentRef ref = ITEMS.document("a");

        SubscriptionRegistry.Handle first = registry.open(ref);
        SubscriptionRegistry.Handle second = registry.open(ref);

        assertSame(first, second);
        assertEquals(1, registry.size());
        assertEquals(1, store.memory.subscriptionCount());
        assertEquals(1, events.size(), "only one initial event");
    }

    @Test
    void close_releases_the_store_subscription() {
        registry.open(ITEMS.document("a"));
        registry.open(ITEMS.document("b"));

        assertTrue(registry.close("a"));
        assertFalse(registry.close("a"));
        assertEquals(Set.of("b"), registry.openIds());
        assertEquals(1, store.memory.subscriptionCount());

        assertEquals(1, registry.closeAll());
        assertEquals(0, store.memory.subscriptionCount());
    }

    @Test
    void closed_handle_is_no_longer_current_and_forwards_nothing() {
        DocumentRef ref = ITEMS.document("a");
        SubscriptionRegistry.Handle handle = registry.open(ref);
        assertTrue(registry.isCurrent(handle));

        registry.closeAll();
        int before = events.size();
        store.set(ref, Map.of("name", "late"), false).join();

        assertFalse(registry.isCurrent(handle));
        assertEquals(before, events.size());

        SubscriptionRegistry.Handle reopened = registry.open(ref);
        assertNotSame(handle, reopened);
        assertFalse(registry.isCurrent(handle), "old handle stays stale after reopen");
    }
}
