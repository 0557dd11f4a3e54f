package io.invsync.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ValueOrderingTest {

    @Test
    void orders_by_type_rank_then_natural_order() {
        Instant t = Instant.parse("2026-01-01T00:00:00Z");
        List<Object> values = new ArrayList<>(Arrays.asList("b", 5L, null, t, "a", 2L));

        values.sort(ValueOrdering.INSTANCE);

        assertEquals(Arrays.asList(null, 2L, 5L, t, "a", "b"), values);
    }

    @Test
    void rejects_unsupported_types() {
        assertThrows(IllegalArgumentException.class,
                () -> ValueOrdering.INSTANCE.compare(1.5d, "x"));
    }
}
