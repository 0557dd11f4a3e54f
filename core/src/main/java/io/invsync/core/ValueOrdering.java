package io.invsync.core;

import java.time.Instant;
import java.util.Comparator;

/**
 * Total order over field values, used for query ordering and cursor
 * comparison.
 * <p>
 * Values of different types order by type rank: null, then integers, then
 * timestamps, then strings. Within a type the natural order applies.
 */
public final class ValueOrdering implements Comparator<Object> {

    public static final ValueOrdering INSTANCE = new ValueOrdering();

    private ValueOrdering() {
    }

    @Override
    public int compare(Object a, Object b) {
        int rank = Integer.compare(rank(a), rank(b));
        if (rank != 0) {
            return rank;
        }
        if (a == null) {
            return 0;
        }
        if (a instanceof Long la) {
            return la.compareTo((Long) b);
        }
        if (a instanceof Instant ta) {
            return ta.compareTo((Instant) b);
        }
        return ((String) a).compareTo((String) b);
    }

    private static int rank(Object v) {
        if (v == null) return 0;
        if (v instanceof Long) return 1;
        if (v instanceof Instant) return 2;
        if (v instanceof String) return 3;
        throw new IllegalArgumentException("value is not orderable: " + v.getClass().getName());
    }
}
