package io.invsync.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Validation and normalization of document field maps.
 * <p>
 * Supported value types:
 *  - String
 *  - Long (Integer and Short are widened)
 *  - Instant (timestamps)
 *  - null
 *  - {@link FieldValue} sentinels, in writes only
 */
public final class Fields {

    private Fields() {
        // utility
    }

    /** Normalized, unmodifiable copy of stored fields. Sentinels are rejected. */
    public static Map<String, Object> stored(Map<String, ?> fields) {
        return copy(fields, false);
    }

    /** Normalized, unmodifiable copy of fields about to be written. */
    public static Map<String, Object> writable(Map<String, ?> fields) {
        return copy(fields, true);
    }

    public static Object normalize(Object value, boolean allowSentinel) {
        if (value == null || value instanceof String || value instanceof Long || value instanceof Instant) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short) {
            return ((Number) value).longValue();
        }
        if (value instanceof FieldValue && allowSentinel) {
            return value;
        }
        throw new IllegalArgumentException("unsupported field value type: " + value.getClass().getName());
    }

    private static Map<String, Object> copy(Map<String, ?> fields, boolean allowSentinel) {
        Objects.requireNonNull(fields, "fields");
        Map<String, Object> out = new LinkedHashMap<>(fields.size() * 2);
        for (Map.Entry<String, ?> e : fields.entrySet()) {
            String name = Objects.requireNonNull(e.getKey(), "field name");
            if (name.isBlank() || PageQuery.DOCUMENT_ID.equals(name)) {
                throw new IllegalArgumentException("invalid field name: '" + name + "'");
            }
            out.put(name, normalize(e.getValue(), allowSentinel));
        }
        return Collections.unmodifiableMap(out);
    }
}
