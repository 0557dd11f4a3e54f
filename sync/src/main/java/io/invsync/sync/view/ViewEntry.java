package io.invsync.sync.view;

import java.util.Map;
import java.util.Objects;

/**
 * Cached projection of one document inside a {@link MaterializedView}.
 *
 * @param source where the current fields came from; once a subscription has
 *               delivered data, page data for the same id is ignored
 */
public record ViewEntry(String id, Map<String, Object> fields, Source source) {

    public enum Source { PAGE, SUBSCRIPTION }

    public ViewEntry {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(fields, "fields");
        Objects.requireNonNull(source, "source");
    }

    public String getString(String field) {
        return fields.get(field) instanceof String s ? s : null;
    }

    public Long getLong(String field) {
        return fields.get(field) instanceof Long l ? l : null;
    }
}
