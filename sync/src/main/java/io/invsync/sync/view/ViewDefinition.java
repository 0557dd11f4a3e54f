package io.invsync.sync.view;

import io.invsync.core.CollectionRef;
import io.invsync.core.PageQuery;

import java.util.Objects;
import java.util.function.Function;

/**
 * What a session shows: the collection, its page order and how entries map
 * to the caller's row type.
 */
public record ViewDefinition<T>(
        CollectionRef collection,
        String orderField,
        PageQuery.Direction direction,
        Function<ViewEntry, T> projection
) {
    public ViewDefinition {
        Objects.requireNonNull(collection, "collection");
        Objects.requireNonNull(orderField, "orderField");
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(projection, "projection");
    }

    public static <T> ViewDefinition<T> ascending(CollectionRef collection, String orderField, Function<ViewEntry, T> projection) {
        return new ViewDefinition<>(collection, orderField, PageQuery.Direction.ASCENDING, projection);
    }
}
