package io.invsync.core;

import java.util.Objects;

/**
 * One ordered, limited page request against a collection.
 *
 * @param collection collection to enumerate
 * @param orderField field to order by, or {@link #DOCUMENT_ID} to order by id only
 * @param direction  sort direction; the id tiebreaker follows the same direction
 * @param after      cursor from the previous page, or null for the first page
 * @param limit      maximum number of documents returned, at least 1
 */
public record PageQuery(
        CollectionRef collection,
        String orderField,
        Direction direction,
        Cursor after,
        int limit
) {
    /** Pseudo-field that orders by document id. */
    public static final String DOCUMENT_ID = "__id__";

    public enum Direction { ASCENDING, DESCENDING }

    public PageQuery {
        Objects.requireNonNull(collection, "collection");
        Objects.requireNonNull(orderField, "orderField");
        Objects.requireNonNull(direction, "direction");
        if (orderField.isBlank()) throw new IllegalArgumentException("orderField must not be blank");
        if (limit <= 0) throw new IllegalArgumentException("limit must be > 0, got " + limit);
    }

    public static PageQuery firstPage(CollectionRef collection, String orderField, int limit) {
        return new PageQuery(collection, orderField, Direction.ASCENDING, null, limit);
    }

    public PageQuery startAfter(Cursor cursor) {
        return new PageQuery(collection, orderField, direction, cursor, limit);
    }

    public boolean orderedById() {
        return DOCUMENT_ID.equals(orderField);
    }
}
