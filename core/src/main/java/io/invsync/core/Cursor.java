package io.invsync.core;

import java.util.Objects;

/**
 * Continuation marker for ordered pagination: the order-field value and id of
 * the last document of the previous page.
 * <p>
 * Cursors are values, not snapshots. A page requested with a cursor returns
 * documents strictly after (orderValue, documentId) in the query's order, even
 * if the document the cursor was taken from has since been deleted.
 */
public record Cursor(Object orderValue, String documentId) {

    public Cursor {
        Objects.requireNonNull(documentId, "documentId");
        orderValue = Fields.normalize(orderValue, false);
    }

    /** Cursor positioned at {@code last}, for a query ordered by {@code orderField}. */
    public static Cursor after(Document last, String orderField) {
        Objects.requireNonNull(last, "last");
        Objects.requireNonNull(orderField, "orderField");
        return new Cursor(last.get(orderField), last.id());
    }
}
