package io.invsync.sync;

import io.invsync.core.CollectionRef;
import io.invsync.core.Cursor;
import io.invsync.core.Document;
import io.invsync.core.DocumentStore;
import io.invsync.core.PageQuery;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Issues one ordered, limited page request.
 * <p>
 * The fetcher holds no pagination state: the caller owns the cursor and
 * only advances it after a successful fetch, so a failed request can be
 * retried with the same arguments.
 */
public final class PageFetcher {

    private final DocumentStore store;
    private final int maxPageSize;

    public PageFetcher(DocumentStore store, int maxPageSize) {
        this.store = Objects.requireNonNull(store, "store");
        if (maxPageSize <= 0 || maxPageSize > DocumentStore.MAX_BATCH_OPERATIONS) {
            throw new IllegalArgumentException("maxPageSize out of range: " + maxPageSize);
        }
        this.maxPageSize = maxPageSize;
    }

    /**
     * Fetch up to {@code limit} documents strictly after {@code after}.
     *
     * @param after cursor of the previous page's last document, or null for the first page
     * @return ordered documents; an empty list means there is no more data
     */
    public CompletableFuture<List<Document>> fetchPage(
            CollectionRef collection,
            String orderField,
            PageQuery.Direction direction,
            Cursor after,
            int limit
    ) {
        if (limit <= 0 || limit > maxPageSize) {
            throw new IllegalArgumentException("limit must be in [1, " + maxPageSize + "], got " + limit);
        }
        return store.fetchPage(new PageQuery(collection, orderField, direction, after, limit));
    }

    public CompletableFuture<List<Document>> fetchPage(CollectionRef collection, String orderField, Cursor after, int limit) {
        return fetchPage(collection, orderField, PageQuery.Direction.ASCENDING, after, limit);
    }
}
