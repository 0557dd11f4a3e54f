package io.invsync.server;

import io.invsync.core.CollectionRef;
import io.invsync.core.Cursor;
import io.invsync.core.Document;
import io.invsync.core.DocumentRef;
import io.invsync.core.DocumentStore;
import io.invsync.core.PageQuery;
import io.invsync.core.StoreException;
import io.invsync.core.WriteOp;
import io.invsync.core.wire.CommitRequest;
import io.invsync.core.wire.DocumentResponse;
import io.invsync.core.wire.QueryResponse;
import io.invsync.core.wire.WireCodec;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Application service behind the HTTP layer.
 *
 * Responsibilities:
 *  - Parse and validate paths and query parameters.
 *  - Translate between wire DTOs and the document model.
 *  - Call the document store and wait for the result.
 *
 * Validation failures throw {@link IllegalArgumentException}; store failures
 * surface as {@link StoreException}.
 */
public class DocumentService {

    public static final int DEFAULT_QUERY_LIMIT = 50;

    private final DocumentStore store;

    public DocumentService(DocumentStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /** Current state of one document; {@code exists=false} when absent. */
    public DocumentResponse get(String documentPath) {
        DocumentRef ref = DocumentRef.parse(documentPath);
        Optional<Document> doc = await(store.get(ref));
        return doc.map(WireCodec::toResponse).orElseGet(() -> WireCodec.missing(ref));
    }

    /**
     * One ordered page of a collection.
     *
     * @param orderBy    order field, defaults to the document id
     * @param direction  "asc" (default) or "desc"
     * @param afterValue wire-encoded JSON order value of the cursor, may be null
     * @param afterId    document id of the cursor; required for a cursor
     * @param limit      page size, defaults to {@link #DEFAULT_QUERY_LIMIT}
     */
    public QueryResponse query(
            String collectionPath,
            String orderBy,
            String direction,
            String afterValue,
            String afterId,
            String limit
    ) {
        CollectionRef collection = new CollectionRef(collectionPath);
        String orderField = orderBy == null || orderBy.isBlank() ? PageQuery.DOCUMENT_ID : orderBy;
        PageQuery.Direction dir = parseDirection(direction);

        Cursor cursor = null;
        if (afterId != null) {
            Object value = afterValue == null ? null : WireCodec.decodeCursorValue(afterValue);
            cursor = new Cursor(value, afterId);
        } else if (afterValue != null) {
            throw new IllegalArgumentException("afterValue requires afterId");
        }

        int pageSize = parseLimit(limit);
        List<Document> docs = await(store.fetchPage(new PageQuery(collection, orderField, dir, cursor, pageSize)));

        var dto = new QueryResponse();
        dto.documents = new ArrayList<>(docs.size());
        for (Document d : docs) {
            dto.documents.add(WireCodec.toResponse(d));
        }
        return dto;
    }

    /** Apply a batch atomically. A missing opId gets a fresh one. */
    public void commit(CommitRequest req) {
        if (req == null) {
            throw new IllegalArgumentException("request body required");
        }
        List<WriteOp> writes = WireCodec.fromRequest(req);
        String opId = req.opId == null || req.opId.isBlank() ? UUID.randomUUID().toString() : req.opId;
        await(store.commit(writes, opId));
    }

    private static PageQuery.Direction parseDirection(String raw) {
        if (raw == null || raw.isBlank()) {
            return PageQuery.Direction.ASCENDING;
        }
        return switch (raw.toLowerCase(Locale.ROOT)) {
            case "asc", "ascending" -> PageQuery.Direction.ASCENDING;
            case "desc", "descending" -> PageQuery.Direction.DESCENDING;
            default -> throw new IllegalArgumentException("direction must be asc or desc, got " + raw);
        };
    }

    private static int parseLimit(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULT_QUERY_LIMIT;
        }
        int limit;
        try {
            limit = Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("limit must be an integer, got " + raw, e);
        }
        if (limit <= 0 || limit > DocumentStore.MAX_BATCH_OPERATIONS) {
            throw new IllegalArgumentException("limit must be in [1, " + DocumentStore.MAX_BATCH_OPERATIONS + "]");
        }
        return limit;
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new StoreException(StoreException.Kind.TRANSIENT, "store call failed", e.getCause());
        }
    }
}
