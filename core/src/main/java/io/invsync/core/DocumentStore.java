package io.invsync.core;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous contract of the remote document store.
 * <p>
 * Semantics:
 *  - fetchPage() returns documents of one collection ordered by the query's
 *    order field with the document id as tiebreaker, strictly after the
 *    query's cursor. Documents without the order field are not returned.
 *  - get() resolves to empty when the document does not exist.
 *  - subscribe() delivers the current state first, then every change,
 *    including deletion (an event with exists=false).
 *  - commit() applies all writes atomically or none of them. A batch larger
 *    than {@link #MAX_BATCH_OPERATIONS} is rejected with INVALID_ARGUMENT.
 *    Re-sending a commit with the same opId is acknowledged without being
 *    applied twice.
 * <p>
 * Failures complete the returned future exceptionally with a
 * {@link StoreException}.
 */
public interface DocumentStore {

    /** Hard per-commit operation limit of the backend. */
    int MAX_BATCH_OPERATIONS = 500;

    CompletableFuture<List<Document>> fetchPage(PageQuery query);

    CompletableFuture<Optional<Document>> get(DocumentRef ref);

    Subscription subscribe(DocumentRef ref, DocumentListener listener);

    CompletableFuture<Void> commit(List<WriteOp> writes, String opId);

    default CompletableFuture<Void> commit(List<WriteOp> writes) {
        return commit(writes, UUID.randomUUID().toString());
    }

    /** Single-document write; {@code merge=true} keeps fields not mentioned. */
    default CompletableFuture<Void> set(DocumentRef ref, Map<String, ?> fields, boolean merge) {
        WriteOp op = merge ? WriteOp.merge(ref, fields) : WriteOp.set(ref, fields);
        return commit(List.of(op));
    }

    default CompletableFuture<Void> delete(DocumentRef ref) {
        return commit(List.of(WriteOp.delete(ref)));
    }
}
