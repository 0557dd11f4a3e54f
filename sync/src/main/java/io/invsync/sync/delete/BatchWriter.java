package io.invsync.sync.delete;

import io.invsync.core.DocumentRef;
import io.invsync.core.DocumentStore;
import io.invsync.core.WriteOp;
import io.invsync.sync.Futures;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Accumulates writes and commits them in bounded batches.
 * <p>
 * A commit is issued when the queued count reaches the flush threshold, and
 * on {@link #flush()}. The threshold is strictly below the hard limit, so no
 * commit ever exceeds it. Commits are awaited: the writer is meant for a
 * single worker thread running a sequential job.
 * <p>
 * A delete of a document already queued in the current batch is dropped.
 * <p>
 * Not thread-safe.
 */
final class BatchWriter {
    private static final Logger log = Logger.getLogger(BatchWriter.class.getName());

    private final DocumentStore store;
    private final int threshold;
    private final List<WriteOp> pending = new ArrayList<>();
    private final Set<DocumentRef> pendingDeletes = new HashSet<>();

    private int commits;
    private int operations;

    BatchWriter(DocumentStore store, int threshold, int hardLimit) {
        this.store = Objects.requireNonNull(store, "store");
        if (threshold <= 0 || threshold >= hardLimit) {
            throw new IllegalArgumentException("threshold " + threshold + " must be in [1, " + hardLimit + ")");
        }
        this.threshold = threshold;
    }

    /** Queue a delete; returns false if the same delete is already queued. */
    boolean delete(DocumentRef ref) {
        if (!pendingDeletes.add(ref)) {
            return false;
        }
        add(WriteOp.delete(ref));
        return true;
    }

    /** Queue one write, committing first if the threshold is reached. */
    void add(WriteOp op) {
        pending.add(Objects.requireNonNull(op, "op"));
        if (pending.size() >= threshold) {
            flush();
        }
    }

    /**
     * Commit everything queued. No-op when nothing is queued. On failure the
     * queued writes are kept and the store exception is rethrown.
     */
    void flush() {
        if (pending.isEmpty()) {
            return;
        }
        List<WriteOp> batch = List.copyOf(pending);
        String opId = UUID.randomUUID().toString();
        Futures.await(store.commit(batch, opId));
        pending.clear();
        pendingDeletes.clear();
        commits++;
        operations += batch.size();
        log.log(Level.FINE, "committed batch {0} with {1} operations", new Object[]{commits, batch.size()});
    }

    int pendingCount() {
        return pending.size();
    }

    /** Commits applied so far. */
    int commits() {
        return commits;
    }

    /** Operations applied so far, across all commits. */
    int operations() {
        return operations;
    }
}
