package io.invsync.sync.delete;

import io.invsync.core.CollectionRef;
import io.invsync.core.Cursor;
import io.invsync.core.Document;
import io.invsync.core.DocumentRef;
import io.invsync.core.DocumentStore;
import io.invsync.core.PageQuery;
import io.invsync.sync.Futures;
import io.invsync.sync.PageFetcher;
import io.invsync.sync.SyncConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Deletes a root document together with its dependents, in bounded batches.
 * <p>
 * Algorithm:
 *  1. Read the root; if absent the job is already done.
 *  2. Resolve auxiliary refs from the root (failure here deletes nothing).
 *  3. Drain each dependent collection page by page, ordered by id, queueing
 *     each document and its linked records.
 *  4. Queue the auxiliary records that exist, then the root, and flush.
 * <p>
 * Batches are committed as they fill up; the first failed read or commit
 * stops the job. Every step only deletes, so re-running after a partial
 * failure converges. Deletions of the same root must not run concurrently.
 */
public final class CascadingDeleter {
    private static final Logger log = Logger.getLogger(CascadingDeleter.class.getName());

    private final DocumentStore store;
    private final SyncConfig config;
    private final PageFetcher fetcher;
    private final Executor executor;

    public CascadingDeleter(DocumentStore store, SyncConfig config, Executor executor) {
        this.store = Objects.requireNonNull(store, "store");
        this.config = Objects.requireNonNull(config, "config");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.fetcher = new PageFetcher(store, config.maxPageSize());
    }

    /**
     * Run {@code plan} on the executor. The future never completes
     * exceptionally: failures are reported as {@link DeletionResult.Failed}.
     */
    public CompletableFuture<DeletionResult> deleteCascade(DeletionPlan plan) {
        Objects.requireNonNull(plan, "plan");
        return CompletableFuture.supplyAsync(() -> run(plan), executor);
    }

    private DeletionResult run(DeletionPlan plan) {
        DocumentRef rootRef = plan.root();
        BatchWriter writer = new BatchWriter(store, config.batchFlushThreshold(), config.batchHardLimit());
        long start = System.nanoTime();
        try {
            Optional<Document> root = Futures.await(store.get(rootRef));
            if (root.isEmpty()) {
                log.log(Level.INFO, "cascade for {0}: root already absent", rootRef);
                return new DeletionResult.AlreadyAbsent();
            }
            Document rootDoc = root.get();
            List<DocumentRef> auxiliary = plan.auxiliaryRecords(rootDoc);

            for (DeletionPlan.DependentStep step : plan.dependents()) {
                int drained = drain(rootDoc, step, writer);
                log.log(Level.FINE, "cascade for {0}: queued {1} {2}", new Object[]{rootRef, drained, step.name()});
            }

            for (DocumentRef aux : auxiliary) {
                if (Futures.await(store.get(aux)).isPresent()) {
                    writer.delete(aux);
                } else {
                    log.log(Level.FINE, "cascade for {0}: auxiliary {1} absent", new Object[]{rootRef, aux});
                }
            }
            writer.delete(rootRef);
            writer.flush();

            long ms = (System.nanoTime() - start) / 1_000_000;
            log.info(String.format("cascade for %s: deleted %d docs in %d commits (%dms)",
                    rootRef, writer.operations(), writer.commits(), ms));
            return new DeletionResult.Deleted(writer.commits(), writer.operations());
        } catch (RuntimeException e) {
            RuntimeException cause = Futures.unwrap(e);
            log.log(Level.WARNING, "cascade for " + rootRef + " failed after " + writer.commits() + " commits", cause);
            return new DeletionResult.Failed(cause, writer.commits());
        }
    }

    /** Queue every document of one dependent collection; returns how many were seen. */
    private int drain(Document rootDoc, DeletionPlan.DependentStep step, BatchWriter writer) {
        CollectionRef collection = step.collection().apply(rootDoc);
        int pageSize = config.deletePageSize();
        Cursor after = null;
        int seen = 0;
        while (true) {
            List<Document> page = Futures.await(
                    fetcher.fetchPage(collection, PageQuery.DOCUMENT_ID, after, pageSize));
            for (Document doc : page) {
                List<DocumentRef> refs = new ArrayList<>();
                refs.add(doc.ref());
                refs.addAll(step.linked().apply(rootDoc, doc));
                for (DocumentRef ref : refs) {
                    writer.delete(ref);
                }
            }
            seen += page.size();
            if (page.size() < pageSize) {
                return seen;
            }
            after = Cursor.after(page.get(page.size() - 1), PageQuery.DOCUMENT_ID);
        }
    }
}
