package io.invsync.sync;

import io.invsync.core.Document;
import io.invsync.core.DocumentListener;
import io.invsync.core.DocumentRef;
import io.invsync.core.DocumentStore;
import io.invsync.core.PageQuery;
import io.invsync.core.StoreException;
import io.invsync.core.Subscription;
import io.invsync.core.WriteOp;
import io.invsync.storage.MemoryDocumentStore;
import io.invsync.storage.TtlOpIdDeduper;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test store: a synchronous {@link MemoryDocumentStore} plus commit accounting,
 * injectable failures and fetches that can be held back and released later.
 */
public final class InstrumentedStore implements DocumentStore {

    public final MemoryDocumentStore memory =
            new MemoryDocumentStore(new TtlOpIdDeduper(Duration.ofMinutes(10)), Runnable::run, Clock.systemUTC());

    /** Operation count of every commit that reached the backing store. */
    public final List<Integer> commitSizes = new CopyOnWriteArrayList<>();
    public final AtomicInteger fetches = new AtomicInteger();

    private final AtomicInteger commitAttempts = new AtomicInteger();
    private volatile int failCommitAttempt = -1;
    private volatile StoreException nextFetchFailure;
    private volatile StoreException getFailure;
    private volatile boolean holdFetches;
    private final List<Runnable> held = new ArrayList<>();
    private final Set<String> refuseSubscribe = ConcurrentHashMap.newKeySet();
    private final Map<DocumentRef, List<DocumentListener>> listeners = new ConcurrentHashMap<>();

    /** Fail the n-th commit attempt (1-based) with a transient error. */
    public void failCommitAttempt(int n) {
        this.failCommitAttempt = n;
    }

    public void failNextFetch(StoreException e) {
        this.nextFetchFailure = e;
    }

    public void failGets(StoreException e) {
        this.getFailure = e;
    }

    /** The next subscribe() for a document with this id throws. */
    public void refuseNextSubscribe(String id) {
        refuseSubscribe.add(id);
    }

    /** Deliver a stream error to every open subscription of {@code ref}. */
    public void emitError(DocumentRef ref, StoreException error) {
        for (DocumentListener l : listeners.getOrDefault(ref, List.of())) {
            l.onError(error);
        }
    }

    public void holdFetches(boolean hold) {
        this.holdFetches = hold;
    }

    /** Complete every held fetch against the current data, oldest first. */
    public void releaseFetches() {
        List<Runnable> toRun;
        synchronized (held) {
            toRun = new ArrayList<>(held);
            held.clear();
        }
        toRun.forEach(Runnable::run);
    }

    public int heldFetches() {
        synchronized (held) {
            return held.size();
        }
    }

    @Override
    public CompletableFuture<List<Document>> fetchPage(PageQuery query) {
        fetches.incrementAndGet();
        StoreException failure = nextFetchFailure;
        if (failure != null) {
            nextFetchFailure = null;
            return CompletableFuture.failedFuture(failure);
        }
        if (!holdFetches) {
            return memory.fetchPage(query);
        }
        CompletableFuture<List<Document>> gate = new CompletableFuture<>();
        synchronized (held) {
            held.add(() -> memory.fetchPage(query).whenComplete((docs, err) -> {
                if (err != null) {
                    gate.completeExceptionally(err);
                } else {
                    gate.complete(docs);
                }
            }));
        }
        return gate;
    }

    @Override
    public CompletableFuture<Optional<Document>> get(DocumentRef ref) {
        StoreException failure = getFailure;
        if (failure != null) {
            return CompletableFuture.failedFuture(failure);
        }
        return memory.get(ref);
    }

    @Override
    public Subscription subscribe(DocumentRef ref, DocumentListener listener) {
        if (refuseSubscribe.remove(ref.id())) {
            throw new StoreException(StoreException.Kind.TRANSIENT, "injected subscribe failure for " + ref);
        }
        List<DocumentListener> forRef = listeners.computeIfAbsent(ref, r -> new CopyOnWriteArrayList<>());
        forRef.add(listener);
        Subscription inner = memory.subscribe(ref, listener);
        return () -> {
            forRef.remove(listener);
            inner.close();
        };
    }

    @Override
    public CompletableFuture<Void> commit(List<WriteOp> writes, String opId) {
        if (commitAttempts.incrementAndGet() == failCommitAttempt) {
            return CompletableFuture.failedFuture(
                    new StoreException(StoreException.Kind.TRANSIENT, "injected commit failure"));
        }
        return memory.commit(writes, opId).thenRun(() -> commitSizes.add(writes.size()));
    }

    public void resetCounters() {
        commitSizes.clear();
        commitAttempts.set(0);
        failCommitAttempt = -1;
        fetches.set(0);
    }
}
