package io.invsync.sync.view;

import io.invsync.core.DocumentStore;
import io.invsync.sync.Futures;
import io.invsync.sync.PageFetcher;
import io.invsync.sync.SyncConfig;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Caller-facing lifecycle around one {@link MaterializedView}.
 * <p>
 * Lifecycle: NEW -> ACTIVE (startSession) -> ENDED (endSession).
 * <p>
 * Paging:
 *  - at most one page request in flight per view generation;
 *  - the cursor advances only when a page is merged, so a failed request is
 *    reported to the caller and can be retried as is;
 *  - results arriving after reload() or endSession() are discarded.
 * <p>
 * One session belongs to one screen/consumer and is never shared.
 */
public final class ViewSession<T> implements PagedSession<T> {
    private static final Logger log = Logger.getLogger(ViewSession.class.getName());

    public enum State { NEW, ACTIVE, ENDED }

    private final ViewDefinition<T> definition;
    private final PageFetcher fetcher;
    private final int pageSize;
    private final MaterializedView view;
    private final Supplier<CompletableFuture<?>> startHook;

    private final AtomicReference<State> state = new AtomicReference<>(State.NEW);
    /** Generation of the in-flight page request, or null when idle. */
    private final AtomicReference<Long> inFlight = new AtomicReference<>();

    public ViewSession(DocumentStore store, ViewDefinition<T> definition, SyncConfig config, Consumer<List<T>> listener) {
        this(store, definition, config, listener, null);
    }

    /**
     * @param listener  receives the projected snapshot after every view change; must not block
     * @param startHook optional best-effort work run before the first page
     *                  (its failure is logged, not propagated)
     */
    public ViewSession(
            DocumentStore store,
            ViewDefinition<T> definition,
            SyncConfig config,
            Consumer<List<T>> listener,
            Supplier<CompletableFuture<?>> startHook
    ) {
        Objects.requireNonNull(store, "store");
        Objects.requireNonNull(listener, "listener");
        this.definition = Objects.requireNonNull(definition, "definition");
        this.pageSize = config.viewPageSize();
        this.fetcher = new PageFetcher(store, config.maxPageSize());
        this.startHook = startHook;
        this.view = new MaterializedView(
                definition.collection(),
                definition.orderField(),
                store,
                entries -> listener.accept(project(entries))
        );
    }

    /** Start the session and load the first page. */
    @Override
    public CompletableFuture<PageOutcome> startSession() {
        if (!state.compareAndSet(State.NEW, State.ACTIVE)) {
            throw new IllegalStateException("session already " + state.get().name().toLowerCase(java.util.Locale.ROOT));
        }
        log.log(Level.INFO, "session started for {0}", definition.collection());
        if (startHook == null) {
            return onNextPageNeeded();
        }
        CompletableFuture<?> hook;
        try {
            hook = startHook.get();
        } catch (RuntimeException e) {
            hook = CompletableFuture.failedFuture(e);
        }
        return hook
                .handle((ignored, err) -> {
                    if (err != null) {
                        log.log(Level.WARNING, "session start hook failed for " + definition.collection(), Futures.unwrap(err));
                    }
                    return null;
                })
                .thenCompose(ignored -> onNextPageNeeded());
    }

    /**
     * Request the next page. Completes exceptionally with the store failure
     * if the fetch fails; view state is left unchanged in that case.
     */
    @Override
    public CompletableFuture<PageOutcome> onNextPageNeeded() {
        switch (state.get()) {
            case NEW -> throw new IllegalStateException("session not started");
            case ENDED -> {
                return CompletableFuture.completedFuture(PageOutcome.DISCARDED);
            }
            default -> { }
        }
        if (view.reachedEnd()) {
            return CompletableFuture.completedFuture(PageOutcome.REACHED_END);
        }

        Long generation = view.generation();
        Long current = inFlight.get();
        if ((current != null && current.equals(generation)) || !inFlight.compareAndSet(current, generation)) {
            return CompletableFuture.completedFuture(PageOutcome.ALREADY_LOADING);
        }

        CompletableFuture<PageOutcome> result;
        try {
            result = fetcher
                    .fetchPage(definition.collection(), definition.orderField(), definition.direction(), view.cursor(), pageSize)
                    .thenCompose(docs -> view.ingestPage(generation, docs)
                            .thenApply(applied -> !applied
                                    ? PageOutcome.DISCARDED
                                    : docs.isEmpty() ? PageOutcome.REACHED_END : PageOutcome.LOADED));
        } catch (RuntimeException e) {
            result = CompletableFuture.failedFuture(e);
        }
        return result.whenComplete((outcome, err) -> {
            inFlight.compareAndSet(generation, null);
            if (err != null) {
                log.log(Level.FINE, "page fetch failed for " + definition.collection(), Futures.unwrap(err));
            }
        });
    }

    /** Drop everything and load the first page again. */
    public CompletableFuture<PageOutcome> reload() {
        if (state.get() != State.ACTIVE) {
            throw new IllegalStateException("reload requires an active session, state=" + state.get());
        }
        view.reset();
        return onNextPageNeeded();
    }

    /** Projected rows in view order. */
    @Override
    public List<T> currentSnapshot() {
        return project(view.snapshot());
    }

    /**
     * End the session. Synchronous: when this returns all subscriptions are
     * closed. Idempotent.
     */
    @Override
    public void endSession() {
        if (state.getAndSet(State.ENDED) != State.ENDED) {
            view.dispose();
            log.log(Level.INFO, "session ended for {0}", definition.collection());
        }
    }

    public State state() {
        return state.get();
    }

    public boolean reachedEnd() {
        return view.reachedEnd();
    }

    /** Underlying view, for inspection. */
    public MaterializedView view() {
        return view;
    }

    private List<T> project(List<ViewEntry> entries) {
        return entries.stream().map(definition.projection()).toList();
    }
}
