package io.invsync.sync.view;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/** A paged, live list owned by one consumer. */
public interface PagedSession<T> {

    CompletableFuture<PageOutcome> startSession();

    CompletableFuture<PageOutcome> onNextPageNeeded();

    List<T> currentSnapshot();

    void endSession();
}
