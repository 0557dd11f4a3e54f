package io.invsync.sync;

import io.invsync.core.StoreException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Await helpers for code that runs sequentially on a worker thread.
 */
public final class Futures {

    private Futures() {
        // utility
    }

    /**
     * Block until {@code future} completes and return its value, rethrowing
     * the original failure instead of the {@link CompletionException} wrapper.
     */
    public static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            throw unwrap(e);
        }
    }

    /** Strip CompletionException/ExecutionException layers. */
    public static RuntimeException unwrap(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
            cur = cur.getCause();
        }
        if (cur instanceof RuntimeException re) {
            return re;
        }
        return new StoreException(StoreException.Kind.TRANSIENT, String.valueOf(cur.getMessage()), cur);
    }
}
