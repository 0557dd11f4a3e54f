package io.invsync.core;

import java.util.Objects;

/**
 * Failure reported by a {@link DocumentStore}.
 * <p>
 * The kind lets callers tell a retryable backend hiccup apart from a
 * permission problem; the sync engine itself treats all kinds alike
 * (report to the caller, leave local state untouched).
 */
public class StoreException extends RuntimeException {

    public enum Kind {
        /** Network or backend failure; safe to retry. */
        TRANSIENT,
        /** Caller is not allowed to perform the operation. */
        PERMISSION_DENIED,
        /** Malformed request (bad path, oversized batch, ...). */
        INVALID_ARGUMENT,
        /** Addressed resource does not exist where existence is required. */
        NOT_FOUND
    }

    private final Kind kind;

    public StoreException(Kind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public StoreException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public Kind kind() {
        return kind;
    }

    public boolean retryable() {
        return kind == Kind.TRANSIENT;
    }
}
