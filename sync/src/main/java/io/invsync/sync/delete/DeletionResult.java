package io.invsync.sync.delete;

import java.util.Objects;

/** Outcome of a cascading delete. */
public sealed interface DeletionResult
        permits DeletionResult.Deleted, DeletionResult.AlreadyAbsent, DeletionResult.Failed {

    /** True for {@link Deleted} and {@link AlreadyAbsent}. */
    boolean succeeded();

    /** Root and everything below it were removed. */
    record Deleted(int commits, int operations) implements DeletionResult {
        @Override
        public boolean succeeded() {
            return true;
        }
    }

    /** Root did not exist; nothing was written. */
    record AlreadyAbsent() implements DeletionResult {
        @Override
        public boolean succeeded() {
            return true;
        }
    }

    /**
     * The cascade stopped at the first failure. Batches committed before it
     * stay deleted; running the same plan again finishes the job.
     */
    record Failed(RuntimeException cause, int commitsApplied) implements DeletionResult {
        public Failed {
            Objects.requireNonNull(cause, "cause");
        }

        @Override
        public boolean succeeded() {
            return false;
        }
    }
}
