package io.invsync.sync.index;

/** What {@link FanoutIndexMaintainer#ensureOwnerIndexed} did. */
public enum IndexRepair {
    ALREADY_PRESENT,
    CREATED,
    /** No root to point at; nothing written. */
    ROOT_MISSING,
    /** A read or write failed; logged. */
    FAILED
}
