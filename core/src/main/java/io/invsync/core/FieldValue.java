package io.invsync.core;

/**
 * Write-only sentinels resolved by the store at commit time.
 */
public enum FieldValue {
    /** Replaced with the commit instant when the write is applied. */
    SERVER_TIMESTAMP
}
