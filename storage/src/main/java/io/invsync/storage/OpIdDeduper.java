package io.invsync.storage;

import java.time.Duration;

/**
 * Remembers commit ids so a retried commit is acknowledged but applied once.
 * <p>
 * Clients retry commits after timeouts without knowing whether the first
 * attempt landed. Every commit carries a client-generated opId; the store asks
 * the deduper before applying it.
 */
public interface OpIdDeduper {
    /** Returns true if this opId was not seen before and is now recorded. */
    boolean firstTime(String opId);

    /** Configure retention window for remembering ids. */
    void setTtl(Duration ttl);
}
