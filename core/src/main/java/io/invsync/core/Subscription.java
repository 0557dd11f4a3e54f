package io.invsync.core;

/** Handle of a live document subscription. */
public interface Subscription extends AutoCloseable {

    /** Stop delivery. Idempotent. */
    @Override
    void close();
}
