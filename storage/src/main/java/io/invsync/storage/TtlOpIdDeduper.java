package io.invsync.storage;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * OpId deduper with a retention window.
 *
 * Semantics:
 *  - firstTime(opId) is true for an opId not recorded within the last TTL,
 *    false for a repeat inside the window.
 *  - Expired ids are purged lazily: each call scans a bounded slice of the
 *    map, so there is no background thread.
 */
public final class TtlOpIdDeduper implements OpIdDeduper {

    private static final int PURGE_SCAN_LIMIT = 64;

    /** opId -> expiry in epoch millis. */
    private final Map<String, Long> expiries = new ConcurrentHashMap<>();
    private final Clock clock;

    private volatile long ttlMillis;

    public TtlOpIdDeduper(Duration ttl) {
        this(ttl, Clock.systemUTC());
    }

    public TtlOpIdDeduper(Duration ttl, Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        setTtl(ttl);
    }

    @Override
    public boolean firstTime(String opId) {
        Objects.requireNonNull(opId, "opId");
        long now = clock.millis();
        long expireAt = now + ttlMillis;

        boolean[] fresh = {false};
        expiries.compute(opId, (id, previous) -> {
            if (previous != null && previous >= now) {
                return previous;
            }
            fresh[0] = true;
            return expireAt;
        });

        purgeExpired(now);
        return fresh[0];
    }

    @Override
    public void setTtl(Duration ttl) {
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive, got: " + ttl);
        }
        this.ttlMillis = ttl.toMillis();
    }

    int size() {
        return expiries.size();
    }

    private void purgeExpired(long now) {
        int scanned = 0;
        for (var it = expiries.entrySet().iterator(); it.hasNext() && scanned < PURGE_SCAN_LIMIT; scanned++) {
            if (it.next().getValue() < now) {
                it.remove();
            }
        }
    }
}
