package io.invsync.sync;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.invsync.core.DocumentStore;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Tuning knobs of the sync and deletion engines.
 *
 *  - viewPageSize:        documents per page for materialized views
 *  - maxPageSize:         upper bound accepted by the page fetcher
 *  - deletePageSize:      documents per page while draining a dependent collection
 *  - batchFlushThreshold: queued writes that trigger a commit
 *  - batchHardLimit:      backend per-commit limit; the threshold must stay below it
 *  - pollInterval:        refresh period for stores that emulate subscriptions by polling
 */
public record SyncConfig(
        int viewPageSize,
        int maxPageSize,
        int deletePageSize,
        int batchFlushThreshold,
        int batchHardLimit,
        Duration pollInterval
) {

    public static final int DEFAULT_VIEW_PAGE_SIZE = 50;
    public static final int DEFAULT_DELETE_PAGE_SIZE = 450;
    public static final int DEFAULT_FLUSH_THRESHOLD = 450;
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(2);

    public SyncConfig {
        Objects.requireNonNull(pollInterval, "pollInterval");
        if (viewPageSize <= 0 || maxPageSize <= 0 || deletePageSize <= 0) {
            throw new IllegalArgumentException("page sizes must be > 0");
        }
        if (viewPageSize > maxPageSize || deletePageSize > maxPageSize) {
            throw new IllegalArgumentException("page sizes must be <= maxPageSize (" + maxPageSize + ")");
        }
        if (batchHardLimit <= 0 || batchHardLimit > DocumentStore.MAX_BATCH_OPERATIONS) {
            throw new IllegalArgumentException("batchHardLimit must be in [1, " + DocumentStore.MAX_BATCH_OPERATIONS + "]");
        }
        // Strictly below the hard limit.
        if (batchFlushThreshold <= 0 || batchFlushThreshold >= batchHardLimit) {
            throw new IllegalArgumentException("batchFlushThreshold must be in [1, batchHardLimit)");
        }
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
    }

    public static SyncConfig defaults() {
        return new SyncConfig(
                DEFAULT_VIEW_PAGE_SIZE,
                DocumentStore.MAX_BATCH_OPERATIONS,
                DEFAULT_DELETE_PAGE_SIZE,
                DEFAULT_FLUSH_THRESHOLD,
                DocumentStore.MAX_BATCH_OPERATIONS,
                DEFAULT_POLL_INTERVAL
        );
    }

    public SyncConfig withBatchFlushThreshold(int threshold) {
        return new SyncConfig(viewPageSize, maxPageSize, deletePageSize, threshold, batchHardLimit, pollInterval);
    }

    public SyncConfig withViewPageSize(int pageSize) {
        return new SyncConfig(pageSize, maxPageSize, deletePageSize, batchFlushThreshold, batchHardLimit, pollInterval);
    }

    public SyncConfig withDeletePageSize(int pageSize) {
        return new SyncConfig(viewPageSize, maxPageSize, pageSize, batchFlushThreshold, batchHardLimit, pollInterval);
    }

    /**
     * Load from a JSON file. Missing keys keep their default.
     * <pre>
     *   { "viewPageSize": 50, "deletePageSize": 450, "batchFlushThreshold": 450, "pollIntervalMillis": 2000 }
     * </pre>
     */
    public static SyncConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        try {
            JsonSyncConfig json = mapper.readValue(path.toFile(), JsonSyncConfig.class);
            SyncConfig d = defaults();
            return new SyncConfig(
                    json.viewPageSize != null ? json.viewPageSize : d.viewPageSize(),
                    json.maxPageSize != null ? json.maxPageSize : d.maxPageSize(),
                    json.deletePageSize != null ? json.deletePageSize : d.deletePageSize(),
                    json.batchFlushThreshold != null ? json.batchFlushThreshold : d.batchFlushThreshold(),
                    json.batchHardLimit != null ? json.batchHardLimit : d.batchHardLimit(),
                    json.pollIntervalMillis != null ? Duration.ofMillis(json.pollIntervalMillis) : d.pollInterval()
            );
        } catch (IOException e) {
            throw new RuntimeException("Failed to load SyncConfig from " + path, e);
        }
    }

    /** Jackson binding for {@link #fromJsonFile(Path)}. */
    public static class JsonSyncConfig {
        public Integer viewPageSize;
        public Integer maxPageSize;
        public Integer deletePageSize;
        public Integer batchFlushThreshold;
        public Integer batchHardLimit;
        public Long pollIntervalMillis;
    }
}
