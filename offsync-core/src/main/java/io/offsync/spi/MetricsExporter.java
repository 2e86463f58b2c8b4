package io.offsync.spi;

/**
 * Observability hook for exporting sync queue and prefetch cache counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. See the
 * {@code offsync-micrometer} module for a Micrometer bridge.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of items added to the sync queue.
     */
    void incrementSyncEnqueued();

    /**
     * Increments the count of items whose operation completed successfully.
     */
    void incrementSyncSuccess();

    /**
     * Increments the count of failed executions that were scheduled for another attempt.
     */
    void incrementSyncRetry();

    /**
     * Increments the count of items that exhausted their retries and became FAILED.
     */
    void incrementSyncFailed();

    /**
     * Records the current queue depth.
     *
     * @param pendingCount items awaiting execution (pending or retrying)
     * @param failedCount  items parked in FAILED
     */
    void recordQueueDepths(int pendingCount, int failedCount);

    /**
     * Increments the count of fresh cache reads.
     */
    void incrementCacheHit();

    /**
     * Increments the count of cache reads that found nothing or a stale entry.
     */
    void incrementCacheMiss();

    /**
     * Increments the count of prefetch calls that joined an in-flight fetch for the same key.
     */
    default void incrementPrefetchDeduplicated() {
    }

    /**
     * Increments the count of prefetches whose fetcher failed.
     */
    default void incrementPrefetchFailure() {
    }

    /**
     * Increments the count of cache entries evicted by capacity or expiry.
     *
     * @param count number of entries evicted
     */
    default void incrementCacheEvicted(int count) {
    }

    /**
     * Records the number of entries currently held by the prefetch cache.
     *
     * @param size entry count
     */
    default void recordCacheSize(int size) {
    }

    /**
     * Increments the count of durable storage operations that failed and were degraded.
     */
    default void incrementStoreFailure() {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementSyncEnqueued() {
        }

        @Override
        public void incrementSyncSuccess() {
        }

        @Override
        public void incrementSyncRetry() {
        }

        @Override
        public void incrementSyncFailed() {
        }

        @Override
        public void recordQueueDepths(int pendingCount, int failedCount) {
        }

        @Override
        public void incrementCacheHit() {
        }

        @Override
        public void incrementCacheMiss() {
        }
    }
}
