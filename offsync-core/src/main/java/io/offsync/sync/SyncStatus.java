package io.offsync.sync;

/**
 * Lifecycle status of a {@link SyncQueueItem}.
 *
 * <pre>
 * PENDING ──► SYNCING ──► COMPLETED (removed from the queue)
 *                │
 *                ├──► RETRYING ──► SYNCING ...
 *                └──► FAILED   (parked until retried or cleared)
 * </pre>
 */
public enum SyncStatus {
    PENDING,
    SYNCING,
    RETRYING,
    COMPLETED,
    FAILED;

    /**
     * @return {@code true} for statuses that wait to be picked up by a sync pass
     */
    public boolean isAwaitingSync() {
        return this == PENDING || this == RETRYING;
    }
}
