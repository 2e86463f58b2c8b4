package io.offsync.sync;

import java.time.Instant;

/**
 * Point-in-time summary of a {@link SyncQueue}.
 *
 * @param queueLength  items held by the queue, in any status
 * @param pendingCount items waiting for a pass (PENDING or RETRYING)
 * @param failedCount  items parked in FAILED
 * @param syncing      whether a pass is running
 * @param lastSyncTime completion time of the last pass, or {@code null} if none ran
 */
public record SyncQueueStatus(
    int queueLength,
    int pendingCount,
    int failedCount,
    boolean syncing,
    Instant lastSyncTime
) {
}
