package io.offsync.sync;

/**
 * Optional per-item outcome notification. Invoked at most once per terminal outcome, after
 * the queue state has been updated and persisted.
 */
public interface SyncCallback {

    SyncCallback NOOP = new SyncCallback() {
    };

    /**
     * Called when the operation completed successfully.
     *
     * @param item the item in its final {@link SyncStatus#COMPLETED} state
     * @param result the value the operation completed with, may be {@code null}
     */
    default void onSuccess(SyncQueueItem item, Object result) {
    }

    /**
     * Called when the item exhausted its retries.
     *
     * @param item the item in its {@link SyncStatus#FAILED} state
     * @param error the last failure
     */
    default void onFailure(SyncQueueItem item, Throwable error) {
    }
}
