package io.offsync.sync;

import java.util.concurrent.CompletionStage;

/**
 * The remote call that performs a queued write.
 *
 * <p>The returned stage decides the outcome: normal completion means the write succeeded,
 * exceptional completion (or throwing from this method) means it failed and may be retried.
 * Operations can run more than once and should be idempotent on the remote side.
 */
@FunctionalInterface
public interface SyncOperation {

    CompletionStage<?> execute(SyncQueueItem item) throws Exception;
}
