package io.offsync.sync;

/**
 * Completes a {@link SyncTicket} whose item exhausted its retries.
 */
public class SyncFailedException extends RuntimeException {
  private final transient SyncQueueItem item;

  public SyncFailedException(SyncQueueItem item, Throwable cause) {
    super("Sync failed for item " + item.id() + " (" + item.operationType() + ") after "
        + item.attempts() + " attempts", cause);
    this.item = item;
  }

  public SyncQueueItem item() {
    return item;
  }
}
