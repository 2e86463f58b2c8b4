package io.offsync.sync;

/**
 * Thrown when an item has no operation and no handler is registered for its operation type.
 * Items failing this way go straight to {@link SyncStatus#FAILED}.
 */
public class UnhandledOperationException extends RuntimeException {

  public UnhandledOperationException(String message) {
    super(message);
  }
}
