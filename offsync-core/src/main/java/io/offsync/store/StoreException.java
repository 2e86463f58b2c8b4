package io.offsync.store;

/**
 * Thrown by {@link io.offsync.spi.KeyValueStore} implementations when the backing
 * storage cannot be read or written.
 */
public class StoreException extends RuntimeException {

  public StoreException(String message, Throwable cause) {
    super(message, cause);
  }

  public StoreException(String message) {
    super(message);
  }
}
