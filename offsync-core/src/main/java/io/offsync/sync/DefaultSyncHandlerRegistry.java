package io.offsync.sync;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe registry with one handler per operation type.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * DefaultSyncHandlerRegistry handlers = new DefaultSyncHandlerRegistry()
 *     .register("updateProfile", item -> api.updateProfile(item.payload(Profile.class)))
 *     .register("postComment", item -> api.postComment(item.payload(Comment.class)));
 * }</pre>
 */
public final class DefaultSyncHandlerRegistry implements SyncHandlerRegistry {
  private final Map<String, SyncOperation> handlers = new ConcurrentHashMap<>();

  /**
   * Registers the handler for an operation type.
   *
   * @param operationType the operation type
   * @param handler the handler
   * @return this registry for chaining
   * @throws IllegalStateException if a handler is already registered for the type
   */
  public DefaultSyncHandlerRegistry register(String operationType, SyncOperation handler) {
    Objects.requireNonNull(operationType, "operationType");
    Objects.requireNonNull(handler, "handler");
    SyncOperation previous = handlers.putIfAbsent(operationType, handler);
    if (previous != null) {
      throw new IllegalStateException("Handler already registered for operationType=" + operationType);
    }
    return this;
  }

  @Override
  public SyncOperation handlerFor(String operationType) {
    return handlers.get(operationType);
  }

  public int size() {
    return handlers.size();
  }
}
