package io.offsync.sync;

/**
 * Resolves the {@link SyncOperation} for an operation type.
 *
 * <p>Consulted when an item was enqueued without an explicit operation and for items
 * restored from durable storage after a restart, whose in-memory operation was lost.
 *
 * @see DefaultSyncHandlerRegistry
 */
public interface SyncHandlerRegistry {

    /**
     * @param operationType the item's operation type
     * @return the handler, or {@code null} if none is registered
     */
    SyncOperation handlerFor(String operationType);
}
