package io.offsync.sync;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Handle returned by {@link SyncQueue#addToSyncQueue}.
 *
 * <p>{@link #result()} completes with the operation's value on success, exceptionally with a
 * {@link SyncFailedException} once retries are exhausted, and is cancelled when the item is
 * removed or the queue is cleared first.
 */
public final class SyncTicket {
    private final String id;
    private final CompletableFuture<Object> result;

    SyncTicket(String id) {
        this.id = Objects.requireNonNull(id, "id");
        this.result = new CompletableFuture<>();
    }

    public String id() {
        return id;
    }

    public CompletableFuture<Object> result() {
        return result;
    }

    @Override
    public String toString() {
        return "SyncTicket{id=" + id + ", done=" + result.isDone() + "}";
    }
}
