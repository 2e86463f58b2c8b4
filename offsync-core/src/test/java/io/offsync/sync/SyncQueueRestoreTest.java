package io.offsync.sync;

import io.offsync.MutableClock;
import io.offsync.store.DurableStore;
import io.offsync.store.InMemoryKeyValueStore;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SyncQueueRestoreTest {

    private final InMemoryKeyValueStore kv = new InMemoryKeyValueStore();
    private final MutableClock clock = new MutableClock();

    public record Profile(String name, int age) {
    }

    @Test
    void pendingItemsSurviveRestartAndRunThroughHandler() throws Exception {
        String id;
        try (SyncQueue before = newQueue(new DefaultSyncHandlerRegistry())) {
            id = before.addToSyncQueue("updateProfile", new Profile("Ada", 36),
                    item -> new CompletableFuture<>()).id();
        }

        AtomicReference<Profile> seen = new AtomicReference<>();
        DefaultSyncHandlerRegistry handlers = new DefaultSyncHandlerRegistry()
                .register("updateProfile", item -> {
                    seen.set(item.payload(Profile.class));
                    return CompletableFuture.completedFuture(null);
                });
        try (SyncQueue after = newQueue(handlers)) {
            SyncQueueItem restored = after.item(id).orElseThrow();
            assertEquals(SyncStatus.PENDING, restored.status());
            assertEquals("updateProfile", restored.operationType());

            after.start();
            after.syncNow().get(5, TimeUnit.SECONDS);

            assertEquals(new Profile("Ada", 36), seen.get());
            assertTrue(after.items().isEmpty());
        }
    }

    @Test
    void interruptedExecutionGoesBackToPendingKeepingAttempts() throws Exception {
        String id;
        try (SyncQueue before = newQueue(new DefaultSyncHandlerRegistry())) {
            before.start();
            id = before.addToSyncQueue("updateProfile", "v1", item -> new CompletableFuture<>()).id();
            before.syncNow();
            assertEquals(SyncStatus.SYNCING, before.item(id).orElseThrow().status());
        }

        try (SyncQueue after = newQueue(new DefaultSyncHandlerRegistry())) {
            SyncQueueItem restored = after.item(id).orElseThrow();
            assertEquals(SyncStatus.PENDING, restored.status());
            assertEquals(1, restored.attempts());
        }
    }

    @Test
    void restoredItemWithoutHandlerFails() throws Exception {
        String id;
        try (SyncQueue before = newQueue(new DefaultSyncHandlerRegistry())) {
            id = before.addToSyncQueue("legacyOperation", "v1", item -> new CompletableFuture<>()).id();
        }

        try (SyncQueue after = newQueue(new DefaultSyncHandlerRegistry())) {
            SyncTicket ticket = after.ticket(id).orElseThrow();
            after.start();
            after.syncNow().get(5, TimeUnit.SECONDS);

            SyncQueueItem item = after.item(id).orElseThrow();
            assertEquals(SyncStatus.FAILED, item.status());
            assertTrue(item.lastError().contains("legacyOperation"));
            assertTrue(ticket.result().isCompletedExceptionally());
        }
    }

    @Test
    void overdueRetryWaitsForStartAndLateHandlerRegistration() throws Exception {
        String id;
        try (SyncQueue before = SyncQueue.builder()
                .store(new DurableStore(kv))
                .clock(clock)
                .retryPolicy(attempts -> 60_000L)
                .build()) {
            before.start();
            id = before.addToSyncQueue("updateProfile", new Profile("Ada", 36),
                    item -> CompletableFuture.failedFuture(new IllegalStateException("503"))).id();
            before.syncNow().get(5, TimeUnit.SECONDS);
            assertEquals(SyncStatus.RETRYING, before.item(id).orElseThrow().status());
        }
        clock.advance(Duration.ofMinutes(2));

        DefaultSyncHandlerRegistry handlers = new DefaultSyncHandlerRegistry();
        try (SyncQueue after = newQueue(handlers)) {
            Thread.sleep(300);
            SyncQueueItem waiting = after.item(id).orElseThrow();
            assertEquals(SyncStatus.RETRYING, waiting.status());
            assertEquals(1, waiting.attempts());

            AtomicReference<Profile> seen = new AtomicReference<>();
            handlers.register("updateProfile", item -> {
                seen.set(item.payload(Profile.class));
                return CompletableFuture.completedFuture("ok");
            });
            SyncTicket ticket = after.ticket(id).orElseThrow();
            after.start();

            assertEquals("ok", ticket.result().get(5, TimeUnit.SECONDS));
            assertEquals(new Profile("Ada", 36), seen.get());
            assertTrue(after.items().isEmpty());
        }
    }

    @Test
    void itemsOlderThanMaxAgeAreDropped() {
        try (SyncQueue before = newQueue(new DefaultSyncHandlerRegistry())) {
            before.addToSyncQueue("updateProfile", "old", item -> new CompletableFuture<>());
            clock.advance(Duration.ofHours(23));
            before.addToSyncQueue("updateProfile", "recent", item -> new CompletableFuture<>());
        }
        clock.advance(Duration.ofHours(2));

        try (SyncQueue after = newQueue(new DefaultSyncHandlerRegistry())) {
            List<SyncQueueItem> items = after.items();
            assertEquals(1, items.size());
            assertEquals("recent", items.get(0).payload(String.class));
        }
    }

    @Test
    void failedItemsStayFailedAcrossRestart() throws Exception {
        String id;
        try (SyncQueue before = SyncQueue.builder()
                .store(new DurableStore(kv))
                .clock(clock)
                .maxRetries(0)
                .build()) {
            before.start();
            id = before.addToSyncQueue("updateProfile", "v1",
                    item -> CompletableFuture.failedFuture(new IllegalStateException("409"))).id();
            before.syncNow().get(5, TimeUnit.SECONDS);
        }

        try (SyncQueue after = newQueue(new DefaultSyncHandlerRegistry())) {
            SyncQueueItem item = after.item(id).orElseThrow();
            assertEquals(SyncStatus.FAILED, item.status());
            assertTrue(item.lastError().contains("409"));
            assertEquals(1, after.status().failedCount());
        }
    }

    @Test
    void corruptSnapshotStartsEmpty() {
        kv.set("background_sync_queue", "[{\"broken\":");

        try (SyncQueue queue = newQueue(new DefaultSyncHandlerRegistry())) {
            assertEquals(0, queue.status().queueLength());
        }
    }

    private SyncQueue newQueue(SyncHandlerRegistry handlers) {
        return SyncQueue.builder()
                .store(new DurableStore(kv))
                .handlers(handlers)
                .clock(clock)
                .build();
    }
}
