package io.offsync.sync;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import io.offsync.MutableClock;
import io.offsync.RecordingMetricsExporter;
import io.offsync.connectivity.DefaultConnectivityMonitor;
import io.offsync.spi.ConnectivityListener;
import io.offsync.spi.ConnectivityMonitor;
import io.offsync.store.DurableStore;
import io.offsync.store.FailingKeyValueStore;
import io.offsync.store.InMemoryKeyValueStore;
import io.offsync.util.JacksonJsonCodec;
import io.offsync.util.JsonCodec;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SyncQueueTest {

    private final InMemoryKeyValueStore kv = new InMemoryKeyValueStore();
    private final DurableStore store = new DurableStore(kv);

    // ── Builder validation ──────────────────────────────────────────

    @Test
    void builderRejectsMissingStore() {
        assertThrows(NullPointerException.class, () -> SyncQueue.builder().build());
    }

    @Test
    void builderRejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> SyncQueue.builder().store(store).batchSize(0).build());
        assertThrows(IllegalArgumentException.class, () -> SyncQueue.builder().store(store).maxRetries(-1).build());
        assertThrows(IllegalArgumentException.class, () -> SyncQueue.builder().store(store).onlineIntervalMs(0).build());
        assertThrows(IllegalArgumentException.class, () -> SyncQueue.builder().store(store).jitter(1.5).build());
    }

    // ── Enqueue ─────────────────────────────────────────────────────

    @Test
    void addPersistsWithoutExecuting() {
        AtomicInteger calls = new AtomicInteger();
        try (SyncQueue queue = newQueue().build()) {
            SyncTicket ticket = queue.addToSyncQueue("updateProfile", Map.of("name", "Ada"), item -> {
                calls.incrementAndGet();
                return CompletableFuture.completedFuture(null);
            });

            SyncQueueItem item = queue.item(ticket.id()).orElseThrow();
            assertEquals(SyncStatus.PENDING, item.status());
            assertEquals(0, item.attempts());
            assertEquals(SyncPriority.NORMAL, item.priority());
            assertNull(item.lastError());
            assertEquals(0, calls.get());
            assertTrue(kv.get("background_sync_queue").orElseThrow().contains(ticket.id()));
        }
    }

    @Test
    void idsAreUniqueAndOrdered() {
        try (SyncQueue queue = newQueue().build()) {
            String first = queue.addToSyncQueue("a", 1, SyncQueueTest::succeed).id();
            String second = queue.addToSyncQueue("a", 2, SyncQueueTest::succeed).id();

            assertNotEquals(first, second);
            assertTrue(first.compareTo(second) < 0);
        }
    }

    @Test
    void payloadIsCapturedAtEnqueueTime() {
        try (SyncQueue queue = newQueue().build()) {
            Map<String, Object> payload = new HashMap<>();
            payload.put("name", "Ada");
            SyncTicket ticket = queue.addToSyncQueue("updateProfile", payload, SyncQueueTest::succeed);
            payload.put("name", "Grace");

            Map<?, ?> captured = queue.item(ticket.id()).orElseThrow().payload(Map.class);
            assertEquals("Ada", captured.get("name"));
        }
    }

    @Test
    void addWithoutOperationRequiresRegisteredHandler() {
        try (SyncQueue queue = newQueue().build()) {
            assertThrows(UnhandledOperationException.class, () -> queue.addToSyncQueue("unknown", "x"));
            assertEquals(0, queue.status().queueLength());
        }
    }

    @Test
    void addAfterCloseIsRejected() {
        SyncQueue queue = newQueue().build();
        queue.close();
        assertThrows(IllegalStateException.class, () -> queue.addToSyncQueue("a", 1, SyncQueueTest::succeed));
    }

    // ── Processing ──────────────────────────────────────────────────

    @Test
    void successfulItemIsRemovedAndTicketCompleted() throws Exception {
        AtomicReference<Object> callbackResult = new AtomicReference<>();
        try (SyncQueue queue = newQueue().build()) {
            queue.start();
            SyncTicket ticket = queue.addToSyncQueue("postComment", "hello",
                    item -> CompletableFuture.completedFuture("created"),
                    new SyncCallback() {
                        @Override
                        public void onSuccess(SyncQueueItem item, Object result) {
                            callbackResult.set(result);
                        }
                    });

            queue.syncNow().get(5, TimeUnit.SECONDS);

            assertEquals("created", ticket.result().get(5, TimeUnit.SECONDS));
            assertEquals("created", callbackResult.get());
            assertTrue(queue.items().isEmpty());
            assertNotNull(queue.status().lastSyncTime());
            assertFalse(kv.get("background_sync_queue").orElseThrow().contains(ticket.id()));
        }
    }

    @Test
    void completedItemIsNeverExecutedAgain() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        try (SyncQueue queue = newQueue().build()) {
            queue.start();
            SyncTicket ticket = queue.addToSyncQueue("postComment", "hello", item -> {
                calls.incrementAndGet();
                return CompletableFuture.completedFuture("created");
            });

            queue.syncNow().get(5, TimeUnit.SECONDS);
            assertEquals("created", ticket.result().get(5, TimeUnit.SECONDS));

            queue.syncNow().get(5, TimeUnit.SECONDS);
            queue.processSyncQueue().get(5, TimeUnit.SECONDS);

            assertEquals(1, calls.get());
            assertTrue(queue.item(ticket.id()).isEmpty());
        }
    }

    @Test
    void nothingRunsBeforeStart() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        try (SyncQueue queue = newQueue().build()) {
            SyncTicket ticket = queue.addToSyncQueue("a", 1, item -> {
                calls.incrementAndGet();
                return CompletableFuture.completedFuture(null);
            });

            queue.syncNow().get(5, TimeUnit.SECONDS);
            assertEquals(0, calls.get());
            assertEquals(SyncStatus.PENDING, queue.item(ticket.id()).orElseThrow().status());

            queue.start();
            queue.syncNow().get(5, TimeUnit.SECONDS);
            ticket.result().get(5, TimeUnit.SECONDS);
            assertEquals(1, calls.get());
        }
    }

    @Test
    void retriesBackOffExponentiallyFromRetryDelay() throws Exception {
        MutableClock clock = new MutableClock();
        Instant start = clock.instant();
        try (SyncQueue queue = SyncQueue.builder()
                .store(store)
                .clock(clock)
                .retryDelayMs(1000)
                .jitter(0)
                .onlineIntervalMs(60_000)
                .offlineIntervalMs(60_000)
                .build()) {
            queue.start();
            SyncTicket ticket = queue.addToSyncQueue("updateProfile", "v2",
                    item -> CompletableFuture.failedFuture(new IllegalStateException("503")));

            queue.syncNow().get(5, TimeUnit.SECONDS);
            SyncQueueItem first = queue.item(ticket.id()).orElseThrow();
            assertEquals(SyncStatus.RETRYING, first.status());
            assertEquals(start.plusMillis(2000), first.nextAttemptAt());

            clock.advance(Duration.ofMillis(2000));
            queue.syncNow().get(5, TimeUnit.SECONDS);
            SyncQueueItem second = queue.item(ticket.id()).orElseThrow();
            assertEquals(2, second.attempts());
            assertEquals(start.plusMillis(2000 + 4000), second.nextAttemptAt());
        }
    }

    @Test
    void failedItemIsRetriedUntilItSucceeds() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        RecordingMetricsExporter metrics = new RecordingMetricsExporter();
        try (SyncQueue queue = newQueue().metrics(metrics).build()) {
            queue.start();
            SyncTicket ticket = queue.addToSyncQueue("updateProfile", "v2", item -> {
                if (calls.incrementAndGet() < 3) {
                    return CompletableFuture.failedFuture(new IllegalStateException("503"));
                }
                return CompletableFuture.completedFuture("ok");
            });

            queue.syncNow();

            assertEquals("ok", ticket.result().get(5, TimeUnit.SECONDS));
            assertEquals(3, calls.get());
            assertEquals(2, metrics.retry.get());
            assertEquals(1, metrics.success.get());
            assertTrue(queue.items().isEmpty());
        }
    }

    @Test
    void retryingItemRecordsErrorAndNextAttempt() throws Exception {
        try (SyncQueue queue = newQueue().retryPolicy(attempts -> 60_000L).build()) {
            queue.start();
            SyncTicket ticket = queue.addToSyncQueue("updateProfile", "v2",
                    item -> CompletableFuture.failedFuture(new IllegalStateException("503")));

            queue.syncNow().get(5, TimeUnit.SECONDS);

            SyncQueueItem item = queue.item(ticket.id()).orElseThrow();
            assertEquals(SyncStatus.RETRYING, item.status());
            assertEquals(1, item.attempts());
            assertTrue(item.lastError().contains("503"));
            assertNotNull(item.nextAttemptAt());
            assertEquals(1, queue.status().pendingCount());
            assertFalse(ticket.result().isDone());
        }
    }

    @Test
    void itemFailsAfterMaxRetries() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        AtomicInteger failureCallbacks = new AtomicInteger();
        RecordingMetricsExporter metrics = new RecordingMetricsExporter();
        try (SyncQueue queue = newQueue().maxRetries(2).metrics(metrics).build()) {
            queue.start();
            SyncTicket ticket = queue.addToSyncQueue("updateProfile", "v2", item -> {
                calls.incrementAndGet();
                return CompletableFuture.failedFuture(new IllegalStateException("503"));
            }, new SyncCallback() {
                @Override
                public void onFailure(SyncQueueItem item, Throwable error) {
                    failureCallbacks.incrementAndGet();
                }
            });

            queue.syncNow();

            ExecutionException thrown = assertThrows(ExecutionException.class,
                    () -> ticket.result().get(5, TimeUnit.SECONDS));
            SyncFailedException failure = assertInstanceOf(SyncFailedException.class, thrown.getCause());
            assertEquals("503", failure.getCause().getMessage());
            assertEquals(3, calls.get());
            assertEquals(1, failureCallbacks.get());

            SyncQueueItem item = queue.item(ticket.id()).orElseThrow();
            assertEquals(SyncStatus.FAILED, item.status());
            assertEquals(3, item.attempts());
            assertNull(item.nextAttemptAt());
            assertEquals(1, queue.status().failedCount());
            assertEquals(1, metrics.failed.get());
            assertEquals(1, metrics.lastFailed);
        }
    }

    @Test
    void synchronousThrowCountsAsFailure() throws Exception {
        try (SyncQueue queue = newQueue().maxRetries(0).build()) {
            queue.start();
            SyncTicket ticket = queue.addToSyncQueue("updateProfile", "v2", item -> {
                throw new IllegalStateException("bad request");
            });

            queue.syncNow().get(5, TimeUnit.SECONDS);

            assertEquals(SyncStatus.FAILED, queue.item(ticket.id()).orElseThrow().status());
            assertTrue(ticket.result().isCompletedExceptionally());
        }
    }

    @Test
    void nullStageCountsAsFailure() throws Exception {
        try (SyncQueue queue = newQueue().maxRetries(0).build()) {
            queue.start();
            SyncTicket ticket = queue.addToSyncQueue("updateProfile", "v2", item -> null);

            queue.syncNow().get(5, TimeUnit.SECONDS);

            assertEquals(SyncStatus.FAILED, queue.item(ticket.id()).orElseThrow().status());
        }
    }

    @Test
    void passTakesHighestPriorityFirstThenEnqueueOrder() throws Exception {
        List<String> order = Collections.synchronizedList(new ArrayList<>());
        try (SyncQueue queue = newQueue().batchSize(1).build()) {
            queue.start();
            queue.addToSyncQueue("a", 1, recordingOp(order, "a"), null, SyncPriority.NORMAL);
            queue.addToSyncQueue("b", 2, recordingOp(order, "b"), null, SyncPriority.LOW);
            queue.addToSyncQueue("c", 3, recordingOp(order, "c"), null, SyncPriority.HIGH);
            queue.addToSyncQueue("d", 4, recordingOp(order, "d"), null, SyncPriority.NORMAL);

            for (int i = 0; i < 4; i++) {
                queue.syncNow().get(5, TimeUnit.SECONDS);
            }

            assertEquals(List.of("c", "a", "d", "b"), order);
        }
    }

    @Test
    void passIsLimitedToBatchSize() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        try (SyncQueue queue = newQueue().batchSize(2).build()) {
            queue.start();
            for (int i = 0; i < 5; i++) {
                queue.addToSyncQueue("a", i, item -> {
                    calls.incrementAndGet();
                    return CompletableFuture.completedFuture(null);
                });
            }

            queue.syncNow().get(5, TimeUnit.SECONDS);

            assertEquals(2, calls.get());
            assertEquals(3, queue.status().queueLength());
        }
    }

    @Test
    void concurrentTriggerJoinsRunningPass() throws Exception {
        CompletableFuture<Object> remote = new CompletableFuture<>();
        AtomicInteger calls = new AtomicInteger();
        try (SyncQueue queue = newQueue().build()) {
            queue.start();
            SyncTicket ticket = queue.addToSyncQueue("a", 1, item -> {
                calls.incrementAndGet();
                return remote;
            });

            CompletableFuture<Void> first = queue.syncNow();
            CompletableFuture<Void> second = queue.processSyncQueue();

            assertSame(first, second);
            assertTrue(queue.status().syncing());
            awaitStatus(queue, ticket.id(), SyncStatus.SYNCING);

            remote.complete("done");
            first.get(5, TimeUnit.SECONDS);
            assertEquals("done", ticket.result().get(5, TimeUnit.SECONDS));
            assertEquals(1, calls.get());
        }
    }

    @Test
    void itemsEnqueuedDuringPassRunInFollowUpPass() throws Exception {
        CompletableFuture<Object> remote = new CompletableFuture<>();
        try (SyncQueue queue = newQueue().build()) {
            queue.start();
            queue.addToSyncQueue("a", 1, item -> remote);
            CompletableFuture<Void> pass = queue.syncNow();

            SyncTicket late = queue.addToSyncQueue("b", 2, SyncQueueTest::succeed);
            queue.syncNow();
            remote.complete(null);
            pass.get(5, TimeUnit.SECONDS);

            late.result().get(5, TimeUnit.SECONDS);
            assertTrue(queue.items().isEmpty());
        }
    }

    @Test
    void triggersRacingPassCompletionAreNotLost() throws Exception {
        ExecutorService remote = Executors.newFixedThreadPool(2);
        ExecutorService callers = Executors.newFixedThreadPool(4);
        try (SyncQueue queue = newQueue().batchSize(100).build()) {
            queue.start();
            List<Future<List<SyncTicket>>> submitted = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                submitted.add(callers.submit(() -> {
                    List<SyncTicket> tickets = new ArrayList<>();
                    for (int i = 0; i < 25; i++) {
                        tickets.add(queue.addToSyncQueue("a", i,
                                item -> CompletableFuture.supplyAsync(() -> "ok", remote)));
                        queue.syncNow();
                    }
                    return tickets;
                }));
            }

            for (Future<List<SyncTicket>> future : submitted) {
                for (SyncTicket ticket : future.get(10, TimeUnit.SECONDS)) {
                    assertEquals("ok", ticket.result().get(10, TimeUnit.SECONDS));
                }
            }
            assertTrue(queue.items().isEmpty());
        } finally {
            callers.shutdownNow();
            remote.shutdownNow();
        }
    }

    @Test
    void disabledQueueNeverExecutes() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        try (SyncQueue queue = newQueue().enabled(false).build()) {
            queue.start();
            queue.addToSyncQueue("a", 1, item -> {
                calls.incrementAndGet();
                return CompletableFuture.completedFuture(null);
            });

            queue.syncNow().get(5, TimeUnit.SECONDS);

            assertEquals(0, calls.get());
            assertEquals(1, queue.status().pendingCount());
        }
    }

    // ── Connectivity ────────────────────────────────────────────────

    @Test
    void offlineQueueDrainsWhenConnectivityReturns() throws Exception {
        DefaultConnectivityMonitor monitor = new DefaultConnectivityMonitor(false);
        List<String> order = Collections.synchronizedList(new ArrayList<>());
        try (SyncQueue queue = newQueue().connectivity(monitor).build()) {
            queue.start();
            SyncTicket first = queue.addToSyncQueue("a", 1, recordingOp(order, "a"));
            SyncTicket second = queue.addToSyncQueue("b", 2, recordingOp(order, "b"));

            queue.syncNow().get(5, TimeUnit.SECONDS);
            assertTrue(order.isEmpty());
            assertFalse(queue.status().syncing());

            monitor.setOnline(true);

            first.result().get(5, TimeUnit.SECONDS);
            second.result().get(5, TimeUnit.SECONDS);
            assertEquals(2, order.size());
            assertTrue(order.containsAll(List.of("a", "b")));
        }
    }

    @Test
    void periodicTickProcessesQueue() throws Exception {
        try (SyncQueue queue = newQueue().onlineIntervalMs(20).build()) {
            queue.start();
            SyncTicket ticket = queue.addToSyncQueue("a", 1, SyncQueueTest::succeed);

            ticket.result().get(5, TimeUnit.SECONDS);
        }
    }

    @Test
    void tickIntervalFollowsConnectivity() throws Exception {
        SwitchableMonitor monitor = new SwitchableMonitor();
        try (SyncQueue queue = newQueue().onlineIntervalMs(20).offlineIntervalMs(60_000)
                .connectivity(monitor).build()) {
            queue.start();
            Thread.sleep(200);
            int whileOffline = monitor.checks.get();
            assertTrue(whileOffline <= 2, "offline checks: " + whileOffline);

            monitor.switchTo(true);
            long deadline = System.currentTimeMillis() + 5000;
            while (monitor.checks.get() < whileOffline + 5 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            assertTrue(monitor.checks.get() >= whileOffline + 5, "online checks: " + monitor.checks.get());

            monitor.switchTo(false);
            Thread.sleep(50);
            int afterSwitch = monitor.checks.get();
            Thread.sleep(200);
            assertTrue(monitor.checks.get() - afterSwitch <= 1, "checks after going offline");
        }
    }

    // ── Removal ─────────────────────────────────────────────────────

    @Test
    void removedItemOutcomeIsDiscarded() throws Exception {
        CompletableFuture<Object> remote = new CompletableFuture<>();
        AtomicInteger callbacks = new AtomicInteger();
        try (SyncQueue queue = newQueue().build()) {
            queue.start();
            SyncTicket ticket = queue.addToSyncQueue("a", 1, item -> remote, new SyncCallback() {
                @Override
                public void onSuccess(SyncQueueItem item, Object result) {
                    callbacks.incrementAndGet();
                }
            });
            CompletableFuture<Void> pass = queue.syncNow();
            awaitStatus(queue, ticket.id(), SyncStatus.SYNCING);

            assertTrue(queue.removeFromSyncQueue(ticket.id()));
            assertFalse(queue.removeFromSyncQueue(ticket.id()));
            remote.complete("late");
            pass.get(5, TimeUnit.SECONDS);

            assertTrue(ticket.result().isCancelled());
            assertEquals(0, callbacks.get());
            assertTrue(queue.items().isEmpty());
        }
    }

    @Test
    void clearCancelsPendingRetries() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        try (SyncQueue queue = newQueue().retryPolicy(attempts -> 150L).build()) {
            queue.start();
            SyncTicket ticket = queue.addToSyncQueue("a", 1, item -> {
                calls.incrementAndGet();
                return CompletableFuture.failedFuture(new IllegalStateException("503"));
            });
            queue.syncNow().get(5, TimeUnit.SECONDS);
            assertEquals(SyncStatus.RETRYING, queue.item(ticket.id()).orElseThrow().status());

            queue.clearSyncQueue();
            Thread.sleep(400);

            assertEquals(1, calls.get());
            assertEquals(0, queue.status().queueLength());
            assertTrue(ticket.result().isCancelled());
            assertEquals("[]", kv.get("background_sync_queue").orElseThrow());
        }
    }

    // ── Handlers and manual recovery ────────────────────────────────

    @Test
    void registeredHandlerExecutesItemsWithoutOperation() throws Exception {
        AtomicReference<String> seen = new AtomicReference<>();
        DefaultSyncHandlerRegistry handlers = new DefaultSyncHandlerRegistry()
                .register("postComment", item -> {
                    seen.set(item.payload(String.class));
                    return CompletableFuture.completedFuture(null);
                });
        try (SyncQueue queue = newQueue().handlers(handlers).build()) {
            queue.start();
            SyncTicket ticket = queue.addToSyncQueue("postComment", "hello");

            queue.syncNow().get(5, TimeUnit.SECONDS);

            ticket.result().get(5, TimeUnit.SECONDS);
            assertEquals("hello", seen.get());
        }
    }

    @Test
    void payloadDecodesWithTheQueueCodec() throws Exception {
        ObjectMapper snakeCase = JacksonJsonCodec.defaultObjectMapper()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        DurableStore snakeCaseStore = new DurableStore(kv, new JacksonJsonCodec(snakeCase), null);
        AtomicReference<Profile> seen = new AtomicReference<>();
        try (SyncQueue queue = SyncQueue.builder().store(snakeCaseStore).build()) {
            queue.start();
            SyncTicket ticket = queue.addToSyncQueue("updateProfile", new Profile("Ada Lovelace"), item -> {
                seen.set(queue.payload(item, Profile.class));
                return CompletableFuture.completedFuture(null);
            });
            assertTrue(queue.item(ticket.id()).orElseThrow().payloadJson().contains("display_name"));

            queue.syncNow().get(5, TimeUnit.SECONDS);

            ticket.result().get(5, TimeUnit.SECONDS);
            assertEquals(new Profile("Ada Lovelace"), seen.get());
        }
    }

    @Test
    void retryRevivesFailedItemWithNewTicket() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        try (SyncQueue queue = newQueue().maxRetries(0).build()) {
            queue.start();
            SyncTicket ticket = queue.addToSyncQueue("a", 1, item -> calls.incrementAndGet() == 1
                    ? CompletableFuture.failedFuture(new IllegalStateException("503"))
                    : CompletableFuture.completedFuture("ok"));
            queue.syncNow().get(5, TimeUnit.SECONDS);
            assertTrue(ticket.result().isCompletedExceptionally());

            SyncTicket retried = queue.retry(ticket.id()).orElseThrow();
            assertNotSame(ticket, retried);
            SyncQueueItem item = queue.item(ticket.id()).orElseThrow();
            assertEquals(SyncStatus.PENDING, item.status());
            assertEquals(0, item.attempts());
            assertNull(item.lastError());

            queue.syncNow().get(5, TimeUnit.SECONDS);
            assertEquals("ok", retried.result().get(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void retryIgnoresItemsThatAreNotFailed() {
        try (SyncQueue queue = newQueue().build()) {
            SyncTicket ticket = queue.addToSyncQueue("a", 1, SyncQueueTest::succeed);
            assertTrue(queue.retry(ticket.id()).isEmpty());
            assertTrue(queue.retry("missing").isEmpty());
        }
    }

    @Test
    void retryAllAndClearFailed() throws Exception {
        try (SyncQueue queue = newQueue().maxRetries(0).build()) {
            queue.start();
            for (int i = 0; i < 3; i++) {
                queue.addToSyncQueue("a", i, item -> CompletableFuture.failedFuture(new IllegalStateException("x")));
            }
            queue.syncNow().get(5, TimeUnit.SECONDS);
            assertEquals(3, queue.status().failedCount());

            assertEquals(3, queue.retryAllFailed());
            assertEquals(3, queue.status().pendingCount());

            queue.syncNow().get(5, TimeUnit.SECONDS);
            assertEquals(3, queue.clearFailed());
            assertEquals(0, queue.status().queueLength());
        }
    }

    // ── Storage ─────────────────────────────────────────────────────

    @Test
    void keepsWorkingWhenStorageFails() throws Exception {
        RecordingMetricsExporter metrics = new RecordingMetricsExporter();
        DurableStore failing = new DurableStore(new FailingKeyValueStore(), JsonCodec.getDefault(), metrics);
        try (SyncQueue queue = SyncQueue.builder().store(failing).metrics(metrics).build()) {
            queue.start();
            SyncTicket ticket = queue.addToSyncQueue("a", 1, item -> CompletableFuture.completedFuture("ok"));

            queue.syncNow().get(5, TimeUnit.SECONDS);

            assertEquals("ok", ticket.result().get(5, TimeUnit.SECONDS));
            assertTrue(metrics.storeFailure.get() > 0);
        }
    }

    @Test
    void usesConfiguredQueueKey() {
        try (SyncQueue queue = newQueue().queueKey("tenant_42_queue").build()) {
            queue.addToSyncQueue("a", 1, SyncQueueTest::succeed);

            assertTrue(kv.get("tenant_42_queue").isPresent());
            assertTrue(kv.get("background_sync_queue").isEmpty());
        }
    }

    // ── Helpers ─────────────────────────────────────────────────────

    private SyncQueue.Builder newQueue() {
        return SyncQueue.builder()
                .store(store)
                .retryPolicy(attempts -> 20L)
                .onlineIntervalMs(60_000)
                .offlineIntervalMs(60_000);
    }

    public record Profile(String displayName) {
    }

    // Counts connectivity checks, one per attempted pass
    private static final class SwitchableMonitor implements ConnectivityMonitor {
        final AtomicInteger checks = new AtomicInteger();
        private final List<ConnectivityListener> listeners = new CopyOnWriteArrayList<>();
        private volatile boolean online;

        @Override
        public boolean isOnline() {
            checks.incrementAndGet();
            return online;
        }

        @Override
        public Subscription subscribe(ConnectivityListener listener) {
            listeners.add(listener);
            return () -> listeners.remove(listener);
        }

        void switchTo(boolean value) {
            online = value;
            for (ConnectivityListener listener : listeners) {
                if (value) {
                    listener.onOnline();
                } else {
                    listener.onOffline();
                }
            }
        }
    }

    private static CompletableFuture<Object> succeed(SyncQueueItem item) {
        return CompletableFuture.completedFuture(null);
    }

    private static SyncOperation recordingOp(List<String> order, String name) {
        return item -> {
            order.add(name);
            return CompletableFuture.completedFuture(name);
        };
    }

    static void awaitStatus(SyncQueue queue, String id, SyncStatus expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (System.currentTimeMillis() < deadline) {
            if (queue.item(id).map(SyncQueueItem::status).orElse(null) == expected) {
                return;
            }
            Thread.sleep(5);
        }
        throw new AssertionError("Item " + id + " never reached " + expected);
    }
}
