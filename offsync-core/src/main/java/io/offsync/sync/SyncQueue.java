package io.offsync.sync;

import com.github.f4b6a3.ulid.UlidCreator;
import io.offsync.connectivity.DefaultConnectivityMonitor;
import io.offsync.spi.ConnectivityListener;
import io.offsync.spi.ConnectivityMonitor;
import io.offsync.spi.MetricsExporter;
import io.offsync.store.DurableStore;
import io.offsync.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable queue of writes that are replayed against a remote backend until they succeed.
 *
 * <p>Items are added with {@link #addToSyncQueue} and executed by sync passes. A pass takes up
 * to {@code batchSize} eligible items (PENDING, or RETRYING whose retry time has come), highest
 * priority first and otherwise in enqueue order, and runs their operations concurrently. A
 * failed execution is retried with exponential backoff until {@code maxRetries} retries have
 * been used, after which the item is parked as FAILED. Passes only run while the
 * {@link ConnectivityMonitor} reports online; at most one pass runs at a time.
 *
 * <p>Passes are triggered by {@link #syncNow()}, by a periodic tick (every
 * {@code onlineIntervalMs} while online, {@code offlineIntervalMs} while offline), by
 * per-item retry timers and by every offline-to-online transition.
 *
 * <p>Every state change is written through to the {@link DurableStore} under
 * {@code queueKey}. On construction the snapshot is restored: items interrupted mid-execution
 * go back to PENDING, items older than {@code maxItemAge} are dropped, and operations are
 * re-resolved through the {@link SyncHandlerRegistry}. Nothing is executed before
 * {@link #start()}, so handlers can be registered after the queue is built.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe and implements
 * {@link AutoCloseable}.
 *
 * @see SyncQueue.Builder
 * @see SyncTicket
 */
public final class SyncQueue implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(SyncQueue.class.getName());

  private static final Comparator<Entry> BY_PRIORITY = Comparator.comparing(e -> e.item.priority());

  private final DurableStore store;
  private final ConnectivityMonitor connectivity;
  private final SyncHandlerRegistry handlers;
  private final RetryPolicy retryPolicy;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final String queueKey;
  private final int batchSize;
  private final int maxRetries;
  private final long onlineIntervalMs;
  private final long offlineIntervalMs;
  private final Duration maxItemAge;
  private final boolean enabled;

  private final Object lock = new Object();
  // Guarded by lock; iteration order is enqueue order
  private final Map<String, Entry> entries = new LinkedHashMap<>();

  private final AtomicReference<CompletableFuture<Void>> activePass = new AtomicReference<>();
  private final AtomicBoolean rerunRequested = new AtomicBoolean();
  private volatile Instant lastSyncTime;

  private final ExecutorService workers;
  private final ScheduledExecutorService scheduler;
  private final ConnectivityListener connectivityListener = new TransitionListener();
  private ScheduledFuture<?> tickTask;
  private ConnectivityMonitor.Subscription subscription;
  private volatile boolean started;
  private volatile boolean closed;

  private SyncQueue(Builder builder) {
    this.store = Objects.requireNonNull(builder.store, "store");
    this.connectivity = builder.connectivity != null
        ? builder.connectivity : new DefaultConnectivityMonitor();
    this.handlers = builder.handlers != null ? builder.handlers : new DefaultSyncHandlerRegistry();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.queueKey = Objects.requireNonNull(builder.queueKey, "queueKey");
    this.maxItemAge = Objects.requireNonNull(builder.maxItemAge, "maxItemAge");
    this.enabled = builder.enabled;

    if (builder.batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be >= 1");
    }
    if (builder.maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0");
    }
    if (builder.onlineIntervalMs <= 0L || builder.offlineIntervalMs <= 0L) {
      throw new IllegalArgumentException("Sync intervals must be > 0");
    }
    if (maxItemAge.isNegative() || maxItemAge.isZero()) {
      throw new IllegalArgumentException("maxItemAge must be > 0");
    }
    this.batchSize = builder.batchSize;
    this.maxRetries = builder.maxRetries;
    this.onlineIntervalMs = builder.onlineIntervalMs;
    this.offlineIntervalMs = builder.offlineIntervalMs;
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy
        : new ExponentialBackoffRetryPolicy(builder.retryDelayMs, builder.maxRetryDelayMs, builder.jitter);

    this.workers = Executors.newFixedThreadPool(batchSize, new DaemonThreadFactory("offsync-sync-"));
    this.scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("offsync-sync-timer-"));
    restore();
  }

  public static Builder builder() {
    return new Builder();
  }

  // ── Enqueue ──────────────────────────────────────────────────────

  /**
   * Adds an item whose operation is resolved from the {@link SyncHandlerRegistry}.
   *
   * @throws UnhandledOperationException if no handler is registered for {@code operationType}
   */
  public SyncTicket addToSyncQueue(String operationType, Object payload) {
    if (handlers.handlerFor(operationType) == null) {
      throw new UnhandledOperationException("No sync handler registered for operationType=" + operationType);
    }
    return addToSyncQueue(operationType, payload, null, SyncCallback.NOOP, SyncPriority.NORMAL);
  }

  public SyncTicket addToSyncQueue(String operationType, Object payload, SyncOperation operation) {
    return addToSyncQueue(operationType, payload, operation, SyncCallback.NOOP, SyncPriority.NORMAL);
  }

  public SyncTicket addToSyncQueue(String operationType, Object payload, SyncOperation operation,
      SyncCallback callback) {
    return addToSyncQueue(operationType, payload, operation, callback, SyncPriority.NORMAL);
  }

  /**
   * Adds an item to the queue and persists the queue. The operation is not executed here;
   * it runs on the next sync pass.
   *
   * @param operationType label of the write, used for handler lookup after a restart
   * @param payload value captured as JSON now; later changes to the object are not seen
   * @param operation the remote call, or {@code null} to resolve it from the registry
   * @param callback outcome notification, or {@code null}
   * @param priority processing priority, or {@code null} for {@link SyncPriority#NORMAL}
   * @return a ticket carrying the item id and its eventual outcome
   * @throws IllegalArgumentException if the payload cannot be encoded as JSON
   * @throws IllegalStateException if the queue has been closed
   */
  public SyncTicket addToSyncQueue(String operationType, Object payload, SyncOperation operation,
      SyncCallback callback, SyncPriority priority) {
    Objects.requireNonNull(operationType, "operationType");
    if (closed) {
      throw new IllegalStateException("SyncQueue has been closed");
    }
    String payloadJson = store.codec().toJson(payload);
    String id = UlidCreator.getMonotonicUlid().toString();
    SyncQueueItem item = SyncQueueItem.pending(id, operationType, payloadJson, priority, clock.instant());
    Entry entry = new Entry(item, operation, callback != null ? callback : SyncCallback.NOOP);
    synchronized (lock) {
      entries.put(id, entry);
      persist();
      recordDepths();
    }
    metrics.incrementSyncEnqueued();
    logger.fine(() -> "Queued " + operationType + " as " + id);
    return entry.ticket;
  }

  /**
   * Removes an item in any status. A running execution is not interrupted, but its outcome
   * is discarded. The item's ticket is cancelled.
   *
   * @return {@code true} if the item was present
   */
  public boolean removeFromSyncQueue(String id) {
    Entry removed;
    synchronized (lock) {
      removed = entries.remove(id);
      if (removed == null) {
        return false;
      }
      removed.cancelRetryTimer();
      persist();
      recordDepths();
    }
    removed.ticket.result().cancel(false);
    return true;
  }

  /**
   * Removes every item and cancels all pending retry timers and tickets.
   */
  public void clearSyncQueue() {
    List<Entry> cleared;
    synchronized (lock) {
      entries.values().forEach(Entry::cancelRetryTimer);
      cleared = new ArrayList<>(entries.values());
      entries.clear();
      persist();
      recordDepths();
    }
    cleared.forEach(e -> e.ticket.result().cancel(false));
    if (!cleared.isEmpty()) {
      logger.info("Cleared " + cleared.size() + " items from the sync queue");
    }
  }

  // ── Processing ───────────────────────────────────────────────────

  /**
   * Starts a sync pass unless one is already running, the queue is disabled, not yet started
   * or the monitor reports offline.
   *
   * <p>If a pass is running, another pass is requested to follow it and the running pass's
   * future is returned. The returned future completes once every item picked by the pass has
   * reached its next state; it never completes exceptionally.
   *
   * @return a future for the pass
   */
  public CompletableFuture<Void> processSyncQueue() {
    if (closed || !enabled || !started) {
      return CompletableFuture.completedFuture(null);
    }
    if (!connectivity.isOnline()) {
      logger.fine("Offline; skipping sync pass");
      return CompletableFuture.completedFuture(null);
    }
    CompletableFuture<Void> pass = new CompletableFuture<>();
    CompletableFuture<Void> running;
    while ((running = activePass.compareAndExchange(null, pass)) != null) {
      rerunRequested.set(true);
      if (activePass.get() == running || !rerunRequested.compareAndSet(true, false)) {
        // The running pass, or whoever cleared it, picks the request up
        return running;
      }
    }
    try {
      runPass(pass);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Sync pass failed to start", e);
      finishPass(pass);
    }
    return pass;
  }

  /**
   * Triggers a sync pass immediately.
   *
   * @return a future for the pass
   * @see #processSyncQueue()
   */
  public CompletableFuture<Void> syncNow() {
    return processSyncQueue();
  }

  private void runPass(CompletableFuture<Void> pass) {
    List<Entry> batch = new ArrayList<>();
    List<Runnable> notifications = new ArrayList<>();
    synchronized (lock) {
      selectBatch(clock.instant(), batch, notifications);
      if (!batch.isEmpty() || !notifications.isEmpty()) {
        persist();
        recordDepths();
      }
    }
    notifications.forEach(SyncQueue::notifySafely);
    if (batch.isEmpty()) {
      finishPass(pass);
      return;
    }
    logger.fine(() -> "Sync pass started with " + batch.size() + " items");
    CompletableFuture<?>[] executions = new CompletableFuture<?>[batch.size()];
    for (int i = 0; i < batch.size(); i++) {
      executions[i] = execute(batch.get(i));
    }
    CompletableFuture.allOf(executions).whenComplete((ignored, error) -> finishPass(pass));
  }

  private void selectBatch(Instant now, List<Entry> batch, List<Runnable> notifications) {
    List<Entry> candidates = new ArrayList<>();
    for (Entry entry : entries.values()) {
      if (isEligible(entry, now)) {
        candidates.add(entry);
      }
    }
    candidates.sort(BY_PRIORITY);
    for (Entry entry : candidates) {
      if (batch.size() >= batchSize) {
        break;
      }
      if (entry.operation == null) {
        entry.operation = handlers.handlerFor(entry.item.operationType());
      }
      entry.cancelRetryTimer();
      if (entry.operation == null) {
        UnhandledOperationException error = new UnhandledOperationException(
            "No sync handler registered for operationType=" + entry.item.operationType());
        notifications.add(markFailed(entry, error));
        continue;
      }
      entry.item = entry.item.syncing(now);
      batch.add(entry);
    }
  }

  private static boolean isEligible(Entry entry, Instant now) {
    SyncQueueItem item = entry.item;
    if (item.status() == SyncStatus.PENDING) {
      return true;
    }
    return item.status() == SyncStatus.RETRYING
        && (entry.retryDue || item.nextAttemptAt() == null || !item.nextAttemptAt().isAfter(now));
  }

  private CompletableFuture<Void> execute(Entry entry) {
    SyncQueueItem snapshot = entry.item;
    SyncOperation operation = entry.operation;
    CompletableFuture<CompletionStage<Object>> started;
    try {
      started = CompletableFuture.supplyAsync(() -> invoke(operation, snapshot), workers);
    } catch (RejectedExecutionException e) {
      started = CompletableFuture.<CompletionStage<Object>>completedFuture(CompletableFuture.failedFuture(e));
    }
    return started
        .thenCompose(stage -> stage)
        .handle((result, error) -> {
          try {
            onSettled(entry, snapshot, result, unwrap(error));
          } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to record outcome of item " + snapshot.id(), e);
          }
          return null;
        });
  }

  private static CompletionStage<Object> invoke(SyncOperation operation, SyncQueueItem item) {
    try {
      CompletionStage<?> stage = operation.execute(item);
      if (stage == null) {
        return CompletableFuture.failedFuture(
            new IllegalStateException("SyncOperation returned null for item " + item.id()));
      }
      return stage.thenApply(value -> (Object) value);
    } catch (Exception e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  private void onSettled(Entry entry, SyncQueueItem snapshot, Object result, Throwable error) {
    Runnable notification;
    synchronized (lock) {
      if (entries.get(snapshot.id()) != entry || entry.item.status() != SyncStatus.SYNCING) {
        logger.fine(() -> "Discarding outcome of removed item " + snapshot.id());
        return;
      }
      if (error == null) {
        entries.remove(snapshot.id());
        SyncQueueItem done = entry.item.completed();
        entry.item = done;
        persist();
        recordDepths();
        metrics.incrementSyncSuccess();
        logger.fine(() -> "Synced " + done.operationType() + " " + done.id()
            + " after " + done.attempts() + " attempts");
        notification = () -> {
          entry.callback.onSuccess(done, result);
          entry.ticket.result().complete(result);
        };
      } else if (entry.item.attempts() <= maxRetries) {
        scheduleRetry(entry, error);
        notification = null;
      } else {
        notification = markFailed(entry, error);
      }
    }
    if (notification != null) {
      notifySafely(notification);
    }
  }

  // Caller holds lock
  private void scheduleRetry(Entry entry, Throwable error) {
    int attempts = entry.item.attempts();
    long delayMs = retryPolicy.computeDelayMs(attempts);
    entry.item = entry.item.retrying(clock.instant().plusMillis(delayMs), describe(error));
    entry.retryDue = false;
    entry.retryTimer = scheduleTimer(entry, delayMs);
    persist();
    recordDepths();
    metrics.incrementSyncRetry();
    logger.log(Level.WARNING, "Sync of item " + entry.item.id() + " (" + entry.item.operationType()
        + ") failed on attempt " + attempts + "/" + (maxRetries + 1) + "; retrying in " + delayMs + " ms", error);
  }

  // Caller holds lock
  private Runnable markFailed(Entry entry, Throwable error) {
    SyncQueueItem failed = entry.item.failed(describe(error));
    entry.item = failed;
    persist();
    recordDepths();
    metrics.incrementSyncFailed();
    logger.log(Level.SEVERE, "Item " + failed.id() + " (" + failed.operationType()
        + ") moved to FAILED after " + failed.attempts() + " attempts", error);
    SyncTicket ticket = entry.ticket;
    SyncCallback callback = entry.callback;
    return () -> {
      callback.onFailure(failed, error);
      ticket.result().completeExceptionally(new SyncFailedException(failed, error));
    };
  }

  // Caller holds lock
  private ScheduledFuture<?> scheduleTimer(Entry entry, long delayMs) {
    if (closed) {
      return null;
    }
    try {
      return scheduler.schedule(() -> onRetryDue(entry), Math.max(0L, delayMs), TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      logger.log(Level.FINE, "Retry timer rejected for item " + entry.item.id(), e);
      return null;
    }
  }

  private void onRetryDue(Entry entry) {
    try {
      synchronized (lock) {
        if (entries.get(entry.item.id()) != entry || entry.item.status() != SyncStatus.RETRYING) {
          return;
        }
        entry.retryDue = true;
        entry.retryTimer = null;
      }
      processSyncQueue();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Retry timer failed", t);
    }
  }

  private void finishPass(CompletableFuture<Void> pass) {
    lastSyncTime = clock.instant();
    activePass.compareAndSet(pass, null);
    pass.complete(null);
    if (rerunRequested.getAndSet(false)) {
      processSyncQueue();
    }
  }

  private void tick() {
    try {
      processSyncQueue();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Periodic sync failed", t);
    }
  }

  // ── Inspection and manual recovery ───────────────────────────────

  /**
   * Decodes an item's payload with the codec the queue encoded it with.
   *
   * @param item an item of this queue, typically the one passed to a {@link SyncOperation}
   * @param type payload type
   * @param <T> payload type
   * @return the decoded payload
   * @throws IllegalArgumentException if the payload cannot be decoded as {@code type}
   */
  public <T> T payload(SyncQueueItem item, Class<T> type) {
    return item.payload(type, store.codec());
  }

  /**
   * @return snapshots of all items in enqueue order
   */
  public List<SyncQueueItem> items() {
    synchronized (lock) {
      List<SyncQueueItem> result = new ArrayList<>(entries.size());
      entries.values().forEach(e -> result.add(e.item));
      return List.copyOf(result);
    }
  }

  public Optional<SyncQueueItem> item(String id) {
    synchronized (lock) {
      Entry entry = entries.get(id);
      return entry == null ? Optional.empty() : Optional.of(entry.item);
    }
  }

  /**
   * Returns the current ticket for an item. After {@link #retry(String)} this is the new
   * ticket, not the one returned at enqueue time.
   */
  public Optional<SyncTicket> ticket(String id) {
    synchronized (lock) {
      Entry entry = entries.get(id);
      return entry == null ? Optional.empty() : Optional.of(entry.ticket);
    }
  }

  /**
   * Moves a FAILED item back to PENDING with a fresh retry budget. The original ticket has
   * already completed exceptionally, so a new ticket is issued for the retried execution.
   *
   * @return the new ticket, or empty if the item is absent or not FAILED
   */
  public Optional<SyncTicket> retry(String id) {
    synchronized (lock) {
      Entry entry = entries.get(id);
      if (entry == null || entry.item.status() != SyncStatus.FAILED) {
        return Optional.empty();
      }
      entry.revive();
      persist();
      recordDepths();
      logger.info("Item " + id + " moved back to PENDING for retry");
      return Optional.of(entry.ticket);
    }
  }

  /**
   * Moves every FAILED item back to PENDING.
   *
   * @return the number of items revived
   */
  public int retryAllFailed() {
    int count = 0;
    synchronized (lock) {
      for (Entry entry : entries.values()) {
        if (entry.item.status() == SyncStatus.FAILED) {
          entry.revive();
          count++;
        }
      }
      if (count > 0) {
        persist();
        recordDepths();
      }
    }
    if (count > 0) {
      logger.info("Moved " + count + " failed items back to PENDING");
    }
    return count;
  }

  /**
   * Removes every FAILED item.
   *
   * @return the number of items removed
   */
  public int clearFailed() {
    int count = 0;
    synchronized (lock) {
      Iterator<Entry> it = entries.values().iterator();
      while (it.hasNext()) {
        if (it.next().item.status() == SyncStatus.FAILED) {
          it.remove();
          count++;
        }
      }
      if (count > 0) {
        persist();
        recordDepths();
      }
    }
    return count;
  }

  public SyncQueueStatus status() {
    synchronized (lock) {
      int pending = 0;
      int failed = 0;
      for (Entry entry : entries.values()) {
        SyncStatus status = entry.item.status();
        if (status.isAwaitingSync()) {
          pending++;
        } else if (status == SyncStatus.FAILED) {
          failed++;
        }
      }
      return new SyncQueueStatus(entries.size(), pending, failed, activePass.get() != null, lastSyncTime);
    }
  }

  // ── Lifecycle ────────────────────────────────────────────────────

  /**
   * Subscribes to connectivity transitions, starts the periodic tick and arms the retry
   * timers of restored items. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("SyncQueue has been closed");
    }
    if (started) {
      return;
    }
    started = true;
    synchronized (lock) {
      Instant now = clock.instant();
      for (Entry entry : entries.values()) {
        SyncQueueItem item = entry.item;
        if (item.status() == SyncStatus.RETRYING && entry.retryTimer == null && item.nextAttemptAt() != null) {
          entry.retryTimer = scheduleTimer(entry, Duration.between(now, item.nextAttemptAt()).toMillis());
        }
      }
    }
    subscription = connectivity.subscribe(connectivityListener);
    reschedule(connectivity.isOnline());
  }

  // Swaps the periodic tick to the interval matching the connectivity state
  private synchronized void reschedule(boolean online) {
    if (!started || closed) {
      return;
    }
    if (tickTask != null) {
      tickTask.cancel(false);
    }
    long intervalMs = online ? onlineIntervalMs : offlineIntervalMs;
    tickTask = scheduler.scheduleWithFixedDelay(this::tick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Stops the tick and retry timers and unsubscribes from connectivity. Executions already
   * running are allowed to finish and their outcomes are still recorded.
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (subscription != null) {
      subscription.close();
    }
    if (tickTask != null) {
      tickTask.cancel(false);
    }
    synchronized (lock) {
      entries.values().forEach(Entry::cancelRetryTimer);
    }
    scheduler.shutdownNow();
    workers.shutdown();
    try {
      if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
        logger.warning("Sync workers did not finish within 5 s of close");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  // ── Persistence ──────────────────────────────────────────────────

  // Caller holds lock
  private void persist() {
    SyncQueueItem[] snapshot = new SyncQueueItem[entries.size()];
    int i = 0;
    for (Entry entry : entries.values()) {
      snapshot[i++] = entry.item;
    }
    store.writeSnapshot(queueKey, snapshot);
  }

  // Caller holds lock
  private void recordDepths() {
    int pending = 0;
    int failed = 0;
    for (Entry entry : entries.values()) {
      if (entry.item.status().isAwaitingSync()) {
        pending++;
      } else if (entry.item.status() == SyncStatus.FAILED) {
        failed++;
      }
    }
    metrics.recordQueueDepths(pending, failed);
  }

  private void restore() {
    Optional<SyncQueueItem[]> snapshot = store.readSnapshot(queueKey, SyncQueueItem[].class);
    if (snapshot.isEmpty()) {
      return;
    }
    Instant now = clock.instant();
    Instant cutoff = now.minus(maxItemAge);
    int dropped = 0;
    synchronized (lock) {
      for (SyncQueueItem item : snapshot.get()) {
        if (item == null || item.status() == SyncStatus.COMPLETED) {
          continue;
        }
        if (item.enqueuedAt().isBefore(cutoff)) {
          dropped++;
          continue;
        }
        SyncQueueItem restored = item.status() == SyncStatus.SYNCING ? item.interrupted() : item;
        entries.put(restored.id(), new Entry(restored, null, SyncCallback.NOOP));
      }
      if (dropped > 0) {
        persist();
      }
      recordDepths();
    }
    if (!entries.isEmpty() || dropped > 0) {
      logger.info("Restored " + entries.size() + " queued items from '" + queueKey + "'"
          + (dropped > 0 ? ", dropped " + dropped + " older than " + maxItemAge : ""));
    }
  }

  // ── Helpers ──────────────────────────────────────────────────────

  private static void notifySafely(Runnable notification) {
    try {
      notification.run();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Sync callback failed", e);
    }
  }

  private static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  private static String describe(Throwable error) {
    if (error instanceof CancellationException) {
      return "cancelled";
    }
    String message = error.getMessage();
    return message == null ? error.getClass().getName() : error.getClass().getSimpleName() + ": " + message;
  }

  private static final class Entry {
    volatile SyncQueueItem item;
    SyncOperation operation;
    final SyncCallback callback;
    SyncTicket ticket;
    ScheduledFuture<?> retryTimer;
    boolean retryDue;

    Entry(SyncQueueItem item, SyncOperation operation, SyncCallback callback) {
      this.item = item;
      this.operation = operation;
      this.callback = callback;
      this.ticket = new SyncTicket(item.id());
    }

    void cancelRetryTimer() {
      if (retryTimer != null) {
        retryTimer.cancel(false);
        retryTimer = null;
      }
      retryDue = false;
    }

    void revive() {
      cancelRetryTimer();
      item = item.reset();
      if (ticket.result().isDone()) {
        ticket = new SyncTicket(item.id());
      }
    }
  }

  private final class TransitionListener implements ConnectivityListener {
    @Override
    public void onOnline() {
      reschedule(true);
      int pending = status().pendingCount();
      if (pending > 0) {
        logger.info("Back online; syncing " + pending + " queued items");
      }
      syncNow();
    }

    @Override
    public void onOffline() {
      reschedule(false);
      logger.info("Offline; sync passes paused");
    }
  }

  /**
   * Builder for {@link SyncQueue}.
   */
  public static final class Builder {
    private DurableStore store;
    private ConnectivityMonitor connectivity;
    private SyncHandlerRegistry handlers;
    private RetryPolicy retryPolicy;
    private MetricsExporter metrics;
    private Clock clock;
    private String queueKey = "background_sync_queue";
    private int batchSize = 3;
    private int maxRetries = 3;
    private long retryDelayMs = 5000L;
    private long maxRetryDelayMs = Duration.ofMinutes(10).toMillis();
    private double jitter = 0.2d;
    private long onlineIntervalMs = 30_000L;
    private long offlineIntervalMs = 60_000L;
    private Duration maxItemAge = Duration.ofHours(24);
    private boolean enabled = true;

    private Builder() {
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder store(DurableStore store) {
      this.store = store;
      return this;
    }

    /**
     * <p>Optional. Defaults to an always-online {@link DefaultConnectivityMonitor}.
     */
    public Builder connectivity(ConnectivityMonitor connectivity) {
      this.connectivity = connectivity;
      return this;
    }

    /**
     * Registry for items enqueued without an operation and for restored items.
     *
     * <p>Optional. Defaults to an empty {@link DefaultSyncHandlerRegistry}.
     */
    public Builder handlers(SyncHandlerRegistry handlers) {
      this.handlers = handlers;
      return this;
    }

    /**
     * Overrides the backoff computed from {@link #retryDelayMs}, {@link #maxRetryDelayMs}
     * and {@link #jitter}.
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Storage key of the queue snapshot.
     *
     * <p>Optional. Defaults to {@code background_sync_queue}.
     */
    public Builder queueKey(String queueKey) {
      this.queueKey = queueKey;
      return this;
    }

    /**
     * Maximum items executed concurrently per pass; also the worker pool size.
     *
     * <p>Optional. Defaults to {@code 3}.
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Retries allowed after the first failed execution.
     *
     * <p>Optional. Defaults to {@code 3}.
     */
    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 5000} ms.
     */
    public Builder retryDelayMs(long retryDelayMs) {
      this.retryDelayMs = retryDelayMs;
      return this;
    }

    /**
     * <p>Optional. Defaults to 10 minutes.
     */
    public Builder maxRetryDelayMs(long maxRetryDelayMs) {
      this.maxRetryDelayMs = maxRetryDelayMs;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 0.2}.
     */
    public Builder jitter(double jitter) {
      this.jitter = jitter;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 30000} ms.
     */
    public Builder onlineIntervalMs(long onlineIntervalMs) {
      this.onlineIntervalMs = onlineIntervalMs;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 60000} ms.
     */
    public Builder offlineIntervalMs(long offlineIntervalMs) {
      this.offlineIntervalMs = offlineIntervalMs;
      return this;
    }

    /**
     * Restored items enqueued longer ago than this are dropped.
     *
     * <p>Optional. Defaults to 24 hours.
     */
    public Builder maxItemAge(Duration maxItemAge) {
      this.maxItemAge = maxItemAge;
      return this;
    }

    /**
     * When {@code false}, items are still queued and persisted but never executed.
     *
     * <p>Optional. Defaults to {@code true}.
     */
    public Builder enabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    public SyncQueue build() {
      return new SyncQueue(this);
    }
  }
}
