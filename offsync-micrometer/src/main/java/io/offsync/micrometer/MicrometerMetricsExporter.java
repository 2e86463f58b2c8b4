package io.offsync.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.offsync.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code offsync.sync.enqueued} - items added to the sync queue</li>
 *   <li>{@code offsync.sync.success} - operations that completed</li>
 *   <li>{@code offsync.sync.retry} - failed executions scheduled for another attempt</li>
 *   <li>{@code offsync.sync.failed} - items that exhausted their retries</li>
 *   <li>{@code offsync.cache.hit} / {@code offsync.cache.miss} - cache reads</li>
 *   <li>{@code offsync.cache.evicted} - entries dropped by capacity or expiry</li>
 *   <li>{@code offsync.prefetch.deduplicated} - prefetches that joined an in-flight fetch</li>
 *   <li>{@code offsync.prefetch.failure} - fetchers that failed</li>
 *   <li>{@code offsync.store.failure} - degraded durable storage operations</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code offsync.queue.pending} - items pending or retrying</li>
 *   <li>{@code offsync.queue.failed} - items parked in FAILED</li>
 *   <li>{@code offsync.cache.size} - entries held by the prefetch cache</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  public static final String DEFAULT_PREFIX = "offsync";

  private final MeterRegistry registry;
  private final Counter syncEnqueued;
  private final Counter syncSuccess;
  private final Counter syncRetry;
  private final Counter syncFailed;
  private final Counter cacheHit;
  private final Counter cacheMiss;
  private final Counter cacheEvicted;
  private final Counter prefetchDeduplicated;
  private final Counter prefetchFailure;
  private final Counter storeFailure;
  private final Gauge pendingGauge;
  private final Gauge failedGauge;
  private final Gauge cacheSizeGauge;

  private final AtomicInteger pending = new AtomicInteger();
  private final AtomicInteger failed = new AtomicInteger();
  private final AtomicInteger cacheSize = new AtomicInteger();
  private volatile boolean closed;

  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, DEFAULT_PREFIX);
  }

  /**
   * Creates an exporter with a custom metric name prefix, for running several queues in one
   * registry.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "mobile.offsync"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.syncEnqueued = counter(namePrefix + ".sync.enqueued", "Items added to the sync queue");
    this.syncSuccess = counter(namePrefix + ".sync.success", "Sync operations that completed");
    this.syncRetry = counter(namePrefix + ".sync.retry", "Failed executions scheduled for retry");
    this.syncFailed = counter(namePrefix + ".sync.failed", "Items that exhausted their retries");
    this.cacheHit = counter(namePrefix + ".cache.hit", "Fresh cache reads");
    this.cacheMiss = counter(namePrefix + ".cache.miss", "Cache reads without a fresh entry");
    this.cacheEvicted = counter(namePrefix + ".cache.evicted", "Cache entries evicted");
    this.prefetchDeduplicated = counter(namePrefix + ".prefetch.deduplicated",
        "Prefetches joined to an in-flight fetch");
    this.prefetchFailure = counter(namePrefix + ".prefetch.failure", "Failed fetchers");
    this.storeFailure = counter(namePrefix + ".store.failure", "Degraded durable storage operations");

    this.pendingGauge = Gauge.builder(namePrefix + ".queue.pending", pending, AtomicInteger::get)
        .register(registry);
    this.failedGauge = Gauge.builder(namePrefix + ".queue.failed", failed, AtomicInteger::get)
        .register(registry);
    this.cacheSizeGauge = Gauge.builder(namePrefix + ".cache.size", cacheSize, AtomicInteger::get)
        .register(registry);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(name).description(description).register(registry);
  }

  @Override
  public void incrementSyncEnqueued() {
    if (closed) return;
    syncEnqueued.increment();
  }

  @Override
  public void incrementSyncSuccess() {
    if (closed) return;
    syncSuccess.increment();
  }

  @Override
  public void incrementSyncRetry() {
    if (closed) return;
    syncRetry.increment();
  }

  @Override
  public void incrementSyncFailed() {
    if (closed) return;
    syncFailed.increment();
  }

  @Override
  public void recordQueueDepths(int pendingCount, int failedCount) {
    if (closed) return;
    pending.set(pendingCount);
    failed.set(failedCount);
  }

  @Override
  public void incrementCacheHit() {
    if (closed) return;
    cacheHit.increment();
  }

  @Override
  public void incrementCacheMiss() {
    if (closed) return;
    cacheMiss.increment();
  }

  @Override
  public void incrementPrefetchDeduplicated() {
    if (closed) return;
    prefetchDeduplicated.increment();
  }

  @Override
  public void incrementPrefetchFailure() {
    if (closed) return;
    prefetchFailure.increment();
  }

  @Override
  public void incrementCacheEvicted(int count) {
    if (closed || count <= 0) return;
    cacheEvicted.increment(count);
  }

  @Override
  public void recordCacheSize(int size) {
    if (closed) return;
    cacheSize.set(size);
  }

  @Override
  public void incrementStoreFailure() {
    if (closed) return;
    storeFailure.increment();
  }

  /**
   * Removes all meters registered by this exporter from the registry. Called by
   * {@link io.offsync.Offsync#close()}.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(syncEnqueued, syncSuccess, syncRetry, syncFailed,
        cacheHit, cacheMiss, cacheEvicted, prefetchDeduplicated, prefetchFailure, storeFailure,
        pendingGauge, failedGauge, cacheSizeGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
