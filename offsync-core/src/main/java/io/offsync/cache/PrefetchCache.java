package io.offsync.cache;

import io.offsync.spi.MetricsExporter;
import io.offsync.store.DurableStore;
import io.offsync.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded, time-limited cache filled ahead of need by {@link #prefetch}.
 *
 * <p>An entry is served while its age is below {@code maxAge}; older entries count as
 * misses and are removed by the periodic sweep. When a write pushes the cache above
 * {@code maxEntries}, the entries stored longest ago are evicted. Concurrent prefetches of
 * the same key share one fetch. A failing fetch is logged and resolves to empty; it never
 * fails the caller.
 *
 * <p>The cache contents are written through to the {@link DurableStore} under
 * {@code cacheKey} and restored on construction.
 *
 * <p>Create instances via {@link #builder(Class)}. This class is thread-safe and implements
 * {@link AutoCloseable}.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * PrefetchCache<Profile> profiles = PrefetchCache.builder(Profile.class)
 *     .store(durableStore)
 *     .build();
 * profiles.prefetch("profile:42", () -> api.fetchProfile(42));
 * // later
 * Optional<Profile> cached = profiles.getCachedData("profile:42");
 * }</pre>
 *
 * @param <V> value type
 */
public final class PrefetchCache<V> implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(PrefetchCache.class.getName());

  private final Class<V> valueType;
  private final DurableStore store;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final String cacheKey;
  private final Duration maxAge;
  private final int maxEntries;
  private final long sweepIntervalMs;
  private final boolean enabled;

  private final Object lock = new Object();
  // Guarded by lock; iteration order is storage order, oldest first
  private final LinkedHashMap<String, CacheEntry<V>> entries = new LinkedHashMap<>();
  private final ConcurrentHashMap<String, CompletableFuture<Optional<V>>> inFlight = new ConcurrentHashMap<>();

  private final ScheduledExecutorService scheduler;
  private ScheduledFuture<?> sweepTask;
  private volatile boolean closed;

  private PrefetchCache(Builder<V> builder) {
    this.valueType = Objects.requireNonNull(builder.valueType, "valueType");
    this.store = Objects.requireNonNull(builder.store, "store");
    this.cacheKey = Objects.requireNonNull(builder.cacheKey, "cacheKey");
    this.maxAge = Objects.requireNonNull(builder.maxAge, "maxAge");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.enabled = builder.enabled;

    if (maxAge.isNegative() || maxAge.isZero()) {
      throw new IllegalArgumentException("maxAge must be > 0");
    }
    if (builder.maxEntries < 1) {
      throw new IllegalArgumentException("maxEntries must be >= 1");
    }
    if (builder.sweepIntervalMs <= 0L) {
      throw new IllegalArgumentException("sweepIntervalMs must be > 0");
    }
    this.maxEntries = builder.maxEntries;
    this.sweepIntervalMs = builder.sweepIntervalMs;
    this.scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("offsync-cache-"));
    restore();
  }

  public static <V> Builder<V> builder(Class<V> valueType) {
    return new Builder<>(valueType);
  }

  // ── Reads and writes ─────────────────────────────────────────────

  /**
   * Returns the cached value if it is still fresh. Stale entries are reported as a miss
   * but left in place for the sweep.
   */
  public Optional<V> getCachedData(String key) {
    Objects.requireNonNull(key, "key");
    CacheEntry<V> entry;
    synchronized (lock) {
      entry = entries.get(key);
    }
    if (entry == null || !entry.isFresh(clock.instant(), maxAge)) {
      metrics.incrementCacheMiss();
      return Optional.empty();
    }
    metrics.incrementCacheHit();
    return Optional.of(entry.value());
  }

  /**
   * Stores a value with the current time, evicting the oldest entries while the cache holds
   * more than {@code maxEntries}.
   */
  public void setCachedData(String key, V value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    int evicted;
    int size;
    synchronized (lock) {
      entries.remove(key);
      entries.put(key, new CacheEntry<>(key, value, clock.instant()));
      evicted = evictOverflow();
      persist();
      size = entries.size();
    }
    if (evicted > 0) {
      metrics.incrementCacheEvicted(evicted);
      logger.fine(() -> "Evicted " + evicted + " cache entries over capacity " + maxEntries);
    }
    metrics.recordCacheSize(size);
  }

  /**
   * Removes one entry.
   *
   * @return {@code true} if the key was present
   */
  public boolean invalidateCache(String key) {
    Objects.requireNonNull(key, "key");
    int size;
    synchronized (lock) {
      if (entries.remove(key) == null) {
        return false;
      }
      persist();
      size = entries.size();
    }
    metrics.recordCacheSize(size);
    return true;
  }

  /**
   * Removes every entry. Fetches in flight still complete and populate the cache.
   */
  public void clearCache() {
    synchronized (lock) {
      entries.clear();
      persist();
    }
    metrics.recordCacheSize(0);
  }

  // ── Prefetch ─────────────────────────────────────────────────────

  /**
   * Ensures the value for {@code key} is cached.
   *
   * <p>Resolves immediately with a fresh cached value if there is one. Otherwise joins the
   * fetch already in flight for the key, or starts a new one. On success the value is cached
   * before the returned future completes. On failure the error is logged and the future
   * resolves to empty. A fetch resolving to {@code null} is not cached.
   *
   * @return the value, or empty if disabled, the fetch failed or produced nothing
   */
  public CompletableFuture<Optional<V>> prefetch(String key, Fetcher<V> fetcher) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(fetcher, "fetcher");
    if (!enabled) {
      return CompletableFuture.completedFuture(Optional.empty());
    }
    Optional<V> cached = getCachedData(key);
    if (cached.isPresent()) {
      return CompletableFuture.completedFuture(cached);
    }
    CompletableFuture<Optional<V>> promise = new CompletableFuture<>();
    CompletableFuture<Optional<V>> existing = inFlight.putIfAbsent(key, promise);
    if (existing != null) {
      metrics.incrementPrefetchDeduplicated();
      return existing.copy();
    }
    // A fetch for the key may have settled between the miss above and claiming the slot
    Optional<V> settled = freshValue(key);
    if (settled.isPresent()) {
      inFlight.remove(key, promise);
      promise.complete(settled);
      metrics.incrementCacheHit();
      return promise.copy();
    }
    startFetch(key, fetcher, promise);
    return promise.copy();
  }

  private Optional<V> freshValue(String key) {
    CacheEntry<V> entry;
    synchronized (lock) {
      entry = entries.get(key);
    }
    return entry != null && entry.isFresh(clock.instant(), maxAge) ? Optional.of(entry.value()) : Optional.empty();
  }

  /**
   * Schedules {@link #prefetch} after {@code delay}, for data that will probably be needed
   * soon but not right now.
   */
  public void prefetchLazy(String key, Fetcher<V> fetcher, Duration delay) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(fetcher, "fetcher");
    Objects.requireNonNull(delay, "delay");
    if (!enabled || closed) {
      return;
    }
    try {
      scheduler.schedule(() -> {
        try {
          prefetch(key, fetcher);
        } catch (RuntimeException e) {
          logger.log(Level.WARNING, "Lazy prefetch failed for key=" + key, e);
        }
      }, Math.max(0L, delay.toMillis()), TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      logger.log(Level.FINE, "Lazy prefetch rejected for key=" + key + "; cache is closed", e);
    }
  }

  /**
   * Same as {@link #prefetchLazy(String, Fetcher, Duration)} with a one second delay.
   */
  public void prefetchLazy(String key, Fetcher<V> fetcher) {
    prefetchLazy(key, fetcher, Duration.ofSeconds(1));
  }

  /**
   * Prefetches several keys concurrently.
   *
   * @return a future completing with one result per key, in the order of {@code requests}
   */
  public CompletableFuture<Map<String, Optional<V>>> prefetchBatch(Map<String, Fetcher<V>> requests) {
    Objects.requireNonNull(requests, "requests");
    Map<String, CompletableFuture<Optional<V>>> futures = new LinkedHashMap<>();
    requests.forEach((key, fetcher) -> futures.put(key, prefetch(key, fetcher)));
    return CompletableFuture.allOf(futures.values().toArray(new CompletableFuture<?>[0]))
        .thenApply(ignored -> {
          Map<String, Optional<V>> results = new LinkedHashMap<>();
          futures.forEach((key, future) -> results.put(key, future.join()));
          return Collections.unmodifiableMap(results);
        });
  }

  private void startFetch(String key, Fetcher<V> fetcher, CompletableFuture<Optional<V>> promise) {
    CompletionStage<V> stage;
    try {
      stage = fetcher.fetch();
      if (stage == null) {
        throw new IllegalStateException("Fetcher returned null for key=" + key);
      }
    } catch (Exception e) {
      settle(key, promise, null, e);
      return;
    }
    stage.whenComplete((value, error) -> settle(key, promise, value, error));
  }

  private void settle(String key, CompletableFuture<Optional<V>> promise, V value, Throwable error) {
    Optional<V> outcome = Optional.empty();
    try {
      if (error != null) {
        metrics.incrementPrefetchFailure();
        logger.log(Level.WARNING, "Prefetch failed for key=" + key, unwrap(error));
      } else if (value != null) {
        setCachedData(key, value);
        outcome = Optional.of(value);
      }
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to cache prefetched value for key=" + key, e);
    } finally {
      inFlight.remove(key, promise);
      promise.complete(outcome);
    }
  }

  // ── Maintenance ──────────────────────────────────────────────────

  /**
   * Removes every entry that is no longer fresh.
   *
   * @return the number of entries removed
   */
  public int sweepExpired() {
    Instant now = clock.instant();
    int removed = 0;
    int size;
    synchronized (lock) {
      Iterator<CacheEntry<V>> it = entries.values().iterator();
      while (it.hasNext()) {
        if (!it.next().isFresh(now, maxAge)) {
          it.remove();
          removed++;
        }
      }
      if (removed > 0) {
        persist();
      }
      size = entries.size();
    }
    if (removed > 0) {
      metrics.incrementCacheEvicted(removed);
      int count = removed;
      logger.fine(() -> "Swept " + count + " expired cache entries");
    }
    metrics.recordCacheSize(size);
    return removed;
  }

  public CacheStatus status() {
    synchronized (lock) {
      return new CacheStatus(entries.size(), !inFlight.isEmpty());
    }
  }

  /**
   * @return the entry stored under {@code key}, fresh or not
   */
  public Optional<CacheEntry<V>> entry(String key) {
    synchronized (lock) {
      return Optional.ofNullable(entries.get(key));
    }
  }

  /**
   * Starts the periodic sweep. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("PrefetchCache has been closed");
    }
    if (sweepTask != null) {
      return;
    }
    sweepTask = scheduler.scheduleWithFixedDelay(this::sweep, sweepIntervalMs, sweepIntervalMs,
        TimeUnit.MILLISECONDS);
  }

  private void sweep() {
    try {
      sweepExpired();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Cache sweep failed", t);
    }
  }

  /**
   * Stops the sweep and drops pending lazy prefetches. Fetches in flight still complete.
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (sweepTask != null) {
      sweepTask.cancel(false);
    }
    scheduler.shutdownNow();
  }

  // ── Persistence ──────────────────────────────────────────────────

  // Caller holds lock
  private int evictOverflow() {
    int evicted = 0;
    Iterator<CacheEntry<V>> it = entries.values().iterator();
    while (entries.size() > maxEntries && it.hasNext()) {
      it.next();
      it.remove();
      evicted++;
    }
    return evicted;
  }

  // Caller holds lock
  private void persist() {
    List<PersistedEntry> snapshot = new ArrayList<>(entries.size());
    for (CacheEntry<V> entry : entries.values()) {
      snapshot.add(new PersistedEntry(entry.key(), entry.value(), entry.storedAt()));
    }
    store.writeSnapshot(cacheKey, snapshot.toArray(new PersistedEntry[0]));
  }

  private void restore() {
    Optional<PersistedEntry[]> snapshot = store.readSnapshot(cacheKey, PersistedEntry[].class);
    if (snapshot.isEmpty()) {
      return;
    }
    List<CacheEntry<V>> restored = new ArrayList<>();
    int skipped = 0;
    for (PersistedEntry persisted : snapshot.get()) {
      if (persisted == null || persisted.key() == null || persisted.value() == null
          || persisted.storedAt() == null) {
        skipped++;
        continue;
      }
      try {
        V value = store.codec().convert(persisted.value(), valueType);
        restored.add(new CacheEntry<>(persisted.key(), value, persisted.storedAt()));
      } catch (RuntimeException e) {
        skipped++;
        logger.log(Level.WARNING, "Skipping unreadable cache entry key=" + persisted.key(), e);
      }
    }
    restored.sort(Comparator.comparing(CacheEntry::storedAt));
    Instant now = clock.instant();
    int expired = 0;
    synchronized (lock) {
      for (CacheEntry<V> entry : restored) {
        if (entry.isFresh(now, maxAge)) {
          entries.remove(entry.key());
          entries.put(entry.key(), entry);
        } else {
          expired++;
        }
      }
      int evicted = evictOverflow();
      if (skipped > 0 || expired > 0 || evicted > 0) {
        persist();
      }
    }
    logger.fine("Restored " + entries.size() + " cache entries from '" + cacheKey + "'");
    metrics.recordCacheSize(entries.size());
  }

  private static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  /**
   * Builder for {@link PrefetchCache}.
   *
   * @param <V> value type
   */
  public static final class Builder<V> {
    private final Class<V> valueType;
    private DurableStore store;
    private MetricsExporter metrics;
    private Clock clock;
    private String cacheKey = "prefetch_cache";
    private Duration maxAge = Duration.ofMinutes(5);
    private int maxEntries = 50;
    private long sweepIntervalMs = 60_000L;
    private boolean enabled = true;

    private Builder(Class<V> valueType) {
      this.valueType = valueType;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder<V> store(DurableStore store) {
      this.store = store;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder<V> metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     */
    public Builder<V> clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Storage key of the cache snapshot.
     *
     * <p>Optional. Defaults to {@code prefetch_cache}.
     */
    public Builder<V> cacheKey(String cacheKey) {
      this.cacheKey = cacheKey;
      return this;
    }

    /**
     * <p>Optional. Defaults to 5 minutes.
     */
    public Builder<V> maxAge(Duration maxAge) {
      this.maxAge = maxAge;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 50}.
     */
    public Builder<V> maxEntries(int maxEntries) {
      this.maxEntries = maxEntries;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 60000} ms.
     */
    public Builder<V> sweepIntervalMs(long sweepIntervalMs) {
      this.sweepIntervalMs = sweepIntervalMs;
      return this;
    }

    /**
     * When {@code false}, prefetches resolve to empty without fetching. Direct reads and
     * writes still work.
     *
     * <p>Optional. Defaults to {@code true}.
     */
    public Builder<V> enabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    public PrefetchCache<V> build() {
      return new PrefetchCache<>(this);
    }
  }
}
