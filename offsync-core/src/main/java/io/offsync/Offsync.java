package io.offsync;

import io.offsync.cache.PrefetchCache;
import io.offsync.connectivity.DefaultConnectivityMonitor;
import io.offsync.spi.ConnectivityMonitor;
import io.offsync.spi.KeyValueStore;
import io.offsync.spi.MetricsExporter;
import io.offsync.store.DurableStore;
import io.offsync.store.InMemoryKeyValueStore;
import io.offsync.sync.DefaultSyncHandlerRegistry;
import io.offsync.sync.SyncHandlerRegistry;
import io.offsync.sync.SyncQueue;
import io.offsync.util.JsonCodec;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Composite entry point that wires a {@link SyncQueue} and a {@link PrefetchCache} over one
 * {@link DurableStore} and one {@link ConnectivityMonitor} into a single {@link AutoCloseable}
 * unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (Offsync offsync = Offsync.builder()
 *     .keyValueStore(new FileKeyValueStore(Path.of("/var/lib/app/offsync")))
 *     .connectivity(monitor)
 *     .handlers(handlers)
 *     .configureSyncQueue(q -> q.maxRetries(5))
 *     .build()) {
 *   offsync.start();
 *   offsync.syncQueue().addToSyncQueue("updateProfile", profile, item -> api.updateProfile(profile));
 * }
 * }</pre>
 *
 * @see SyncQueue
 * @see PrefetchCache
 */
public final class Offsync implements AutoCloseable {

  private final DurableStore store;
  private final ConnectivityMonitor connectivity;
  private final SyncQueue syncQueue;
  private final PrefetchCache<Object> prefetchCache;
  private final MetricsExporter metrics;

  private Offsync(DurableStore store, ConnectivityMonitor connectivity, SyncQueue syncQueue,
      PrefetchCache<Object> prefetchCache, MetricsExporter metrics) {
    this.store = store;
    this.connectivity = connectivity;
    this.syncQueue = syncQueue;
    this.prefetchCache = prefetchCache;
    this.metrics = metrics;
  }

  public static Builder builder() {
    return new Builder();
  }

  public SyncQueue syncQueue() {
    return syncQueue;
  }

  public PrefetchCache<Object> prefetchCache() {
    return prefetchCache;
  }

  public ConnectivityMonitor connectivity() {
    return connectivity;
  }

  public DurableStore store() {
    return store;
  }

  /**
   * Starts the sync queue's tick and connectivity subscription and the cache sweep.
   */
  public void start() {
    syncQueue.start();
    prefetchCache.start();
  }

  /**
   * Shuts down components in order: prefetch cache, sync queue, metrics exporter (if it is
   * {@link AutoCloseable}). The first failure is rethrown with later ones suppressed.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    try {
      prefetchCache.close();
    } catch (RuntimeException e) {
      first = e;
    }
    try {
      syncQueue.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /**
   * Builder for {@link Offsync}.
   */
  public static final class Builder {
    private KeyValueStore keyValueStore;
    private JsonCodec jsonCodec;
    private ConnectivityMonitor connectivity;
    private SyncHandlerRegistry handlers;
    private MetricsExporter metrics;
    private Clock clock;
    private Consumer<SyncQueue.Builder> syncQueueCustomizer = b -> { };
    private Consumer<PrefetchCache.Builder<Object>> prefetchCacheCustomizer = b -> { };
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {
    }

    /**
     * Sets the durable key-value storage shared by the queue and the cache.
     *
     * <p>Optional. Defaults to an {@link InMemoryKeyValueStore}, which does not survive
     * restarts.
     */
    public Builder keyValueStore(KeyValueStore keyValueStore) {
      this.keyValueStore = keyValueStore;
      return this;
    }

    /**
     * Codec for stored values and queued payloads. Handlers decode payloads encoded with it
     * through {@link SyncQueue#payload(io.offsync.sync.SyncQueueItem, Class)}.
     *
     * <p>Optional. Defaults to {@link JsonCodec#getDefault()}.
     */
    public Builder jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = jsonCodec;
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
     * <p>Optional. Defaults to an empty {@link DefaultSyncHandlerRegistry}.
     */
    public Builder handlers(SyncHandlerRegistry handlers) {
      this.handlers = handlers;
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
     * Applies extra settings (batch size, retries, intervals, ...) to the sync queue builder.
     * Store, connectivity, handlers, metrics and clock are set by this builder.
     */
    public Builder configureSyncQueue(Consumer<SyncQueue.Builder> customizer) {
      this.syncQueueCustomizer = Objects.requireNonNull(customizer, "customizer");
      return this;
    }

    /**
     * Applies extra settings (max age, capacity, ...) to the prefetch cache builder.
     */
    public Builder configurePrefetchCache(Consumer<PrefetchCache.Builder<Object>> customizer) {
      this.prefetchCacheCustomizer = Objects.requireNonNull(customizer, "customizer");
      return this;
    }

    /**
     * Builds the composite. If the cache cannot be built, the already built queue is closed
     * before rethrowing.
     *
     * @throws IllegalStateException if called twice
     */
    public Offsync build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      MetricsExporter exporter = metrics != null ? metrics : MetricsExporter.NOOP;
      ConnectivityMonitor monitor = connectivity != null ? connectivity : new DefaultConnectivityMonitor();
      DurableStore store = new DurableStore(
          keyValueStore != null ? keyValueStore : new InMemoryKeyValueStore(), jsonCodec, exporter);

      SyncQueue.Builder qb = SyncQueue.builder();
      syncQueueCustomizer.accept(qb);
      SyncQueue queue = qb
          .store(store)
          .connectivity(monitor)
          .handlers(handlers != null ? handlers : new DefaultSyncHandlerRegistry())
          .metrics(exporter)
          .clock(clock)
          .build();

      PrefetchCache<Object> cache;
      try {
        PrefetchCache.Builder<Object> cb = PrefetchCache.builder(Object.class);
        prefetchCacheCustomizer.accept(cb);
        cache = cb.store(store).metrics(exporter).clock(clock).build();
      } catch (RuntimeException e) {
        queue.close();
        throw e;
      }
      return new Offsync(store, monitor, queue, cache, exporter);
    }
  }
}
