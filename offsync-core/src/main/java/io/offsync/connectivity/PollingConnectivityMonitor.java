package io.offsync.connectivity;

import io.offsync.spi.ConnectivityListener;
import io.offsync.spi.ConnectivityMonitor;
import io.offsync.util.DaemonThreadFactory;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Connectivity monitor that runs a {@link ConnectivityProbe} on a fixed delay.
 *
 * <p>The monitor reports offline after {@code failureThreshold} consecutive failed probes
 * and online after the first successful one. A probe that throws counts as a failure.
 *
 * <p>Create instances via {@link #builder()}. The {@link #start()} and {@link #close()}
 * methods are synchronized to prevent concurrent lifecycle transitions.
 */
public final class PollingConnectivityMonitor implements ConnectivityMonitor, AutoCloseable {
  private static final Logger logger = Logger.getLogger(PollingConnectivityMonitor.class.getName());

  private final ConnectivityProbe probe;
  private final long intervalMs;
  private final int failureThreshold;
  private final DefaultConnectivityMonitor state;

  private int consecutiveFailures;
  private ScheduledExecutorService scheduler;
  private ScheduledFuture<?> probeTask;
  private volatile boolean closed;

  private PollingConnectivityMonitor(Builder builder) {
    this.probe = Objects.requireNonNull(builder.probe, "probe");
    if (builder.intervalMs <= 0L) {
      throw new IllegalArgumentException("intervalMs must be > 0");
    }
    if (builder.failureThreshold < 1) {
      throw new IllegalArgumentException("failureThreshold must be >= 1");
    }
    this.intervalMs = builder.intervalMs;
    this.failureThreshold = builder.failureThreshold;
    this.state = new DefaultConnectivityMonitor(builder.initiallyOnline);
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public boolean isOnline() {
    return state.isOnline();
  }

  @Override
  public Subscription subscribe(ConnectivityListener listener) {
    return state.subscribe(listener);
  }

  /**
   * Starts probing. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("PollingConnectivityMonitor has been closed");
    }
    if (probeTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("offsync-connectivity-"));
    probeTask = scheduler.scheduleWithFixedDelay(this::check, 0L, intervalMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Runs the probe once and updates the state. Called by the scheduler, but may also be
   * invoked directly.
   */
  public synchronized void check() {
    if (closed) {
      return;
    }
    boolean reachable;
    try {
      reachable = probe.probe();
    } catch (Exception e) {
      logger.log(Level.FINE, "Connectivity probe threw", e);
      reachable = false;
    }
    if (reachable) {
      consecutiveFailures = 0;
      state.setOnline(true);
    } else if (++consecutiveFailures >= failureThreshold) {
      state.setOnline(false);
    }
  }

  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (probeTask != null) {
      probeTask.cancel(false);
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
    }
  }

  /**
   * Builder for {@link PollingConnectivityMonitor}.
   */
  public static final class Builder {
    private ConnectivityProbe probe;
    private long intervalMs = 10_000L;
    private int failureThreshold = 1;
    private boolean initiallyOnline = true;

    private Builder() {
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder probe(ConnectivityProbe probe) {
      this.probe = probe;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 10000} ms.
     */
    public Builder intervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
      return this;
    }

    /**
     * Number of consecutive failed probes before reporting offline.
     *
     * <p>Optional. Defaults to {@code 1}.
     */
    public Builder failureThreshold(int failureThreshold) {
      this.failureThreshold = failureThreshold;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code true}.
     */
    public Builder initiallyOnline(boolean initiallyOnline) {
      this.initiallyOnline = initiallyOnline;
      return this;
    }

    public PollingConnectivityMonitor build() {
      return new PollingConnectivityMonitor(this);
    }
  }
}
