package io.offsync.connectivity;

import io.offsync.spi.ConnectivityListener;
import io.offsync.spi.ConnectivityMonitor;

import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Connectivity monitor driven by explicit {@link #setOnline(boolean)} calls, e.g. from a
 * health check, a circuit breaker or a test.
 *
 * <p>Listeners are notified synchronously on the calling thread, only when the state
 * actually changes. A listener that throws is logged and does not prevent the remaining
 * listeners from being notified.
 */
public final class DefaultConnectivityMonitor implements ConnectivityMonitor {
  private static final Logger logger = Logger.getLogger(DefaultConnectivityMonitor.class.getName());

  private final AtomicBoolean online;
  private final CopyOnWriteArrayList<ConnectivityListener> listeners = new CopyOnWriteArrayList<>();

  public DefaultConnectivityMonitor() {
    this(true);
  }

  public DefaultConnectivityMonitor(boolean initiallyOnline) {
    this.online = new AtomicBoolean(initiallyOnline);
  }

  @Override
  public boolean isOnline() {
    return online.get();
  }

  /**
   * Updates the connectivity state and notifies listeners if it changed.
   *
   * @param value the new state
   * @return {@code true} if this call caused a transition
   */
  public boolean setOnline(boolean value) {
    if (online.getAndSet(value) == value) {
      return false;
    }
    logger.info(value ? "Connectivity restored" : "Connectivity lost");
    for (ConnectivityListener listener : listeners) {
      try {
        if (value) {
          listener.onOnline();
        } else {
          listener.onOffline();
        }
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Connectivity listener failed: " + listener, e);
      }
    }
    return true;
  }

  @Override
  public Subscription subscribe(ConnectivityListener listener) {
    Objects.requireNonNull(listener, "listener");
    listeners.add(listener);
    return () -> listeners.remove(listener);
  }

  int listenerCount() {
    return listeners.size();
  }
}
