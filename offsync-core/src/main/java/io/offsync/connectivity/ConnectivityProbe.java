package io.offsync.connectivity;

/**
 * Reachability check used by {@link PollingConnectivityMonitor}.
 *
 * @see ConnectivityProbes
 */
@FunctionalInterface
public interface ConnectivityProbe {

  /**
   * @return {@code true} if the backend is reachable
   * @throws Exception treated the same as {@code false}
   */
  boolean probe() throws Exception;
}
