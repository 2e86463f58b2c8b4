package io.offsync.connectivity;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Factory methods for common {@link ConnectivityProbe}s.
 */
public final class ConnectivityProbes {
  private static final Logger logger = Logger.getLogger(ConnectivityProbes.class.getName());

  private ConnectivityProbes() {
  }

  /**
   * Probe that succeeds when a TCP connection to {@code host:port} can be opened within
   * {@code timeout}.
   */
  public static ConnectivityProbe tcp(String host, int port, Duration timeout) {
    Objects.requireNonNull(host, "host");
    Objects.requireNonNull(timeout, "timeout");
    if (port <= 0 || port > 65535) {
      throw new IllegalArgumentException("port must be in 1..65535, got: " + port);
    }
    int timeoutMs = (int) Math.min(Integer.MAX_VALUE, Math.max(1L, timeout.toMillis()));
    return () -> {
      try (Socket socket = new Socket()) {
        socket.connect(new InetSocketAddress(host, port), timeoutMs);
        return true;
      } catch (IOException e) {
        logger.log(Level.FINE, "TCP probe to " + host + ":" + port + " failed", e);
        return false;
      }
    };
  }
}
