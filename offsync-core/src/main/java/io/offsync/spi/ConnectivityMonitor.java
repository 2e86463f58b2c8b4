package io.offsync.spi;

/**
 * Source of the current online/offline state and its transitions.
 *
 * @see io.offsync.connectivity.DefaultConnectivityMonitor
 * @see io.offsync.connectivity.PollingConnectivityMonitor
 */
public interface ConnectivityMonitor {

    /**
     * @return {@code true} if the backend is currently believed reachable
     */
    boolean isOnline();

    /**
     * Registers a listener for online/offline transitions.
     *
     * @param listener the listener
     * @return a handle that unregisters the listener when closed
     */
    Subscription subscribe(ConnectivityListener listener);

    /**
     * Registration handle returned by {@link #subscribe(ConnectivityListener)}.
     */
    @FunctionalInterface
    interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}
