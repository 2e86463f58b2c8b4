package io.offsync.spi;

/**
 * Callback for connectivity transitions. Only transitions are reported, never repeats.
 */
public interface ConnectivityListener {

    void onOnline();

    void onOffline();
}
