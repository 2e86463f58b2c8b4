package io.offsync.sync;

/**
 * Processing priority. Within a pass, items are taken in priority order and then in
 * enqueue order.
 */
public enum SyncPriority {
    HIGH,
    NORMAL,
    LOW
}
