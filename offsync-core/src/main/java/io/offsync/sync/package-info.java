/**
 * Background sync queue: durable items, passes, retry with backoff and manual recovery.
 *
 * @see io.offsync.sync.SyncQueue
 */
package io.offsync.sync;
