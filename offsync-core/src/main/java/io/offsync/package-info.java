/**
 * Offline-tolerant data layer for services that talk to an unreliable backend.
 *
 * <p>{@link io.offsync.sync.SyncQueue} persists writes and replays them with backoff once the
 * backend is reachable; {@link io.offsync.cache.PrefetchCache} reads ahead into a bounded,
 * time-limited cache. {@link io.offsync.Offsync} wires both over one durable store.
 */
package io.offsync;
