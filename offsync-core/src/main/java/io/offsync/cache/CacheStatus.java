package io.offsync.cache;

/**
 * Point-in-time summary of a {@link PrefetchCache}.
 *
 * @param cacheSize   entries held, including stale ones not yet swept
 * @param prefetching whether any fetch is in flight
 */
public record CacheStatus(int cacheSize, boolean prefetching) {
}
