package io.offsync.cache;

import java.time.Instant;

/**
 * Storage form of a cache entry. The value is kept as a JSON tree and converted back to the
 * cache's value type on restore.
 */
public record PersistedEntry(String key, Object value, Instant storedAt) {
}
