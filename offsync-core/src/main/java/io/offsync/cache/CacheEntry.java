package io.offsync.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A cached value and the time it was stored.
 *
 * @param key      cache key
 * @param value    cached value
 * @param storedAt when the value was stored
 * @param <V> value type
 */
public record CacheEntry<V>(String key, V value, Instant storedAt) {

    public CacheEntry {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(storedAt, "storedAt");
    }

    public Duration age(Instant now) {
        return Duration.between(storedAt, now);
    }

    /**
     * An entry is fresh while its age is strictly below {@code maxAge}.
     */
    public boolean isFresh(Instant now, Duration maxAge) {
        return age(now).compareTo(maxAge) < 0;
    }
}
