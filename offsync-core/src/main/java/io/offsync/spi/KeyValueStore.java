package io.offsync.spi;

import java.util.Optional;

/**
 * Durable string key-value storage backing the sync queue and prefetch cache snapshots.
 *
 * <p>Implementations signal failures by throwing; callers go through
 * {@link io.offsync.store.DurableStore}, which turns every failure into a logged,
 * non-fatal degradation.
 *
 * @see io.offsync.store.InMemoryKeyValueStore
 * @see io.offsync.store.FileKeyValueStore
 */
public interface KeyValueStore {

    /**
     * Reads the value stored under {@code key}.
     *
     * @param key the storage key
     * @return the stored value, or empty if absent
     */
    Optional<String> get(String key);

    /**
     * Stores {@code value} under {@code key}, replacing any previous value.
     *
     * @param key the storage key
     * @param value the value to store
     */
    void set(String key, String value);

    /**
     * Removes the value stored under {@code key}. Removing an absent key is a no-op.
     *
     * @param key the storage key
     */
    void remove(String key);
}
