package io.offsync.store;

import io.offsync.spi.KeyValueStore;
import io.offsync.spi.MetricsExporter;
import io.offsync.util.JsonCodec;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Best-effort facade over a {@link KeyValueStore}.
 *
 * <p>No method of this class throws because of the underlying storage or the JSON codec:
 * read failures (including corrupt snapshots) are reported as an absent value and write
 * failures are dropped, each logged at {@code WARNING} and counted via
 * {@link MetricsExporter#incrementStoreFailure()}. The sync queue and prefetch cache keep
 * working in memory when persistence is unavailable.
 */
public final class DurableStore {
    private static final Logger logger = Logger.getLogger(DurableStore.class.getName());

    private final KeyValueStore delegate;
    private final JsonCodec codec;
    private final MetricsExporter metrics;

    public DurableStore(KeyValueStore delegate) {
        this(delegate, JsonCodec.getDefault(), MetricsExporter.NOOP);
    }

    public DurableStore(KeyValueStore delegate, JsonCodec codec, MetricsExporter metrics) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.codec = codec != null ? codec : JsonCodec.getDefault();
        this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
    }

    public Optional<String> get(String key) {
        try {
            Optional<String> value = delegate.get(key);
            return value != null ? value : Optional.empty();
        } catch (RuntimeException e) {
            degrade("read", key, e);
            return Optional.empty();
        }
    }

    public void set(String key, String value) {
        try {
            delegate.set(key, value);
        } catch (RuntimeException e) {
            degrade("write", key, e);
        }
    }

    public void remove(String key) {
        try {
            delegate.remove(key);
        } catch (RuntimeException e) {
            degrade("remove", key, e);
        }
    }

    /**
     * Reads and decodes the snapshot stored under {@code key}.
     *
     * @param key the storage key
     * @param type snapshot type
     * @param <T> snapshot type
     * @return the decoded snapshot, or empty if absent, unreadable or corrupt
     */
    public <T> Optional<T> readSnapshot(String key, Class<T> type) {
        Optional<String> json = get(key);
        if (json.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(codec.fromJson(json.get(), type));
        } catch (RuntimeException e) {
            degrade("decode snapshot at", key, e);
            return Optional.empty();
        }
    }

    /**
     * Encodes {@code snapshot} and stores it under {@code key}.
     *
     * @param key the storage key
     * @param snapshot the value to persist
     */
    public void writeSnapshot(String key, Object snapshot) {
        String json;
        try {
            json = codec.toJson(snapshot);
        } catch (RuntimeException e) {
            degrade("encode snapshot for", key, e);
            return;
        }
        set(key, json);
    }

    public JsonCodec codec() {
        return codec;
    }

    private void degrade(String action, String key, RuntimeException e) {
        metrics.incrementStoreFailure();
        logger.log(Level.WARNING, "Durable store failed to " + action + " key=" + key
                + "; continuing without durability", e);
    }
}
