package io.offsync.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration properties for the offline sync queue and prefetch cache.
 *
 * @see OffsyncAutoConfiguration
 */
@ConfigurationProperties(prefix = "offsync")
public class OffsyncProperties {

    private final Sync sync = new Sync();
    private final Cache cache = new Cache();
    private final Store store = new Store();
    private final Metrics metrics = new Metrics();

    public Sync getSync() {
        return sync;
    }

    public Cache getCache() {
        return cache;
    }

    public Store getStore() {
        return store;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public enum StoreType {
        /**
         * JDBC when offsync-jdbc and a DataSource are present, else FILE when a directory is
         * set, else MEMORY.
         */
        AUTO,
        MEMORY,
        FILE,
        JDBC
    }

    public static class Sync {
        /**
         * Whether the queue processes items. A disabled queue still accepts and persists them.
         */
        private boolean enabled = true;

        /**
         * Storage key of the queue snapshot.
         */
        private String queueKey = "background_sync_queue";

        /**
         * Maximum number of items executed concurrently in one pass.
         */
        private int batchSize = 3;

        /**
         * Retries after the first failed execution before an item is marked FAILED.
         */
        private int maxRetries = 3;

        private Duration retryDelay = Duration.ofSeconds(5);
        private Duration maxRetryDelay = Duration.ofMinutes(10);

        /**
         * Relative jitter applied to retry delays, in [0, 1).
         */
        private double jitter = 0.2;

        private Duration onlineInterval = Duration.ofSeconds(30);
        private Duration offlineInterval = Duration.ofSeconds(60);

        /**
         * Items older than this are dropped when the queue is restored.
         */
        private Duration maxItemAge = Duration.ofHours(24);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getQueueKey() {
            return queueKey;
        }

        public void setQueueKey(String queueKey) {
            this.queueKey = queueKey;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getRetryDelay() {
            return retryDelay;
        }

        public void setRetryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
        }

        public Duration getMaxRetryDelay() {
            return maxRetryDelay;
        }

        public void setMaxRetryDelay(Duration maxRetryDelay) {
            this.maxRetryDelay = maxRetryDelay;
        }

        public double getJitter() {
            return jitter;
        }

        public void setJitter(double jitter) {
            this.jitter = jitter;
        }

        public Duration getOnlineInterval() {
            return onlineInterval;
        }

        public void setOnlineInterval(Duration onlineInterval) {
            this.onlineInterval = onlineInterval;
        }

        public Duration getOfflineInterval() {
            return offlineInterval;
        }

        public void setOfflineInterval(Duration offlineInterval) {
            this.offlineInterval = offlineInterval;
        }

        public Duration getMaxItemAge() {
            return maxItemAge;
        }

        public void setMaxItemAge(Duration maxItemAge) {
            this.maxItemAge = maxItemAge;
        }
    }

    public static class Cache {
        /**
         * Whether the cache serves and stores entries. A disabled cache reads as empty.
         */
        private boolean enabled = true;

        /**
         * Storage key of the cache snapshot.
         */
        private String cacheKey = "prefetch_cache";

        private Duration maxAge = Duration.ofMinutes(5);
        private int maxEntries = 50;
        private Duration sweepInterval = Duration.ofSeconds(60);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getCacheKey() {
            return cacheKey;
        }

        public void setCacheKey(String cacheKey) {
            this.cacheKey = cacheKey;
        }

        public Duration getMaxAge() {
            return maxAge;
        }

        public void setMaxAge(Duration maxAge) {
            this.maxAge = maxAge;
        }

        public int getMaxEntries() {
            return maxEntries;
        }

        public void setMaxEntries(int maxEntries) {
            this.maxEntries = maxEntries;
        }

        public Duration getSweepInterval() {
            return sweepInterval;
        }

        public void setSweepInterval(Duration sweepInterval) {
            this.sweepInterval = sweepInterval;
        }
    }

    public static class Store {
        private StoreType type = StoreType.AUTO;

        /**
         * Directory for the FILE store.
         */
        private Path directory;

        /**
         * Table for the JDBC store.
         */
        private String tableName = "offsync_kv";

        /**
         * Whether the JDBC store creates its table on startup when missing.
         */
        private boolean initializeSchema = true;

        public StoreType getType() {
            return type;
        }

        public void setType(StoreType type) {
            this.type = type;
        }

        public Path getDirectory() {
            return directory;
        }

        public void setDirectory(Path directory) {
            this.directory = directory;
        }

        public String getTableName() {
            return tableName;
        }

        public void setTableName(String tableName) {
            this.tableName = tableName;
        }

        public boolean isInitializeSchema() {
            return initializeSchema;
        }

        public void setInitializeSchema(boolean initializeSchema) {
            this.initializeSchema = initializeSchema;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "offsync";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
