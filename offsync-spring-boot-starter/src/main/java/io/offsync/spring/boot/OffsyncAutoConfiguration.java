package io.offsync.spring.boot;

import io.offsync.Offsync;
import io.offsync.cache.PrefetchCache;
import io.offsync.connectivity.DefaultConnectivityMonitor;
import io.offsync.jdbc.JdbcKeyValueStore;
import io.offsync.spi.ConnectivityMonitor;
import io.offsync.spi.KeyValueStore;
import io.offsync.spi.MetricsExporter;
import io.offsync.store.FileKeyValueStore;
import io.offsync.store.InMemoryKeyValueStore;
import io.offsync.sync.DefaultSyncHandlerRegistry;
import io.offsync.sync.SyncQueue;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Condition;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.context.annotation.Conditional;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.type.AnnotatedTypeMetadata;

import javax.sql.DataSource;
import java.util.Locale;
import java.util.logging.Logger;

/**
 * Auto-configuration for the offline sync queue and prefetch cache.
 *
 * <p>Wires an {@link Offsync} composite from {@link OffsyncProperties}, a
 * {@link KeyValueStore} chosen by {@code offsync.store.type}, and any
 * {@link SyncHandler}-annotated beans. The composite is started by {@link OffsyncLifecycle}
 * after the context is refreshed.
 *
 * @see OffsyncProperties
 * @see OffsyncMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(Offsync.class)
@EnableConfigurationProperties(OffsyncProperties.class)
public class OffsyncAutoConfiguration {
  private static final Logger logger = Logger.getLogger(OffsyncAutoConfiguration.class.getName());

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass(JdbcKeyValueStore.class)
  @ConditionalOnBean(DataSource.class)
  @Conditional(JdbcStoreSelected.class)
  static class JdbcStoreConfiguration {

    @Bean
    @ConditionalOnMissingBean(KeyValueStore.class)
    public JdbcKeyValueStore jdbcKeyValueStore(DataSource dataSource, OffsyncProperties props) {
      JdbcKeyValueStore store = JdbcKeyValueStore.create(dataSource, props.getStore().getTableName());
      if (props.getStore().isInitializeSchema()) {
        store.createTableIfMissing();
      }
      return store;
    }
  }

  @Bean
  @ConditionalOnMissingBean(KeyValueStore.class)
  public KeyValueStore offsyncKeyValueStore(OffsyncProperties props) {
    OffsyncProperties.Store store = props.getStore();
    return switch (store.getType()) {
      case JDBC -> throw new IllegalStateException(
          "offsync.store.type=JDBC requires offsync-jdbc on the classpath and a DataSource bean");
      case FILE -> {
        if (store.getDirectory() == null) {
          throw new IllegalStateException("offsync.store.type=FILE requires offsync.store.directory");
        }
        yield new FileKeyValueStore(store.getDirectory());
      }
      case AUTO -> {
        if (store.getDirectory() != null) {
          yield new FileKeyValueStore(store.getDirectory());
        }
        logger.info("No durable store configured for offsync; queued items will not survive a restart");
        yield new InMemoryKeyValueStore();
      }
      case MEMORY -> new InMemoryKeyValueStore();
    };
  }

  @Bean
  @ConditionalOnMissingBean(ConnectivityMonitor.class)
  public DefaultConnectivityMonitor offsyncConnectivityMonitor() {
    return new DefaultConnectivityMonitor();
  }

  @Bean
  @ConditionalOnMissingBean
  public DefaultSyncHandlerRegistry syncHandlerRegistry() {
    return new DefaultSyncHandlerRegistry();
  }

  @Bean
  @ConditionalOnMissingBean
  public SyncHandlerRegistrar syncHandlerRegistrar(ListableBeanFactory beanFactory,
      DefaultSyncHandlerRegistry syncHandlerRegistry) {
    return new SyncHandlerRegistrar(beanFactory, syncHandlerRegistry);
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public Offsync offsync(OffsyncProperties props,
      KeyValueStore keyValueStore,
      ConnectivityMonitor connectivity,
      DefaultSyncHandlerRegistry syncHandlerRegistry,
      ObjectProvider<MetricsExporter> metricsProvider) {
    OffsyncProperties.Sync sync = props.getSync();
    OffsyncProperties.Cache cache = props.getCache();
    return Offsync.builder()
        .keyValueStore(keyValueStore)
        .connectivity(connectivity)
        .handlers(syncHandlerRegistry)
        .metrics(metricsProvider.getIfAvailable())
        .configureSyncQueue(q -> q
            .enabled(sync.isEnabled())
            .queueKey(sync.getQueueKey())
            .batchSize(sync.getBatchSize())
            .maxRetries(sync.getMaxRetries())
            .retryDelayMs(sync.getRetryDelay().toMillis())
            .maxRetryDelayMs(sync.getMaxRetryDelay().toMillis())
            .jitter(sync.getJitter())
            .onlineIntervalMs(sync.getOnlineInterval().toMillis())
            .offlineIntervalMs(sync.getOfflineInterval().toMillis())
            .maxItemAge(sync.getMaxItemAge()))
        .configurePrefetchCache(c -> c
            .enabled(cache.isEnabled())
            .cacheKey(cache.getCacheKey())
            .maxAge(cache.getMaxAge())
            .maxEntries(cache.getMaxEntries())
            .sweepIntervalMs(cache.getSweepInterval().toMillis()))
        .build();
  }

  @Bean(destroyMethod = "")
  @ConditionalOnMissingBean
  public SyncQueue syncQueue(Offsync offsync) {
    return offsync.syncQueue();
  }

  @Bean(destroyMethod = "")
  @ConditionalOnMissingBean
  public PrefetchCache<Object> prefetchCache(Offsync offsync) {
    return offsync.prefetchCache();
  }

  @Bean
  @ConditionalOnMissingBean
  public OffsyncLifecycle offsyncLifecycle(Offsync offsync) {
    return new OffsyncLifecycle(offsync);
  }

  static class JdbcStoreSelected implements Condition {
    @Override
    public boolean matches(ConditionContext context, AnnotatedTypeMetadata metadata) {
      String type = context.getEnvironment().getProperty("offsync.store.type", "AUTO")
          .trim().toUpperCase(Locale.ROOT);
      return type.equals("AUTO") || type.equals("JDBC");
    }
  }
}
