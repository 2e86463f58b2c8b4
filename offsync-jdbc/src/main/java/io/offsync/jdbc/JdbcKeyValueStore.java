package io.offsync.jdbc;

import io.offsync.jdbc.dialect.Dialects;
import io.offsync.jdbc.spi.Dialect;
import io.offsync.spi.KeyValueStore;
import io.offsync.store.StoreException;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * {@link KeyValueStore} persisting values as rows of a single table, one row per key.
 *
 * <p>Each operation borrows a connection from the {@link ConnectionProvider} and relies on
 * the connection's auto-commit. Writes are single-statement upserts.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * JdbcKeyValueStore kv = JdbcKeyValueStore.create(dataSource);
 * kv.createTableIfMissing();
 * }</pre>
 *
 * @see Dialects
 */
public final class JdbcKeyValueStore implements KeyValueStore {
  private static final Logger logger = Logger.getLogger(JdbcKeyValueStore.class.getName());

  private final ConnectionProvider connectionProvider;
  private final Dialect dialect;
  private final String tableName;
  private final Clock clock;

  public JdbcKeyValueStore(ConnectionProvider connectionProvider, Dialect dialect) {
    this(connectionProvider, dialect, TableNames.DEFAULT_TABLE, Clock.systemUTC());
  }

  public JdbcKeyValueStore(ConnectionProvider connectionProvider, Dialect dialect,
      String tableName, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.tableName = TableNames.validate(tableName);
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Creates a store over {@code dataSource} with the default table, detecting the dialect
   * from the connection URL.
   */
  public static JdbcKeyValueStore create(DataSource dataSource) {
    return create(dataSource, TableNames.DEFAULT_TABLE);
  }

  public static JdbcKeyValueStore create(DataSource dataSource, String tableName) {
    ConnectionProvider provider = new DataSourceConnectionProvider(dataSource);
    return new JdbcKeyValueStore(provider, Dialects.detect(provider), tableName, Clock.systemUTC());
  }

  public Dialect dialect() {
    return dialect;
  }

  public String tableName() {
    return tableName;
  }

  /**
   * Creates the backing table when it does not exist yet.
   */
  public void createTableIfMissing() {
    try (Connection conn = connectionProvider.getConnection()) {
      JdbcTemplate.update(conn, dialect.createTableSql(tableName));
    } catch (SQLException e) {
      throw new StoreException("Failed to create table " + tableName, e);
    }
    logger.fine(() -> "Ensured key-value table " + tableName + " (" + dialect.name() + ")");
  }

  @Override
  public Optional<String> get(String key) {
    Objects.requireNonNull(key, "key");
    try (Connection conn = connectionProvider.getConnection()) {
      return JdbcTemplate.queryOne(conn, dialect.selectSql(tableName), rs -> rs.getString(1), key);
    } catch (SQLException e) {
      throw new StoreException("Failed to read key=" + key, e);
    }
  }

  @Override
  public void set(String key, String value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    try (Connection conn = connectionProvider.getConnection()) {
      JdbcTemplate.update(conn, dialect.upsertSql(tableName),
          key, value, Timestamp.from(clock.instant()));
    } catch (SQLException e) {
      throw new StoreException("Failed to write key=" + key, e);
    }
  }

  @Override
  public void remove(String key) {
    Objects.requireNonNull(key, "key");
    try (Connection conn = connectionProvider.getConnection()) {
      JdbcTemplate.update(conn, dialect.deleteSql(tableName), key);
    } catch (SQLException e) {
      throw new StoreException("Failed to remove key=" + key, e);
    }
  }
}
