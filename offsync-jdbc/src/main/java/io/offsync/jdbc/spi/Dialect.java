package io.offsync.jdbc.spi;

import java.util.List;

/**
 * SPI for database dialect support.
 *
 * <p>Implementations provide database-specific SQL for the key-value table. Register
 * custom dialects via {@code META-INF/services/io.offsync.jdbc.spi.Dialect}.
 *
 * <p>Built-in dialects: MySQL (+ TiDB), PostgreSQL, H2.
 *
 * <p>The table has three columns: {@code kv_key} (primary key), {@code kv_value} (the JSON
 * snapshot) and {@code updated_at}.
 *
 * @see io.offsync.jdbc.dialect.Dialects
 */
public interface Dialect {

  /**
   * Unique identifier for this dialect (e.g., "mysql", "postgresql", "h2").
   */
  String name();

  /**
   * JDBC URL prefixes this dialect handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  List<String> jdbcUrlPrefixes();

  /**
   * SQL for reading one value.
   *
   * <p>Parameters: kv_key (String). Returns a single {@code kv_value} column.
   */
  String selectSql(String table);

  /**
   * SQL for inserting or replacing one value.
   *
   * <p>Parameters (in order): kv_key (String), kv_value (String), updated_at (Timestamp)
   */
  String upsertSql(String table);

  /**
   * SQL for deleting one value.
   *
   * <p>Parameters: kv_key (String)
   */
  String deleteSql(String table);

  /**
   * DDL creating the table if it does not exist yet.
   */
  String createTableSql(String table);
}
