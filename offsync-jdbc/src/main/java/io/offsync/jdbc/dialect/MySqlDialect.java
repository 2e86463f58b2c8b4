package io.offsync.jdbc.dialect;

import java.util.List;

/**
 * MySQL dialect. Also compatible with TiDB.
 */
public final class MySqlDialect extends AbstractDialect {

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }

  @Override
  public String upsertSql(String table) {
    return "INSERT INTO " + table + " (kv_key, kv_value, updated_at) VALUES (?,?,?)"
        + " ON DUPLICATE KEY UPDATE kv_value=VALUES(kv_value), updated_at=VALUES(updated_at)";
  }

  @Override
  public String createTableSql(String table) {
    return "CREATE TABLE IF NOT EXISTS " + table + " ("
        + "kv_key VARCHAR(255) NOT NULL PRIMARY KEY, "
        + "kv_value LONGTEXT NOT NULL, "
        + "updated_at DATETIME(6) NOT NULL)";
  }
}
