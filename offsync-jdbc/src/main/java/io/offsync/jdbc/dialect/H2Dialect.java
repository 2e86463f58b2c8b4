package io.offsync.jdbc.dialect;

import java.util.List;

/**
 * H2 dialect. Primarily for testing.
 */
public final class H2Dialect extends AbstractDialect {

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public String upsertSql(String table) {
    return "MERGE INTO " + table + " (kv_key, kv_value, updated_at) KEY (kv_key) VALUES (?,?,?)";
  }

  @Override
  public String createTableSql(String table) {
    return "CREATE TABLE IF NOT EXISTS " + table + " ("
        + "kv_key VARCHAR(255) NOT NULL PRIMARY KEY, "
        + "kv_value CLOB NOT NULL, "
        + "updated_at TIMESTAMP NOT NULL)";
  }
}
