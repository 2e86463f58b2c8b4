package io.offsync.jdbc.dialect;

import java.util.List;

/**
 * PostgreSQL dialect.
 */
public final class PostgresDialect extends AbstractDialect {

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public String upsertSql(String table) {
    return "INSERT INTO " + table + " (kv_key, kv_value, updated_at) VALUES (?,?,?)"
        + " ON CONFLICT (kv_key) DO UPDATE SET kv_value=EXCLUDED.kv_value, updated_at=EXCLUDED.updated_at";
  }

  @Override
  public String createTableSql(String table) {
    return "CREATE TABLE IF NOT EXISTS " + table + " ("
        + "kv_key VARCHAR(255) PRIMARY KEY, "
        + "kv_value TEXT NOT NULL, "
        + "updated_at TIMESTAMPTZ NOT NULL)";
  }
}
