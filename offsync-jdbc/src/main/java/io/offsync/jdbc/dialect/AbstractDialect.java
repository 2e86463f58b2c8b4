package io.offsync.jdbc.dialect;

import io.offsync.jdbc.spi.Dialect;

/**
 * Base class for dialects with the statements that are portable across databases.
 */
public abstract class AbstractDialect implements Dialect {

  @Override
  public String selectSql(String table) {
    return "SELECT kv_value FROM " + table + " WHERE kv_key=?";
  }

  @Override
  public String deleteSql(String table) {
    return "DELETE FROM " + table + " WHERE kv_key=?";
  }
}
