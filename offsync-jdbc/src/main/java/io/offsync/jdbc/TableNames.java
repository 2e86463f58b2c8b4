package io.offsync.jdbc;

import java.util.Objects;

/**
 * Table name validation for the JDBC key-value store. Names are concatenated into SQL, so
 * only plain identifiers are accepted.
 */
public final class TableNames {
  public static final String DEFAULT_TABLE = "offsync_kv";
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";
  // PostgreSQL truncates identifiers beyond 63 bytes
  private static final int MAX_LENGTH = 63;

  private TableNames() {}

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    if (tableName.length() > MAX_LENGTH) {
      throw new IllegalArgumentException("Table name longer than " + MAX_LENGTH + " characters: " + tableName);
    }
    return tableName;
  }
}
