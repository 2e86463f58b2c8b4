package io.offsync.jdbc.dialect;

import io.offsync.jdbc.ConnectionProvider;
import io.offsync.jdbc.spi.Dialect;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Registry of key-value store dialects, loaded via {@link ServiceLoader} from
 * {@code META-INF/services/io.offsync.jdbc.spi.Dialect}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * Dialect dialect = Dialects.detect(connectionProvider);
 * Dialect h2 = Dialects.get("h2");
 * }</pre>
 */
public final class Dialects {

  private static final List<Dialect> DIALECTS = ServiceLoader.load(Dialect.class)
      .stream()
      .map(ServiceLoader.Provider::get)
      .toList();

  private static final Map<String, Dialect> BY_NAME = DIALECTS.stream()
      .collect(Collectors.toUnmodifiableMap(
          d -> d.name().toLowerCase(Locale.ROOT), Function.identity(), (a, b) -> a));

  private Dialects() {
  }

  public static List<Dialect> all() {
    return DIALECTS;
  }

  /**
   * Gets a dialect by name, ignoring case.
   *
   * @throws IllegalArgumentException if no dialect has that name
   */
  public static Dialect get(String name) {
    Dialect dialect = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (dialect == null) {
      throw new IllegalArgumentException("Unknown dialect: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return dialect;
  }

  /**
   * Finds the first dialect claiming a prefix of {@code jdbcUrl}.
   */
  public static Optional<Dialect> find(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      return Optional.empty();
    }
    return DIALECTS.stream()
        .filter(d -> d.jdbcUrlPrefixes().stream().anyMatch(jdbcUrl::startsWith))
        .findFirst();
  }

  /**
   * Auto-detects the dialect from a JDBC URL.
   *
   * @throws IllegalArgumentException if the URL is empty or no dialect matches
   */
  public static Dialect detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    return find(jdbcUrl).orElseThrow(() -> new IllegalArgumentException(
        "No dialect found for JDBC URL: " + jdbcUrl + ". Supported prefixes: " + allPrefixes()));
  }

  /**
   * Auto-detects the dialect from the URL reported by a live connection.
   *
   * @throws IllegalStateException if no connection can be obtained
   */
  public static Dialect detect(ConnectionProvider connectionProvider) {
    try (Connection conn = connectionProvider.getConnection()) {
      return detect(conn.getMetaData().getURL());
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect dialect from connection metadata", e);
    }
  }

  private static List<String> allPrefixes() {
    return DIALECTS.stream()
        .flatMap(d -> d.jdbcUrlPrefixes().stream())
        .toList();
  }
}
