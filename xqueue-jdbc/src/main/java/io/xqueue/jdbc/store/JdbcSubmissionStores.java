package io.xqueue.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of JDBC submission stores, loaded via {@link ServiceLoader} from
 * {@code META-INF/services/io.xqueue.jdbc.store.AbstractJdbcSubmissionStore}.
 *
 * <pre>{@code
 * AbstractJdbcSubmissionStore store = JdbcSubmissionStores.detect(dataSource);
 * AbstractJdbcSubmissionStore custom = JdbcSubmissionStores.detect(dataSource, "grading_queue");
 * AbstractJdbcSubmissionStore pg = JdbcSubmissionStores.get("postgresql");
 * }</pre>
 */
public final class JdbcSubmissionStores {

  private static final List<AbstractJdbcSubmissionStore> STORES;
  private static final Map<String, AbstractJdbcSubmissionStore> BY_NAME = new ConcurrentHashMap<>();

  static {
    STORES = ServiceLoader.load(AbstractJdbcSubmissionStore.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();
    for (AbstractJdbcSubmissionStore store : STORES) {
      BY_NAME.put(store.name().toLowerCase(Locale.ROOT), store);
    }
  }

  private JdbcSubmissionStores() {
  }

  /**
   * Returns all registered stores, bound to the default table.
   */
  public static List<AbstractJdbcSubmissionStore> all() {
    return STORES;
  }

  /**
   * Gets a store by name.
   *
   * @param name store name (case-insensitive)
   * @return the store
   * @throws IllegalArgumentException if no store is registered under that name
   */
  public static AbstractJdbcSubmissionStore get(String name) {
    Objects.requireNonNull(name, "name");
    AbstractJdbcSubmissionStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (store == null) {
      throw new IllegalArgumentException("Unknown submission store: " + name
          + ". Available: " + BY_NAME.keySet());
    }
    return store;
  }

  /**
   * Detects the store matching the database behind {@code dataSource}.
   *
   * @throws IllegalStateException if the connection metadata cannot be read
   * @throws IllegalArgumentException if no store handles the database
   */
  public static AbstractJdbcSubmissionStore detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      return detect(conn.getMetaData().getURL());
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect submission store from DataSource", e);
    }
  }

  /**
   * Like {@link #detect(DataSource)}, bound to {@code tableName}.
   */
  public static AbstractJdbcSubmissionStore detect(DataSource dataSource, String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    return detect(dataSource).withTableName(tableName);
  }

  /**
   * Detects the store handling {@code jdbcUrl} by prefix.
   *
   * @param jdbcUrl the JDBC URL
   * @return the matching store
   * @throws IllegalArgumentException if the URL is empty or no store matches
   */
  public static AbstractJdbcSubmissionStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    String lower = jdbcUrl.toLowerCase(Locale.ROOT);
    for (AbstractJdbcSubmissionStore store : STORES) {
      for (String prefix : store.jdbcUrlPrefixes()) {
        if (lower.startsWith(prefix.toLowerCase(Locale.ROOT))) {
          return store;
        }
      }
    }
    throw new IllegalArgumentException("No submission store found for JDBC URL: " + jdbcUrl
        + ". Supported prefixes: " + allPrefixes());
  }

  private static List<String> allPrefixes() {
    return STORES.stream()
        .flatMap(s -> s.jdbcUrlPrefixes().stream())
        .toList();
  }
}
