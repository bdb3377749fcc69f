package io.ledgerflow.jdbc.store;

import io.ledgerflow.jdbc.TableNames;

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
 * Registry for JDBC key-value stores with auto-detection support.
 *
 * <p>Stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/io.ledgerflow.jdbc.store.AbstractJdbcKeyValueStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Detect the dialect from the DataSource and bind to it
 * AbstractJdbcKeyValueStore store = JdbcKeyValueStores.create(dataSource);
 *
 * // Detect the dialect template from a JDBC URL
 * AbstractJdbcKeyValueStore template = JdbcKeyValueStores.detect("jdbc:mysql://localhost/mydb");
 *
 * // Get a template by name
 * AbstractJdbcKeyValueStore template = JdbcKeyValueStores.get("postgresql");
 * }</pre>
 */
public final class JdbcKeyValueStores {

  private static final List<AbstractJdbcKeyValueStore> STORES;
  private static final Map<String, AbstractJdbcKeyValueStore> BY_NAME = new ConcurrentHashMap<>();

  static {
    STORES = ServiceLoader.load(AbstractJdbcKeyValueStore.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcKeyValueStore store : STORES) {
      BY_NAME.put(store.name().toLowerCase(Locale.ROOT), store);
    }
  }

  private JdbcKeyValueStores() {
  }

  /**
   * Returns all registered store templates.
   */
  public static List<AbstractJdbcKeyValueStore> all() {
    return STORES;
  }

  /**
   * Gets a store template by name.
   *
   * @param name store name (case-insensitive)
   * @throws IllegalArgumentException if no store is registered under that name
   */
  public static AbstractJdbcKeyValueStore get(String name) {
    Objects.requireNonNull(name, "name");
    AbstractJdbcKeyValueStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (store == null) {
      throw new IllegalArgumentException("Unknown key-value store: " + name
          + ". Available: " + BY_NAME.keySet());
    }
    return store;
  }

  /**
   * Auto-detects the store template from a JDBC URL.
   *
   * @throws IllegalArgumentException if no registered store handles the URL
   */
  public static AbstractJdbcKeyValueStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    String lower = jdbcUrl.toLowerCase(Locale.ROOT);
    for (AbstractJdbcKeyValueStore store : STORES) {
      for (String prefix : store.jdbcUrlPrefixes()) {
        if (lower.startsWith(prefix.toLowerCase(Locale.ROOT))) {
          return store;
        }
      }
    }
    throw new IllegalArgumentException("No key-value store found for JDBC URL: " + jdbcUrl
        + ". Supported prefixes: " + allPrefixes());
  }

  /**
   * Auto-detects the store template from a DataSource's connection metadata.
   *
   * @throws IllegalStateException if the metadata cannot be read
   */
  public static AbstractJdbcKeyValueStore detect(DataSource dataSource) {
    Objects.requireNonNull(dataSource, "dataSource");
    try (Connection conn = dataSource.getConnection()) {
      return detect(conn.getMetaData().getURL());
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect key-value store from DataSource", e);
    }
  }

  /** Detects the dialect and binds it to {@code dataSource} using the default table. */
  public static AbstractJdbcKeyValueStore create(DataSource dataSource) {
    return create(dataSource, TableNames.DEFAULT_TABLE);
  }

  /** Detects the dialect and binds it to {@code dataSource} and {@code tableName}. */
  public static AbstractJdbcKeyValueStore create(DataSource dataSource, String tableName) {
    return detect(dataSource).withDataSource(dataSource, tableName);
  }

  private static List<String> allPrefixes() {
    return STORES.stream()
        .flatMap(s -> s.jdbcUrlPrefixes().stream())
        .toList();
  }
}
