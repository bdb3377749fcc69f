package io.ledgerflow.jdbc.store;

import io.ledgerflow.jdbc.KeyValueStoreException;
import io.ledgerflow.jdbc.TableNames;
import io.ledgerflow.spi.KeyValueStore;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Base JDBC key-value store. Each call borrows one connection from the
 * {@link DataSource} and runs in auto-commit mode.
 *
 * <p>Subclasses supply the dialect's upsert and DDL. Instances created by the
 * no-arg constructor are unbound templates used for detection; bind one with
 * {@link #withDataSource}. Register custom implementations via
 * {@code META-INF/services/io.ledgerflow.jdbc.store.AbstractJdbcKeyValueStore}.
 *
 * @see JdbcKeyValueStores
 */
public abstract class AbstractJdbcKeyValueStore implements KeyValueStore {
  protected static final int MAX_KEY_LENGTH = 255;

  private final DataSource dataSource;
  private final String tableName;

  protected AbstractJdbcKeyValueStore() {
    this.dataSource = null;
    this.tableName = TableNames.DEFAULT_TABLE;
  }

  protected AbstractJdbcKeyValueStore(DataSource dataSource, String tableName) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.tableName = TableNames.validate(tableName);
  }

  /**
   * Unique identifier for this store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /** Returns a store of the same dialect bound to {@code dataSource} and {@code tableName}. */
  public abstract AbstractJdbcKeyValueStore withDataSource(DataSource dataSource, String tableName);

  /** Insert-or-replace statement taking key, value and update time, in that order. */
  protected abstract String upsertSql();

  /** {@code CREATE TABLE IF NOT EXISTS} statement for this dialect. */
  protected abstract String createTableSql();

  public String tableName() {
    return tableName;
  }

  /** Creates the backing table if it does not exist yet. */
  public void createTableIfMissing() {
    update("create table " + tableName(), createTableSql());
  }

  @Override
  public Optional<String> get(String key) {
    checkKey(key);
    return execute("read " + key, conn -> {
      try (PreparedStatement ps = conn.prepareStatement(
          "SELECT kv_value FROM " + tableName() + " WHERE kv_key=?")) {
        ps.setString(1, key);
        try (ResultSet rs = ps.executeQuery()) {
          return rs.next() ? Optional.ofNullable(rs.getString("kv_value")) : Optional.empty();
        }
      }
    });
  }

  @Override
  public void set(String key, String value) {
    checkKey(key);
    Objects.requireNonNull(value, "value");
    update("write " + key, upsertSql(), key, value, Timestamp.from(Instant.now()));
  }

  @Override
  public void remove(String key) {
    checkKey(key);
    update("remove " + key, "DELETE FROM " + tableName() + " WHERE kv_key=?", key);
  }

  private static void checkKey(String key) {
    Objects.requireNonNull(key, "key");
    if (key.isEmpty() || key.length() > MAX_KEY_LENGTH) {
      throw new IllegalArgumentException("key length must be 1.." + MAX_KEY_LENGTH + ", got: " + key.length());
    }
  }

  /** Runs a statement whose parameters are strings or timestamps, bound in order. */
  private void update(String action, String sql, Object... params) {
    execute(action, conn -> {
      try (PreparedStatement ps = conn.prepareStatement(sql)) {
        for (int i = 0; i < params.length; i++) {
          ps.setObject(i + 1, params[i]);
        }
        return ps.executeUpdate();
      }
    });
  }

  private <T> T execute(String action, ConnectionCallback<T> callback) {
    if (dataSource == null) {
      throw new IllegalStateException(name() + " key-value store is not bound to a DataSource");
    }
    try (Connection conn = dataSource.getConnection()) {
      return callback.apply(conn);
    } catch (SQLException e) {
      throw new KeyValueStoreException("Failed to " + action + " in " + tableName(), e);
    }
  }

  @FunctionalInterface
  private interface ConnectionCallback<T> {
    T apply(Connection conn) throws SQLException;
  }
}
