package io.ledgerflow.jdbc.store;

import javax.sql.DataSource;
import java.util.List;

/**
 * PostgreSQL key-value store.
 *
 * <p>Upserts with {@code INSERT ... ON CONFLICT DO UPDATE}.
 */
public final class PostgresKeyValueStore extends AbstractJdbcKeyValueStore {

  public PostgresKeyValueStore() {
    super();
  }

  public PostgresKeyValueStore(DataSource dataSource, String tableName) {
    super(dataSource, tableName);
  }

  @Override
  public AbstractJdbcKeyValueStore withDataSource(DataSource dataSource, String tableName) {
    return new PostgresKeyValueStore(dataSource, tableName);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  protected String upsertSql() {
    return "INSERT INTO " + tableName() + " (kv_key, kv_value, updated_at) VALUES (?,?,?)"
        + " ON CONFLICT (kv_key) DO UPDATE SET kv_value=EXCLUDED.kv_value, updated_at=EXCLUDED.updated_at";
  }

  @Override
  protected String createTableSql() {
    return "CREATE TABLE IF NOT EXISTS " + tableName() + " ("
        + "kv_key VARCHAR(" + MAX_KEY_LENGTH + ") PRIMARY KEY,"
        + "kv_value TEXT NOT NULL,"
        + "updated_at TIMESTAMPTZ NOT NULL)";
  }
}
