package io.ledgerflow.jdbc.store;

import javax.sql.DataSource;
import java.util.List;

/**
 * H2 key-value store. Primarily for testing.
 */
public final class H2KeyValueStore extends AbstractJdbcKeyValueStore {

  public H2KeyValueStore() {
    super();
  }

  public H2KeyValueStore(DataSource dataSource, String tableName) {
    super(dataSource, tableName);
  }

  @Override
  public AbstractJdbcKeyValueStore withDataSource(DataSource dataSource, String tableName) {
    return new H2KeyValueStore(dataSource, tableName);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  protected String upsertSql() {
    return "MERGE INTO " + tableName() + " (kv_key, kv_value, updated_at) KEY (kv_key) VALUES (?,?,?)";
  }

  @Override
  protected String createTableSql() {
    return "CREATE TABLE IF NOT EXISTS " + tableName() + " ("
        + "kv_key VARCHAR(" + MAX_KEY_LENGTH + ") PRIMARY KEY,"
        + "kv_value CLOB NOT NULL,"
        + "updated_at TIMESTAMP NOT NULL)";
  }
}
