package io.ledgerflow.jdbc.store;

import javax.sql.DataSource;
import java.util.List;

/**
 * MySQL key-value store. Also compatible with TiDB.
 *
 * <p>Upserts with {@code INSERT ... ON DUPLICATE KEY UPDATE}.
 */
public final class MySqlKeyValueStore extends AbstractJdbcKeyValueStore {

  public MySqlKeyValueStore() {
    super();
  }

  public MySqlKeyValueStore(DataSource dataSource, String tableName) {
    super(dataSource, tableName);
  }

  @Override
  public AbstractJdbcKeyValueStore withDataSource(DataSource dataSource, String tableName) {
    return new MySqlKeyValueStore(dataSource, tableName);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }

  @Override
  protected String upsertSql() {
    return "INSERT INTO " + tableName() + " (kv_key, kv_value, updated_at) VALUES (?,?,?)"
        + " ON DUPLICATE KEY UPDATE kv_value=VALUES(kv_value), updated_at=VALUES(updated_at)";
  }

  @Override
  protected String createTableSql() {
    return "CREATE TABLE IF NOT EXISTS " + tableName() + " ("
        + "kv_key VARCHAR(" + MAX_KEY_LENGTH + ") NOT NULL PRIMARY KEY,"
        + "kv_value LONGTEXT NOT NULL,"
        + "updated_at TIMESTAMP(3) NOT NULL)";
  }
}
