package io.ledgerflow.jdbc.store;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JdbcKeyValueStoresTest {

  @Test
  void allReturnsBuiltInStores() {
    List<AbstractJdbcKeyValueStore> stores = JdbcKeyValueStores.all();

    assertTrue(stores.size() >= 3);
    assertTrue(stores.stream().anyMatch(s -> s.name().equals("mysql")));
    assertTrue(stores.stream().anyMatch(s -> s.name().equals("postgresql")));
    assertTrue(stores.stream().anyMatch(s -> s.name().equals("h2")));
  }

  @Test
  void getByNameIsCaseInsensitive() {
    assertEquals("mysql", JdbcKeyValueStores.get("MySQL").name());
    assertEquals("postgresql", JdbcKeyValueStores.get("POSTGRESQL").name());
    assertEquals("h2", JdbcKeyValueStores.get("h2").name());
  }

  @Test
  void getByNameThrowsForUnknown() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> JdbcKeyValueStores.get("oracle"));
    assertTrue(ex.getMessage().contains("Unknown key-value store"));
    assertTrue(ex.getMessage().contains("oracle"));
  }

  @Test
  void detectFromJdbcUrl() {
    assertEquals("mysql", JdbcKeyValueStores.detect("jdbc:mysql://localhost:3306/app").name());
    assertEquals("mysql", JdbcKeyValueStores.detect("jdbc:tidb://localhost:4000/app").name());
    assertEquals("postgresql", JdbcKeyValueStores.detect("jdbc:postgresql://localhost:5432/app").name());
    assertEquals("h2", JdbcKeyValueStores.detect("JDBC:H2:mem:test").name());
  }

  @Test
  void detectFromJdbcUrlThrowsForUnknown() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> JdbcKeyValueStores.detect("jdbc:oracle:thin:@localhost:1521:xe"));
    assertTrue(ex.getMessage().contains("No key-value store found"));
    assertThrows(IllegalArgumentException.class, () -> JdbcKeyValueStores.detect(""));
  }

  @Test
  void createBindsDetectedDialect() {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");

    AbstractJdbcKeyValueStore store = JdbcKeyValueStores.create(ds, "prefs");
    store.createTableIfMissing();
    store.set("theme", "dark");

    assertInstanceOf(H2KeyValueStore.class, store);
    assertEquals("dark", store.get("theme").orElseThrow());
  }

  @Test
  void templatesAreUnbound() {
    AbstractJdbcKeyValueStore template = JdbcKeyValueStores.get("h2");

    IllegalStateException ex = assertThrows(IllegalStateException.class, () -> template.get("k"));
    assertTrue(ex.getMessage().contains("not bound"));
  }

  @Test
  void invalidTableNameIsRejected() {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:unused");

    assertThrows(IllegalArgumentException.class, () -> new H2KeyValueStore(ds, "kv; DROP TABLE x"));
  }
}
