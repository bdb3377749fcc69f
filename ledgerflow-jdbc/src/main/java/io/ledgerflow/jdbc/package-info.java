/**
 * JDBC persistence for the {@link io.ledgerflow.spi.KeyValueStore} SPI.
 *
 * @see io.ledgerflow.jdbc.store.JdbcKeyValueStores
 */
package io.ledgerflow.jdbc;
