/**
 * Dialect-specific JDBC key-value stores and their registry.
 */
package io.ledgerflow.jdbc.store;
