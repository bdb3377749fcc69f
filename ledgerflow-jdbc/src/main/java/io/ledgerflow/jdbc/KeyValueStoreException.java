package io.ledgerflow.jdbc;

/**
 * Unchecked exception wrapping JDBC errors thrown by the key-value stores in
 * {@link io.ledgerflow.jdbc.store}.
 */
public final class KeyValueStoreException extends RuntimeException {
  public KeyValueStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
