package io.ledgerflow.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A built, not yet signed transaction. {@code expiresAt} is absolute; the ledger refuses
 * the transaction afterwards.
 */
public record UnsignedTransaction(String envelope, String source, long sequence, Instant expiresAt) {
  public UnsignedTransaction {
    Objects.requireNonNull(envelope, "envelope");
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(expiresAt, "expiresAt");
  }
}
