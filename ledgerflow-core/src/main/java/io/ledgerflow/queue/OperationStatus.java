package io.ledgerflow.queue;

/**
 * Lifecycle of a queued operation: {@code PENDING -> PROCESSING -> COMPLETED | FAILED},
 * and {@code FAILED -> PENDING} only through an explicit retry.
 */
public enum OperationStatus {
  PENDING,
  PROCESSING,
  COMPLETED,
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }
}
