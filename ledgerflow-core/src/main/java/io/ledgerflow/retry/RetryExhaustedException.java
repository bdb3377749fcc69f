package io.ledgerflow.retry;

import io.ledgerflow.LedgerException;

/**
 * Every attempt failed with a retryable error. Carries the last failure (as cause and
 * code) and the number of attempts made.
 */
public class RetryExhaustedException extends LedgerException {
  private final int attempts;

  public RetryExhaustedException(LedgerException lastFailure, int attempts) {
    super(lastFailure.code(),
        "Operation failed after " + attempts + " attempts: " + lastFailure.getMessage(), lastFailure);
    this.attempts = attempts;
  }

  public int attempts() {
    return attempts;
  }

  public LedgerException lastFailure() {
    return (LedgerException) getCause();
  }
}
