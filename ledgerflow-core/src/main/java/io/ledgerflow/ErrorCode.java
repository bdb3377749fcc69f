package io.ledgerflow;

/**
 * Classified failure kinds. Each code belongs to exactly one {@link Recovery}.
 */
public enum ErrorCode {
  NETWORK_ERROR(Recovery.RETRYABLE),
  TRANSACTION_FAILED(Recovery.RETRYABLE),
  SERVICE_UNAVAILABLE(Recovery.RETRYABLE),
  RATE_LIMITED(Recovery.RETRYABLE),
  /** The source account's sequence number moved; the transaction must be rebuilt. */
  STALE_SEQUENCE(Recovery.RETRYABLE),

  USER_REJECTED(Recovery.NEEDS_USER_ACTION),
  WALLET_ERROR(Recovery.NEEDS_USER_ACTION),
  INSUFFICIENT_FUNDS(Recovery.NEEDS_USER_ACTION),
  /** The account lacks the settlement-asset trustline. */
  NEEDS_SETUP(Recovery.NEEDS_USER_ACTION),
  /** The caller stopped waiting while the write was already being submitted; check its status. */
  SUBMISSION_UNKNOWN(Recovery.NEEDS_USER_ACTION),

  INVALID_PARAMS(Recovery.FATAL),
  UNAUTHORIZED(Recovery.FATAL),
  CONFLICT(Recovery.FATAL),
  NOT_FOUND(Recovery.FATAL),
  CONTRACT_ERROR(Recovery.FATAL),
  SIGNATURE_INVALID(Recovery.FATAL),
  ANCHOR_ERROR(Recovery.FATAL);

  private final Recovery recovery;

  ErrorCode(Recovery recovery) {
    this.recovery = recovery;
  }

  public Recovery recovery() {
    return recovery;
  }

  public boolean isRetryable() {
    return recovery == Recovery.RETRYABLE;
  }
}
