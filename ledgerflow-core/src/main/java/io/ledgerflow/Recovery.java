package io.ledgerflow;

/**
 * Coarse recovery path a caller should take for a failed operation.
 */
public enum Recovery {
  /** Transient failure. The same request may succeed if repeated. */
  RETRYABLE,
  /** The user has to act (approve in the wallet, top up, add a trustline) before repeating. */
  NEEDS_USER_ACTION,
  /** Repeating the same request will fail again. */
  FATAL
}
