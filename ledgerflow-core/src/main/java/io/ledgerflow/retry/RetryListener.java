package io.ledgerflow.retry;

import io.ledgerflow.LedgerException;

/**
 * Observes retries. Called after a retryable failure and before the wait.
 */
@FunctionalInterface
public interface RetryListener {

  /**
   * @param attempt the attempt that just failed (1-based)
   * @param error   the classified failure
   */
  void onRetry(int attempt, LedgerException error);
}
