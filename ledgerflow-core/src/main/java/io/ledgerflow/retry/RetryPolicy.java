package io.ledgerflow.retry;

/**
 * Strategy for computing the wait before the next attempt of a failed operation.
 *
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

    /**
     * Computes the delay in milliseconds before the next attempt.
     *
     * @param attempts the number of failed attempts so far (1-based)
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int attempts);
}
