/**
 * Exponential-backoff retries with classified failures.
 *
 * <p>{@link io.ledgerflow.retry.RetryEngine} is the one retry loop used by the account
 * queues, and {@link io.ledgerflow.retry.ExponentialBackoffRetryPolicy} the one backoff
 * shape, shared with anchor status polling.
 *
 * @see io.ledgerflow.retry.RetryEngine
 * @see io.ledgerflow.retry.RetryOptions
 */
package io.ledgerflow.retry;
