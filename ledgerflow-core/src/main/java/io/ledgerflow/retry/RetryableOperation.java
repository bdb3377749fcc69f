package io.ledgerflow.retry;

/**
 * A fallible unit of work that may be attempted more than once.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface RetryableOperation<T> {
  T run() throws Exception;
}
