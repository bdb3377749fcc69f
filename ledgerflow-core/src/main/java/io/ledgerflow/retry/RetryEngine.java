package io.ledgerflow.retry;

import io.ledgerflow.ErrorClassifier;
import io.ledgerflow.ErrorCode;
import io.ledgerflow.LedgerException;
import io.ledgerflow.RateLimitedException;
import io.ledgerflow.spi.MetricsExporter;

import java.time.Duration;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs operations with exponential backoff.
 *
 * <p>Every failure is classified with {@link ErrorClassifier}. Non-retryable failures are
 * rethrown at once without waiting. Retryable ones are retried until
 * {@link RetryOptions#maxRetries()} attempts have been made, after which a
 * {@link RetryExhaustedException} is thrown. A {@link RateLimitedException} with a
 * retry-after hint waits for that long instead (never longer than the maximum delay).
 *
 * <p>There is no cancellation: once started, a call runs to success or exhaustion.
 * Interrupting the calling thread while it waits aborts with {@code NETWORK_ERROR}.
 * Instances are stateless and thread-safe.
 */
public final class RetryEngine {
  private static final Logger logger = Logger.getLogger(RetryEngine.class.getName());

  private final Sleeper sleeper;
  private final MetricsExporter metrics;

  public RetryEngine() {
    this(Sleeper.SYSTEM, MetricsExporter.NOOP);
  }

  public RetryEngine(Sleeper sleeper, MetricsExporter metrics) {
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  public <T> T withRetry(RetryableOperation<T> operation) {
    return withRetry(operation, RetryOptions.defaults());
  }

  /**
   * Runs {@code operation}, retrying retryable failures.
   *
   * @return the operation's result
   * @throws LedgerException           the classified failure, for non-retryable errors
   * @throws RetryExhaustedException   after {@code maxRetries} retryable failures
   */
  public <T> T withRetry(RetryableOperation<T> operation, RetryOptions options) {
    Objects.requireNonNull(operation, "operation");
    Objects.requireNonNull(options, "options");
    LedgerException last = null;
    for (int attempt = 1; attempt <= options.maxRetries(); attempt++) {
      try {
        return operation.run();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new LedgerException(ErrorCode.NETWORK_ERROR, "Interrupted during operation", e);
      } catch (Exception e) {
        LedgerException classified = ErrorClassifier.classify(e);
        if (!classified.isRetryable()) {
          throw classified;
        }
        last = classified;
        if (attempt == options.maxRetries()) {
          break;
        }
        long delayMs = delayFor(attempt, classified, options);
        logger.log(Level.WARNING, "Attempt " + attempt + "/" + options.maxRetries() + " failed with "
            + classified.code() + ", retrying in " + delayMs + "ms: " + classified.getMessage());
        metrics.incrementRetryAttempt();
        notifyListener(options.onRetry(), attempt, classified);
        pause(delayMs);
      }
    }
    throw new RetryExhaustedException(last, options.maxRetries());
  }

  private static long delayFor(int attempt, LedgerException failure, RetryOptions options) {
    long maxMs = options.maxDelay().toMillis();
    if (failure instanceof RateLimitedException rl && rl.retryAfter().isPresent()) {
      return Math.min(rl.retryAfter().get().toMillis(), maxMs);
    }
    return options.policy().computeDelayMs(attempt);
  }

  private static void notifyListener(RetryListener listener, int attempt, LedgerException failure) {
    if (listener == null) {
      return;
    }
    try {
      listener.onRetry(attempt, failure);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Retry listener failed", e);
    }
  }

  private void pause(long delayMs) {
    if (delayMs <= 0) {
      return;
    }
    try {
      sleeper.sleep(Duration.ofMillis(delayMs));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new LedgerException(ErrorCode.NETWORK_ERROR, "Interrupted while waiting to retry", e);
    }
  }
}
