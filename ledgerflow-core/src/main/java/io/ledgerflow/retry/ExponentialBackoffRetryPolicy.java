package io.ledgerflow.retry;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff: {@code initialDelay * multiplier^(attempts-1)}, capped at
 * {@code maxDelay}. Optional jitter scales the capped delay by a random factor in
 * [0.5, 1.5), never exceeding the cap.
 *
 * <p>This is the single backoff shape used for submissions, queued operations and
 * anchor status polling.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final long initialDelayMs;
  private final double multiplier;
  private final long maxDelayMs;
  private final boolean jitter;

  /**
   * @param initialDelayMs delay after the first failure (milliseconds)
   * @param multiplier     growth factor per attempt
   * @param maxDelayMs     maximum delay cap (milliseconds)
   * @param jitter         whether to randomize delays
   */
  public ExponentialBackoffRetryPolicy(long initialDelayMs, double multiplier, long maxDelayMs, boolean jitter) {
    if (initialDelayMs < 0) {
      throw new IllegalArgumentException("initialDelayMs must be >= 0, got: " + initialDelayMs);
    }
    if (multiplier < 1.0) {
      throw new IllegalArgumentException("multiplier must be >= 1, got: " + multiplier);
    }
    if (maxDelayMs < initialDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= initialDelayMs, got: " + maxDelayMs);
    }
    this.initialDelayMs = initialDelayMs;
    this.multiplier = multiplier;
    this.maxDelayMs = maxDelayMs;
    this.jitter = jitter;
  }

  public ExponentialBackoffRetryPolicy(long initialDelayMs, double multiplier, long maxDelayMs) {
    this(initialDelayMs, multiplier, maxDelayMs, false);
  }

  @Override
  public long computeDelayMs(int attempts) {
    if (attempts <= 0) {
      return 0L;
    }
    double exp = initialDelayMs * Math.pow(multiplier, attempts - 1);
    // Math.pow overflows to Infinity, which min() caps
    long capped = (long) Math.min((double) maxDelayMs, exp);
    if (!jitter) {
      return capped;
    }
    long withJitter = (long) (capped * ThreadLocalRandom.current().nextDouble(0.5, 1.5));
    return Math.min(maxDelayMs, Math.max(0L, withJitter));
  }

  public long maxDelayMs() {
    return maxDelayMs;
  }
}
