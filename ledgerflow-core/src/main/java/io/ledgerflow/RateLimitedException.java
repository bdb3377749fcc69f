package io.ledgerflow;

import java.time.Duration;
import java.util.Optional;

/**
 * The remote side asked us to slow down, optionally telling us for how long.
 *
 * <p>The retry engine waits for {@link #retryAfter()} (capped at its maximum delay)
 * instead of the computed backoff when present.
 */
public class RateLimitedException extends LedgerException {
  private final Duration retryAfter;

  public RateLimitedException(String message, Duration retryAfter) {
    super(ErrorCode.RATE_LIMITED, message);
    if (retryAfter != null && retryAfter.isNegative()) {
      throw new IllegalArgumentException("retryAfter must not be negative");
    }
    this.retryAfter = retryAfter;
  }

  public Optional<Duration> retryAfter() {
    return Optional.ofNullable(retryAfter);
  }
}
