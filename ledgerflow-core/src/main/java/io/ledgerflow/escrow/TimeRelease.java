package io.ledgerflow.escrow;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * One entry of a time-based release schedule.
 */
public record TimeRelease(Instant releaseAt, BigDecimal amount) {
  public TimeRelease {
    Objects.requireNonNull(releaseAt, "releaseAt");
    Objects.requireNonNull(amount, "amount");
  }
}
