package io.ledgerflow.anchor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Quoted conversion rate between two currencies.
 */
public record ExchangeRate(String from, String to, BigDecimal rate, BigDecimal fee, Instant timestamp) {

  /**
   * {@code amount * rate - fee}, never negative.
   */
  public BigDecimal convert(BigDecimal amount) {
    return amount.multiply(rate).subtract(fee).max(BigDecimal.ZERO);
  }
}
