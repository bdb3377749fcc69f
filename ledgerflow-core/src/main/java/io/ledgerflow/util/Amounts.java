package io.ledgerflow.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Decimal helpers for ledger amounts. The ledger keeps seven fractional digits.
 */
public final class Amounts {
  public static final int LEDGER_SCALE = 7;

  /** Tolerance used when comparing sums of budgets to a total. */
  public static final BigDecimal BUDGET_TOLERANCE = new BigDecimal("0.01");

  private Amounts() {
  }

  /**
   * Parses a decimal amount.
   *
   * @throws IllegalArgumentException if {@code value} is null, blank or not a number
   */
  public static BigDecimal parse(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("amount is empty");
    }
    try {
      return new BigDecimal(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("not a decimal amount: " + value, e);
    }
  }

  /** Parses, returning zero for a missing value. */
  public static BigDecimal parseOrZero(String value) {
    return value == null || value.isBlank() ? BigDecimal.ZERO : parse(value);
  }

  /** Ledger representation: at most seven fractional digits, no trailing zeros. */
  public static String toLedger(BigDecimal amount) {
    BigDecimal scaled = amount.setScale(LEDGER_SCALE, RoundingMode.DOWN).stripTrailingZeros();
    return scaled.signum() == 0 ? "0" : scaled.toPlainString();
  }

  /** Fixed-point rendering with {@code digits} fractional digits, rounding half up. */
  public static String toFixed(BigDecimal amount, int digits) {
    return amount.setScale(digits, RoundingMode.HALF_UP).toPlainString();
  }

  public static boolean isPositive(BigDecimal amount) {
    return amount != null && amount.signum() > 0;
  }

  public static boolean withinTolerance(BigDecimal a, BigDecimal b) {
    return a.subtract(b).abs().compareTo(BUDGET_TOLERANCE) <= 0;
  }
}
