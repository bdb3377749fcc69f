package io.ledgerflow.util;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class AmountsTest {

  @Test
  void ledgerFormTruncatesToSevenDigits() {
    assertEquals("1.2345678", Amounts.toLedger(new BigDecimal("1.23456789")));
    assertEquals("1500", Amounts.toLedger(new BigDecimal("1500.000")));
    assertEquals("0", Amounts.toLedger(new BigDecimal("0.00000001")));
  }

  @Test
  void fixedFormRoundsHalfUp() {
    assertEquals("0.50", Amounts.toFixed(new BigDecimal("0.5"), 2));
    assertEquals("2.35", Amounts.toFixed(new BigDecimal("2.345"), 2));
  }

  @Test
  void parsing() {
    assertEquals(0, Amounts.parse(" 42.10 ").compareTo(new BigDecimal("42.1")));
    assertEquals(BigDecimal.ZERO, Amounts.parseOrZero(null));
    assertThrows(IllegalArgumentException.class, () -> Amounts.parse("ten"));
    assertThrows(IllegalArgumentException.class, () -> Amounts.parse(""));
  }

  @Test
  void budgetToleranceIsOneCent() {
    assertTrue(Amounts.withinTolerance(new BigDecimal("100.01"), new BigDecimal("100")));
    assertFalse(Amounts.withinTolerance(new BigDecimal("100.02"), new BigDecimal("100")));
    assertFalse(Amounts.isPositive(BigDecimal.ZERO));
    assertFalse(Amounts.isPositive(null));
  }
}
