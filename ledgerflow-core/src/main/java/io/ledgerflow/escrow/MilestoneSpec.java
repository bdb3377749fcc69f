package io.ledgerflow.escrow;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A milestone to create: what is delivered and what it pays.
 */
public record MilestoneSpec(String title, String description, BigDecimal budget) {
  public MilestoneSpec {
    Objects.requireNonNull(title, "title");
    Objects.requireNonNull(budget, "budget");
    description = description == null ? "" : description;
  }
}
