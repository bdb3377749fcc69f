package io.ledgerflow.escrow;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * A milestone as stored on the ledger. {@code completedAt} is set once, when the milestone
 * becomes completed.
 */
public record Milestone(String id, String title, String description, BigDecimal budget,
                        MilestoneStatus status, Instant completedAt) {
  public Milestone {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(title, "title");
    Objects.requireNonNull(budget, "budget");
    Objects.requireNonNull(status, "status");
  }

  public Optional<Instant> completed() {
    return Optional.ofNullable(completedAt);
  }
}
