package io.ledgerflow.escrow;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Escrow state as read from the ledger. Milestone-based escrows carry milestones,
 * time-based ones a schedule; the other list is empty.
 */
public record EscrowStatus(String contractId, EscrowState state, String client, String provider,
                           BigDecimal totalAmount, BigDecimal releasedAmount, ReleaseType releaseType,
                           List<Milestone> milestones, List<TimeRelease> schedule) {
  public EscrowStatus {
    Objects.requireNonNull(contractId, "contractId");
    Objects.requireNonNull(state, "state");
    Objects.requireNonNull(client, "client");
    Objects.requireNonNull(totalAmount, "totalAmount");
    Objects.requireNonNull(releasedAmount, "releasedAmount");
    Objects.requireNonNull(releaseType, "releaseType");
    milestones = List.copyOf(milestones);
    schedule = List.copyOf(schedule);
  }

  /** The provider, absent until a bid is accepted. */
  public Optional<String> providerAddress() {
    return Optional.ofNullable(provider);
  }

  public BigDecimal remainingAmount() {
    return totalAmount.subtract(releasedAmount);
  }
}
