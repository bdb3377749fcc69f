package io.ledgerflow.crowdfunding;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Funding pool state as read from the ledger.
 *
 * @param contributors contribution per address, in ledger order
 * @param escrowContract linked escrow, set after a funded pool is finalized
 */
public record PoolInfo(String poolId, String projectOwner, String description, BigDecimal fundingGoal,
                       Instant deadline, BigDecimal totalRaised, PoolStatus status,
                       Map<String, BigDecimal> contributors, String escrowContract) {
  public PoolInfo {
    Objects.requireNonNull(poolId, "poolId");
    Objects.requireNonNull(projectOwner, "projectOwner");
    Objects.requireNonNull(fundingGoal, "fundingGoal");
    Objects.requireNonNull(deadline, "deadline");
    Objects.requireNonNull(totalRaised, "totalRaised");
    Objects.requireNonNull(status, "status");
    contributors = Collections.unmodifiableMap(new LinkedHashMap<>(contributors));
    description = description == null ? "" : description;
  }

  public boolean isGoalReached() {
    return totalRaised.compareTo(fundingGoal) >= 0;
  }

  public boolean isDeadlinePassed(Instant now) {
    return !now.isBefore(deadline);
  }

  /** Finalizing is allowed once the goal is reached or the deadline has passed. */
  public boolean canFinalize(Instant now) {
    return status == PoolStatus.FUNDING && (isGoalReached() || isDeadlinePassed(now));
  }

  public BigDecimal contributionOf(String address) {
    return contributors.getOrDefault(address, BigDecimal.ZERO);
  }

  public Optional<String> linkedEscrow() {
    return Optional.ofNullable(escrowContract);
  }
}
