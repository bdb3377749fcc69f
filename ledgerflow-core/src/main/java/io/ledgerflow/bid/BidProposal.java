package io.ledgerflow.bid;

import io.ledgerflow.util.Amounts;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Content fields of a bid, before signing.
 *
 * @param timestamp creation time; filled in at signing when {@code null}
 */
public record BidProposal(String escrowId, String freelancerAddress, BigDecimal bidAmount, int deliveryDays,
                          String proposal, String portfolioLink, String milestonesApproach, Instant timestamp) {
  public BidProposal {
    Objects.requireNonNull(escrowId, "escrowId");
    Objects.requireNonNull(freelancerAddress, "freelancerAddress");
    Objects.requireNonNull(bidAmount, "bidAmount");
    Objects.requireNonNull(proposal, "proposal");
  }

  public static Builder builder() {
    return new Builder();
  }

  public Optional<String> portfolio() {
    return Optional.ofNullable(portfolioLink);
  }

  public Optional<String> approach() {
    return Optional.ofNullable(milestonesApproach);
  }

  public BidProposal withTimestamp(Instant timestamp) {
    return new BidProposal(escrowId, freelancerAddress, bidAmount, deliveryDays, proposal,
        portfolioLink, milestonesApproach, timestamp);
  }

  public Builder toBuilder() {
    return new Builder()
        .escrowId(escrowId)
        .freelancerAddress(freelancerAddress)
        .bidAmount(bidAmount)
        .deliveryDays(deliveryDays)
        .proposal(proposal)
        .portfolioLink(portfolioLink)
        .milestonesApproach(milestonesApproach)
        .timestamp(timestamp);
  }

  public static final class Builder {
    private String escrowId;
    private String freelancerAddress;
    private BigDecimal bidAmount;
    private int deliveryDays;
    private String proposal;
    private String portfolioLink;
    private String milestonesApproach;
    private Instant timestamp;

    private Builder() {}

    public Builder escrowId(String escrowId) {
      this.escrowId = escrowId;
      return this;
    }

    public Builder freelancerAddress(String freelancerAddress) {
      this.freelancerAddress = freelancerAddress;
      return this;
    }

    public Builder bidAmount(BigDecimal bidAmount) {
      this.bidAmount = bidAmount;
      return this;
    }

    public Builder bidAmount(String bidAmount) {
      return bidAmount(Amounts.parse(bidAmount));
    }

    public Builder deliveryDays(int deliveryDays) {
      this.deliveryDays = deliveryDays;
      return this;
    }

    public Builder proposal(String proposal) {
      this.proposal = proposal;
      return this;
    }

    public Builder portfolioLink(String portfolioLink) {
      this.portfolioLink = portfolioLink;
      return this;
    }

    public Builder milestonesApproach(String milestonesApproach) {
      this.milestonesApproach = milestonesApproach;
      return this;
    }

    public Builder timestamp(Instant timestamp) {
      this.timestamp = timestamp;
      return this;
    }

    public BidProposal build() {
      return new BidProposal(escrowId, freelancerAddress, bidAmount, deliveryDays, proposal,
          portfolioLink, milestonesApproach, timestamp);
    }
  }
}
