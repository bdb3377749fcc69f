package io.ledgerflow.escrow;

import io.ledgerflow.util.Amounts;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parameters for {@link EscrowService#createEscrow}. The client is the signing account.
 *
 * <p>Setting milestones makes the escrow milestone-based, setting a schedule makes it
 * time-based. Values are checked by the service, not here.
 */
public final class CreateEscrowParams {
  private final String provider;
  private final BigDecimal totalAmount;
  private final ReleaseType releaseType;
  private final List<MilestoneSpec> milestones;
  private final List<TimeRelease> schedule;

  private CreateEscrowParams(Builder builder) {
    this.provider = builder.provider;
    this.totalAmount = builder.totalAmount;
    this.releaseType = builder.releaseType;
    this.milestones = List.copyOf(builder.milestones);
    this.schedule = List.copyOf(builder.schedule);
  }

  public static Builder builder() {
    return new Builder();
  }

  public Optional<String> provider() {
    return Optional.ofNullable(provider);
  }

  public BigDecimal totalAmount() {
    return totalAmount;
  }

  public ReleaseType releaseType() {
    return releaseType;
  }

  public List<MilestoneSpec> milestones() {
    return milestones;
  }

  public List<TimeRelease> schedule() {
    return schedule;
  }

  public static final class Builder {
    private String provider;
    private BigDecimal totalAmount;
    private ReleaseType releaseType = ReleaseType.MILESTONE_BASED;
    private final List<MilestoneSpec> milestones = new ArrayList<>();
    private final List<TimeRelease> schedule = new ArrayList<>();

    private Builder() {}

    /** Provider account; leave unset to assign it later through bid acceptance. */
    public Builder provider(String provider) {
      this.provider = provider;
      return this;
    }

    public Builder totalAmount(BigDecimal totalAmount) {
      this.totalAmount = totalAmount;
      return this;
    }

    public Builder totalAmount(String totalAmount) {
      return totalAmount(Amounts.parse(totalAmount));
    }

    public Builder milestones(List<MilestoneSpec> milestones) {
      this.releaseType = ReleaseType.MILESTONE_BASED;
      this.milestones.clear();
      this.milestones.addAll(milestones);
      return this;
    }

    public Builder addMilestone(String title, String description, BigDecimal budget) {
      this.releaseType = ReleaseType.MILESTONE_BASED;
      this.milestones.add(new MilestoneSpec(title, description, budget));
      return this;
    }

    public Builder schedule(List<TimeRelease> schedule) {
      this.releaseType = ReleaseType.TIME_BASED;
      this.schedule.clear();
      this.schedule.addAll(schedule);
      return this;
    }

    public CreateEscrowParams build() {
      return new CreateEscrowParams(this);
    }
  }
}
