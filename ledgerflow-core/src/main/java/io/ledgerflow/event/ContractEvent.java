package io.ledgerflow.event;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A parsed contract event. Each known topic has its own variant; anything else arrives
 * as {@link Unknown} with the raw payload in its metadata.
 *
 * @see ContractEventParser
 */
public sealed interface ContractEvent {

  EventMetadata metadata();

  EventKind kind();

  default String contractId() {
    return metadata().contractId();
  }

  record EscrowCreated(EventMetadata metadata, String client, String provider, BigDecimal totalAmount)
      implements ContractEvent {
    public EscrowCreated {
      Objects.requireNonNull(metadata, "metadata");
      Objects.requireNonNull(client, "client");
      Objects.requireNonNull(totalAmount, "totalAmount");
    }

    @Override
    public EventKind kind() {
      return EventKind.ESCROW_CREATED;
    }
  }

  record MilestoneCompleted(EventMetadata metadata, String milestoneId) implements ContractEvent {
    public MilestoneCompleted {
      Objects.requireNonNull(metadata, "metadata");
      Objects.requireNonNull(milestoneId, "milestoneId");
    }

    @Override
    public EventKind kind() {
      return EventKind.MILESTONE_COMPLETED;
    }
  }

  record FundsReleased(EventMetadata metadata, String recipient, BigDecimal amount) implements ContractEvent {
    public FundsReleased {
      Objects.requireNonNull(metadata, "metadata");
      Objects.requireNonNull(recipient, "recipient");
      Objects.requireNonNull(amount, "amount");
    }

    @Override
    public EventKind kind() {
      return EventKind.FUNDS_RELEASED;
    }
  }

  record DisputeInitiated(EventMetadata metadata, String initiator, String reason) implements ContractEvent {
    public DisputeInitiated {
      Objects.requireNonNull(metadata, "metadata");
      Objects.requireNonNull(initiator, "initiator");
      Objects.requireNonNull(reason, "reason");
    }

    @Override
    public EventKind kind() {
      return EventKind.DISPUTE_INITIATED;
    }
  }

  record PoolFunded(EventMetadata metadata, BigDecimal totalRaised) implements ContractEvent {
    public PoolFunded {
      Objects.requireNonNull(metadata, "metadata");
      Objects.requireNonNull(totalRaised, "totalRaised");
    }

    @Override
    public EventKind kind() {
      return EventKind.POOL_FUNDED;
    }
  }

  record ContributionReceived(EventMetadata metadata, String contributor, BigDecimal amount)
      implements ContractEvent {
    public ContributionReceived {
      Objects.requireNonNull(metadata, "metadata");
      Objects.requireNonNull(contributor, "contributor");
      Objects.requireNonNull(amount, "amount");
    }

    @Override
    public EventKind kind() {
      return EventKind.CONTRIBUTION_RECEIVED;
    }
  }

  record Unknown(EventMetadata metadata) implements ContractEvent {
    public Unknown {
      Objects.requireNonNull(metadata, "metadata");
    }

    @Override
    public EventKind kind() {
      return EventKind.UNKNOWN;
    }
  }
}
