package io.ledgerflow.event;

/**
 * Known contract event topics, plus {@link #UNKNOWN} for everything else.
 */
public enum EventKind {
  ESCROW_CREATED("escrow_created"),
  MILESTONE_COMPLETED("milestone_completed"),
  FUNDS_RELEASED("funds_released"),
  DISPUTE_INITIATED("dispute_initiated"),
  POOL_FUNDED("pool_funded"),
  CONTRIBUTION_RECEIVED("contribution_received"),
  UNKNOWN(null);

  private final String topic;

  EventKind(String topic) {
    this.topic = topic;
  }

  /** Topic string on the ledger feed; {@code null} for {@link #UNKNOWN}. */
  public String topic() {
    return topic;
  }

  public static EventKind fromTopic(String topic) {
    for (EventKind kind : values()) {
      if (kind.topic != null && kind.topic.equals(topic)) {
        return kind;
      }
    }
    return UNKNOWN;
  }
}
