package io.ledgerflow.event;

import io.ledgerflow.model.RawLedgerEvent;
import io.ledgerflow.util.Amounts;
import io.ledgerflow.util.FlatJson;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns raw feed events into {@link ContractEvent}s. A payload that is not a flat JSON
 * object, or lacks the members its topic requires, yields {@link ContractEvent.Unknown}.
 *
 * <p>Payload members per topic: {@code escrow_created} (client, provider, total_amount),
 * {@code milestone_completed} (milestone_id), {@code funds_released} (recipient, amount),
 * {@code dispute_initiated} (initiator, reason), {@code pool_funded} (total_raised),
 * {@code contribution_received} (contributor, amount).
 */
public final class ContractEventParser {
  private static final Logger logger = Logger.getLogger(ContractEventParser.class.getName());

  private final Clock clock;

  public ContractEventParser() {
    this(Clock.systemUTC());
  }

  public ContractEventParser(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public ContractEvent parse(RawLedgerEvent raw) {
    Map<String, String> payload;
    try {
      payload = FlatJson.read(raw.payload());
    } catch (IllegalArgumentException e) {
      logger.log(Level.WARNING, "Unparseable payload for " + raw.type() + " from " + raw.contractId(), e);
      payload = Map.of();
    }
    Instant timestamp = raw.timestamp() != null ? raw.timestamp() : clock.instant();
    EventMetadata metadata = new EventMetadata(raw.type(), raw.contractId(), raw.ledger(),
        raw.pagingToken(), timestamp, payload);
    return toEvent(metadata);
  }

  /**
   * Builds an event for a write this client just made, before the feed reports it.
   */
  public ContractEvent local(EventKind kind, String contractId, Map<String, String> payload) {
    if (kind == EventKind.UNKNOWN) {
      throw new IllegalArgumentException("local events need a known kind");
    }
    return toEvent(new EventMetadata(kind.topic(), contractId, 0L, null, clock.instant(), payload));
  }

  private static ContractEvent toEvent(EventMetadata m) {
    try {
      return switch (EventKind.fromTopic(m.type())) {
        case ESCROW_CREATED -> new ContractEvent.EscrowCreated(m, required(m, "client"),
            m.payload().get("provider"), amount(m, "total_amount"));
        case MILESTONE_COMPLETED -> new ContractEvent.MilestoneCompleted(m, required(m, "milestone_id"));
        case FUNDS_RELEASED -> new ContractEvent.FundsReleased(m, required(m, "recipient"), amount(m, "amount"));
        case DISPUTE_INITIATED -> new ContractEvent.DisputeInitiated(m, required(m, "initiator"),
            m.get("reason").orElse(""));
        case POOL_FUNDED -> new ContractEvent.PoolFunded(m, amount(m, "total_raised"));
        case CONTRIBUTION_RECEIVED -> new ContractEvent.ContributionReceived(m, required(m, "contributor"),
            amount(m, "amount"));
        case UNKNOWN -> new ContractEvent.Unknown(m);
      };
    } catch (IllegalArgumentException e) {
      logger.warning("Malformed " + m.type() + " event from " + m.contractId() + ": " + e.getMessage());
      return new ContractEvent.Unknown(m);
    }
  }

  private static String required(EventMetadata m, String key) {
    return m.get(key).orElseThrow(() -> new IllegalArgumentException("missing " + key));
  }

  private static BigDecimal amount(EventMetadata m, String key) {
    return Amounts.parse(required(m, key));
  }
}
