package io.ledgerflow.model;

import java.time.Instant;
import java.util.Objects;

/**
 * An event as delivered by the ledger feed, before parsing.
 *
 * @param type        event topic, e.g. {@code milestone_completed}
 * @param contractId  emitting contract
 * @param payload     flat JSON payload
 * @param ledger      ledger sequence
 * @param pagingToken cursor to resume the feed after this event
 * @param timestamp   ledger close time
 */
public record RawLedgerEvent(String type, String contractId, String payload, long ledger,
                             String pagingToken, Instant timestamp) {
  public RawLedgerEvent {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(contractId, "contractId");
  }
}
