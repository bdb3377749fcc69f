package io.ledgerflow.event;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Fields common to every contract event.
 *
 * @param type       topic as received
 * @param contractId emitting contract
 * @param ledger     ledger sequence (0 for events emitted locally after a submission)
 * @param cursor     paging token of the event, or {@code null} for local events
 * @param timestamp  ledger close time, or local time for local events
 * @param payload    the raw payload members
 */
public record EventMetadata(String type, String contractId, long ledger, String cursor,
                            Instant timestamp, Map<String, String> payload) {
  public EventMetadata {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(contractId, "contractId");
    Objects.requireNonNull(timestamp, "timestamp");
    payload = payload == null ? Map.of() : Map.copyOf(payload);
  }

  public Optional<String> get(String key) {
    return Optional.ofNullable(payload.get(key));
  }
}
