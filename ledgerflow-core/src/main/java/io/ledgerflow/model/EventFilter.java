package io.ledgerflow.model;

import java.util.Optional;
import java.util.Set;

/**
 * Server-side filter for an event feed. A {@code null} contract id and an empty type set
 * match everything.
 */
public record EventFilter(String contractId, Set<String> eventTypes) {
  public EventFilter {
    eventTypes = eventTypes == null ? Set.of() : Set.copyOf(eventTypes);
  }

  public Optional<String> contract() {
    return Optional.ofNullable(contractId);
  }

  public boolean matches(RawLedgerEvent event) {
    return (contractId == null || contractId.equals(event.contractId()))
        && (eventTypes.isEmpty() || eventTypes.contains(event.type()));
  }
}
