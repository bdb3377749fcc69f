package io.ledgerflow.event;

/**
 * Receives parsed contract events, from a subscription or from a service that just
 * completed a write.
 */
@FunctionalInterface
public interface ContractEventListener {

  ContractEventListener NOOP = event -> { };

  void onEvent(ContractEvent event);
}
