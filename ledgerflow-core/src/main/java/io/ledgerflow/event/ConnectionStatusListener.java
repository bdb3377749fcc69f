package io.ledgerflow.event;

@FunctionalInterface
public interface ConnectionStatusListener {

  void onStatusChange(String subscriptionId, ConnectionStatus status);
}
