package io.ledgerflow.event;

import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Publishes events for writes this client has just completed.
 *
 * <p>The write has already succeeded when this runs, so a listener failure is logged and
 * swallowed rather than reported to the caller.
 */
public final class EventPublisher {
  private static final Logger logger = Logger.getLogger(EventPublisher.class.getName());

  private final ContractEventListener listener;
  private final ContractEventParser parser;

  public EventPublisher(ContractEventListener listener, ContractEventParser parser) {
    this.listener = Objects.requireNonNull(listener, "listener");
    this.parser = Objects.requireNonNull(parser, "parser");
  }

  public static EventPublisher noop() {
    return new EventPublisher(ContractEventListener.NOOP, new ContractEventParser());
  }

  public void publish(EventKind kind, String contractId, Map<String, String> payload) {
    try {
      listener.onEvent(parser.local(kind, contractId, payload));
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to publish " + kind.topic() + " for " + contractId
          + " after a successful write", e);
    }
  }
}
