package io.ledgerflow.event;

import java.util.Optional;

/**
 * Handle to a subscription opened by {@link EventMonitor#subscribe}.
 */
public interface EventSubscription {

  String id();

  SubscriptionConfig config();

  /**
   * Stops delivery and closes the stream. Idempotent.
   */
  void unsubscribe();

  /**
   * {@code false} after {@link #unsubscribe()} or once reconnect attempts are exhausted.
   */
  boolean isActive();

  ConnectionStatus status();

  /** Paging token of the last delivered event; a reconnect resumes after it. */
  Optional<String> cursor();

  /** Consecutive failed connections since the last delivered event. */
  int reconnectAttempts();
}
