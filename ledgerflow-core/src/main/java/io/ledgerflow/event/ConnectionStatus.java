package io.ledgerflow.event;

/**
 * State of an event subscription's underlying stream.
 *
 * <pre>
 * CONNECTING -> CONNECTED -> RECONNECTING -> CONNECTING ...
 *                         \-> ERROR (attempts exhausted, terminal)
 * any -> DISCONNECTED (unsubscribed)
 * </pre>
 */
public enum ConnectionStatus {
  DISCONNECTED,
  CONNECTING,
  CONNECTED,
  RECONNECTING,
  ERROR
}
