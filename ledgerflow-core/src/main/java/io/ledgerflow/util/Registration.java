package io.ledgerflow.util;

/**
 * Handle returned when registering a listener; {@link #remove()} detaches it.
 * Removing twice is a no-op.
 */
@FunctionalInterface
public interface Registration {
  void remove();
}
