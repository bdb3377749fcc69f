package io.ledgerflow.retry;

import java.time.Duration;

/**
 * Blocking wait between attempts; replaced in tests to run without real delays.
 */
@FunctionalInterface
public interface Sleeper {
  Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}
