package io.ledgerflow.testing;

import io.ledgerflow.queue.AccountQueues;
import io.ledgerflow.retry.RetryEngine;
import io.ledgerflow.retry.RetryOptions;
import io.ledgerflow.spi.LedgerClient;
import io.ledgerflow.spi.MetricsExporter;
import io.ledgerflow.submit.LedgerWriter;

import java.time.Clock;
import java.time.Duration;

/** Writers over fresh account queues that retry without sleeping. */
public final class Writers {

  private Writers() {
  }

  public static AccountQueues queues(Clock clock) {
    return new AccountQueues(new RetryEngine(d -> { }, MetricsExporter.NOOP), RetryOptions.defaults(),
        MetricsExporter.NOOP, clock, Duration.ofSeconds(1));
  }

  public static LedgerWriter writer(LedgerClient ledger, AccountQueues queues, boolean simulate) {
    return LedgerWriter.builder()
        .ledgerClient(ledger)
        .accountQueues(queues)
        .simulate(simulate)
        .submitTimeout(Duration.ofSeconds(10))
        .build();
  }
}
