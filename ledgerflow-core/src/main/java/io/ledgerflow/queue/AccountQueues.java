package io.ledgerflow.queue;

import io.ledgerflow.retry.RetryEngine;
import io.ledgerflow.retry.RetryOptions;
import io.ledgerflow.spi.MetricsExporter;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One {@link TransactionQueue} per source account.
 *
 * <p>Every ledger write for an account goes through that account's queue, so two writes
 * from the same account are never in flight together. Connectivity changes fan out to
 * every queue, including ones created later.
 */
public final class AccountQueues implements AutoCloseable {
  private final Map<String, TransactionQueue> queues = new ConcurrentHashMap<>();
  private final RetryEngine retryEngine;
  private final RetryOptions defaultOptions;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final Duration drainTimeout;
  private volatile boolean online = true;
  private volatile boolean closed;

  public AccountQueues(RetryEngine retryEngine, RetryOptions defaultOptions, MetricsExporter metrics,
                       Clock clock, Duration drainTimeout) {
    this.retryEngine = Objects.requireNonNull(retryEngine, "retryEngine");
    this.defaultOptions = Objects.requireNonNull(defaultOptions, "defaultOptions");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.drainTimeout = Objects.requireNonNull(drainTimeout, "drainTimeout");
  }

  /**
   * Returns the queue for {@code account}, creating it on first use.
   *
   * @throws IllegalStateException if closed
   */
  public TransactionQueue queueFor(String account) {
    Objects.requireNonNull(account, "account");
    if (closed) {
      throw new IllegalStateException("Account queues are closed");
    }
    TransactionQueue queue = queues.computeIfAbsent(account, a -> TransactionQueue.builder()
        .name(a)
        .retryEngine(retryEngine)
        .defaultOptions(defaultOptions)
        .metrics(new TotalDepthMetrics())
        .clock(clock)
        .online(online)
        .drainTimeout(drainTimeout)
        .build());
    // close() may have run between the check and the insert and missed this queue
    if (closed) {
      queues.remove(account, queue);
      queue.close();
      throw new IllegalStateException("Account queues are closed");
    }
    return queue;
  }

  public RetryOptions defaultOptions() {
    return defaultOptions;
  }

  public Collection<TransactionQueue> queues() {
    return Collections.unmodifiableCollection(queues.values());
  }

  public void setOnline(boolean online) {
    this.online = online;
    queues.values().forEach(q -> q.setOnline(online));
  }

  public boolean isOnline() {
    return online;
  }

  public int totalPending() {
    int total = 0;
    for (TransactionQueue queue : queues.values()) {
      total += queue.pendingCount();
    }
    return total;
  }

  public List<QueuedOperation> failedOperations() {
    List<QueuedOperation> failed = new ArrayList<>();
    queues.values().forEach(q -> failed.addAll(q.getFailedTransactions()));
    return failed;
  }

  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (TransactionQueue queue : queues.values()) {
      try {
        queue.close();
      } catch (RuntimeException e) {
        if (first == null) first = e;
        else first.addSuppressed(e);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Reports the pending depth across all accounts rather than per queue. */
  private final class TotalDepthMetrics implements MetricsExporter {
    @Override
    public void incrementQueueEnqueued() {
      metrics.incrementQueueEnqueued();
    }

    @Override
    public void incrementQueueCompleted() {
      metrics.incrementQueueCompleted();
    }

    @Override
    public void incrementQueueFailed() {
      metrics.incrementQueueFailed();
    }

    @Override
    public void recordPendingDepth(int depth) {
      metrics.recordPendingDepth(totalPending());
    }

    @Override
    public void incrementRetryAttempt() {
      metrics.incrementRetryAttempt();
    }
  }
}
