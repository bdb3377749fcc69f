package io.ledgerflow.micrometer;

import io.ledgerflow.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code ledgerflow.queue.enqueued}: operations added to an account queue</li>
 *   <li>{@code ledgerflow.queue.completed}: queued operations that succeeded</li>
 *   <li>{@code ledgerflow.queue.failed}: queued operations that failed terminally</li>
 *   <li>{@code ledgerflow.retry.attempts}: failed attempts that were retried</li>
 *   <li>{@code ledgerflow.stream.reconnects}: event stream reconnects</li>
 *   <li>{@code ledgerflow.stream.failures}: event streams that gave up</li>
 *   <li>{@code ledgerflow.notifications}: notifications added to the log</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code ledgerflow.queue.pending}: pending operations across account queues</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter enqueued;
  private final Counter completed;
  private final Counter failed;
  private final Counter retryAttempts;
  private final Counter streamReconnects;
  private final Counter streamFailures;
  private final Counter notifications;
  private final Gauge pendingGauge;

  private final AtomicInteger pending = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "ledgerflow"}.
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "ledgerflow");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "payments.ledgerflow"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.enqueued = Counter.builder(namePrefix + ".queue.enqueued")
        .description("Operations added to an account queue")
        .register(registry);
    this.completed = Counter.builder(namePrefix + ".queue.completed")
        .description("Queued operations that completed successfully")
        .register(registry);
    this.failed = Counter.builder(namePrefix + ".queue.failed")
        .description("Queued operations that failed terminally")
        .register(registry);
    this.retryAttempts = Counter.builder(namePrefix + ".retry.attempts")
        .description("Failed attempts that were retried")
        .register(registry);
    this.streamReconnects = Counter.builder(namePrefix + ".stream.reconnects")
        .description("Event stream reconnects")
        .register(registry);
    this.streamFailures = Counter.builder(namePrefix + ".stream.failures")
        .description("Event streams that exhausted their reconnect attempts")
        .register(registry);
    this.notifications = Counter.builder(namePrefix + ".notifications")
        .description("Notifications added to the log")
        .register(registry);

    this.pendingGauge = Gauge.builder(namePrefix + ".queue.pending", pending, AtomicInteger::get)
        .description("Pending operations across account queues")
        .register(registry);
  }

  @Override
  public void incrementQueueEnqueued() {
    if (closed) return;
    enqueued.increment();
  }

  @Override
  public void incrementQueueCompleted() {
    if (closed) return;
    completed.increment();
  }

  @Override
  public void incrementQueueFailed() {
    if (closed) return;
    failed.increment();
  }

  @Override
  public void recordPendingDepth(int depth) {
    if (closed) return;
    pending.set(depth);
  }

  @Override
  public void incrementRetryAttempt() {
    if (closed) return;
    retryAttempts.increment();
  }

  @Override
  public void incrementStreamReconnect() {
    if (closed) return;
    streamReconnects.increment();
  }

  @Override
  public void incrementStreamFailure() {
    if (closed) return;
    streamFailures.increment();
  }

  @Override
  public void incrementNotification() {
    if (closed) return;
    notifications.increment();
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the owning {@link io.ledgerflow.LedgerFlow} is closed to prevent
   * stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(enqueued, completed, failed, retryAttempts,
        streamReconnects, streamFailures, notifications, pendingGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
