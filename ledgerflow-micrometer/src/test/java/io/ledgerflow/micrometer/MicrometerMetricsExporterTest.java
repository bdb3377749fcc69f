package io.ledgerflow.micrometer;

import io.ledgerflow.notify.NotificationManager;
import io.ledgerflow.notify.NotificationType;
import io.ledgerflow.queue.AccountQueues;
import io.ledgerflow.retry.RetryEngine;
import io.ledgerflow.retry.RetryOptions;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void queueCounters() {
    exporter.incrementQueueEnqueued();
    exporter.incrementQueueEnqueued();
    exporter.incrementQueueCompleted();
    exporter.incrementQueueFailed();

    assertEquals(2.0, counter("ledgerflow.queue.enqueued").count());
    assertEquals(1.0, counter("ledgerflow.queue.completed").count());
    assertEquals(1.0, counter("ledgerflow.queue.failed").count());
  }

  @Test
  void retryAndStreamCounters() {
    exporter.incrementRetryAttempt();
    exporter.incrementStreamReconnect();
    exporter.incrementStreamReconnect();
    exporter.incrementStreamFailure();
    exporter.incrementNotification();

    assertEquals(1.0, counter("ledgerflow.retry.attempts").count());
    assertEquals(2.0, counter("ledgerflow.stream.reconnects").count());
    assertEquals(1.0, counter("ledgerflow.stream.failures").count());
    assertEquals(1.0, counter("ledgerflow.notifications").count());
  }

  @Test
  void recordPendingDepth() {
    exporter.recordPendingDepth(4);
    assertEquals(4.0, gauge("ledgerflow.queue.pending").value());

    exporter.recordPendingDepth(0);
    assertEquals(0.0, gauge("ledgerflow.queue.pending").value());
  }

  @Test
  void customPrefix() {
    SimpleMeterRegistry other = new SimpleMeterRegistry();
    MicrometerMetricsExporter custom = new MicrometerMetricsExporter(other, "payments.ledger");
    custom.incrementQueueEnqueued();

    assertEquals(1.0, other.find("payments.ledger.queue.enqueued").counter().count());
    assertNull(other.find("ledgerflow.queue.enqueued").counter());
  }

  @Test
  void invalidPrefixRejected() {
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "ledgerflow."));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterUpdates() {
    exporter.incrementQueueEnqueued();
    exporter.close();

    assertNull(registry.find("ledgerflow.queue.enqueued").counter());
    assertNull(registry.find("ledgerflow.queue.pending").gauge());
    exporter.incrementQueueEnqueued();
    exporter.recordPendingDepth(3);
    assertTrue(registry.getMeters().isEmpty());
  }

  @Test
  void componentsReportThroughExporter() throws Exception {
    NotificationManager notifications = new NotificationManager(10, Clock.systemUTC(), exporter);
    notifications.notify(NotificationType.INFO, "Hello", "World", Map.of());

    try (AccountQueues queues = new AccountQueues(new RetryEngine(d -> { }, exporter), RetryOptions.defaults(),
        exporter, Clock.systemUTC(), Duration.ofSeconds(1))) {
      queues.queueFor("GACCOUNT").enqueue("noop", () -> "done").get();
    }

    assertEquals(1.0, counter("ledgerflow.notifications").count());
    assertEquals(1.0, counter("ledgerflow.queue.enqueued").count());
    assertEquals(1.0, counter("ledgerflow.queue.completed").count());
    assertEquals(0.0, gauge("ledgerflow.queue.pending").value());
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "counter not found: " + name);
    return c;
  }

  private Gauge gauge(String name) {
    Gauge g = registry.find(name).gauge();
    assertNotNull(g, "gauge not found: " + name);
    return g;
  }
}
