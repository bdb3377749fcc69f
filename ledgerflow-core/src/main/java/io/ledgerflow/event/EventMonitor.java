package io.ledgerflow.event;

import io.ledgerflow.model.RawLedgerEvent;
import io.ledgerflow.spi.EventStream;
import io.ledgerflow.spi.LedgerClient;
import io.ledgerflow.spi.LedgerEventCallback;
import io.ledgerflow.spi.MetricsExporter;
import io.ledgerflow.util.DaemonThreadFactory;
import io.ledgerflow.util.Registration;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Manages push subscriptions to the ledger event feed.
 *
 * <p>Each subscription is an explicit state machine over {@link ConnectionStatus}. When its
 * stream fails and reconnecting is enabled, the subscription waits the configured delay and
 * opens a new stream from the last delivered cursor, against the same handler. Every failed
 * connection counts against {@code maxReconnectAttempts}; a delivered event resets the count.
 * Once attempts are exhausted the subscription ends in {@link ConnectionStatus#ERROR} and
 * delivers nothing more.
 *
 * <p>Callbacks from a stream that has been replaced or closed are ignored. A handler that
 * throws is logged; it does not affect the stream.
 */
public final class EventMonitor implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(EventMonitor.class.getName());

  private final LedgerClient ledgerClient;
  private final ContractEventParser parser;
  private final MetricsExporter metrics;
  private final ScheduledExecutorService scheduler;
  private final boolean ownsScheduler;
  private final Map<String, Subscription> subscriptions = new ConcurrentHashMap<>();
  private final List<ConnectionStatusListener> statusListeners = new CopyOnWriteArrayList<>();
  private final AtomicLong ids = new AtomicLong();
  private volatile ConnectionStatus connectionStatus = ConnectionStatus.DISCONNECTED;

  private EventMonitor(Builder builder) {
    this.ledgerClient = Objects.requireNonNull(builder.ledgerClient, "ledgerClient");
    this.parser = builder.parser != null ? builder.parser : new ContractEventParser();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.ownsScheduler = builder.scheduler == null;
    this.scheduler = ownsScheduler
        ? Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("ledgerflow-events-"))
        : builder.scheduler;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Opens a subscription. The stream is opened before this method returns; failures to open
   * are handled like stream errors.
   */
  public EventSubscription subscribe(SubscriptionConfig config, ContractEventListener handler) {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(handler, "handler");
    Subscription subscription = new Subscription("sub-" + ids.incrementAndGet(), config, handler);
    subscriptions.put(subscription.id, subscription);
    subscription.open();
    return subscription;
  }

  /**
   * Subscribes the same handler to several contracts, one independent subscription each.
   */
  public List<EventSubscription> subscribeToContracts(Collection<String> contractIds, SubscriptionConfig base,
                                                      ContractEventListener handler) {
    List<EventSubscription> result = new ArrayList<>();
    for (String contractId : contractIds) {
      result.add(subscribe(base.toBuilder().contractId(contractId).build(), handler));
    }
    return result;
  }

  public void unsubscribeAll() {
    for (Subscription subscription : List.copyOf(subscriptions.values())) {
      subscription.unsubscribe();
    }
  }

  public List<EventSubscription> activeSubscriptions() {
    return List.copyOf(subscriptions.values());
  }

  public Optional<EventSubscription> subscription(String id) {
    return Optional.ofNullable(subscriptions.get(id));
  }

  /** The most recent status transition of any subscription. */
  public ConnectionStatus connectionStatus() {
    return connectionStatus;
  }

  public Registration addStatusListener(ConnectionStatusListener listener) {
    Objects.requireNonNull(listener, "listener");
    statusListeners.add(listener);
    return () -> statusListeners.remove(listener);
  }

  @Override
  public void close() {
    unsubscribeAll();
    if (ownsScheduler) {
      scheduler.shutdownNow();
    }
  }

  private void publishStatus(String subscriptionId, ConnectionStatus status) {
    connectionStatus = status;
    for (ConnectionStatusListener listener : statusListeners) {
      try {
        listener.onStatusChange(subscriptionId, status);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Status listener failed", e);
      }
    }
  }

  private final class Subscription implements EventSubscription {
    private final String id;
    private final SubscriptionConfig config;
    private final ContractEventListener handler;

    private boolean active = true;
    private ConnectionStatus status = ConnectionStatus.DISCONNECTED;
    private String cursor;
    private int reconnectAttempts;
    private long generation;
    private EventStream stream;
    private ScheduledFuture<?> pendingReconnect;

    Subscription(String id, SubscriptionConfig config, ContractEventListener handler) {
      this.id = id;
      this.config = config;
      this.handler = handler;
      this.cursor = config.startCursor();
    }

    void open() {
      long gen;
      synchronized (this) {
        if (!active) {
          return;
        }
        pendingReconnect = null;
        gen = ++generation;
        setStatus(ConnectionStatus.CONNECTING);
      }
      EventStream opened;
      try {
        opened = ledgerClient.streamEvents(config.toFilter(), resumeCursor(), new Callback(gen));
      } catch (RuntimeException e) {
        onStreamError(gen, e);
        return;
      }
      synchronized (this) {
        if (gen != generation || !active) {
          // replaced or unsubscribed while opening
          closeQuietly(opened);
          return;
        }
        stream = opened;
        if (status == ConnectionStatus.CONNECTING) {
          setStatus(ConnectionStatus.CONNECTED);
        }
      }
    }

    private synchronized String resumeCursor() {
      return cursor;
    }

    void onRawEvent(long gen, RawLedgerEvent raw) {
      synchronized (this) {
        if (!active || gen != generation) {
          return;
        }
        if (raw.pagingToken() != null) {
          cursor = raw.pagingToken();
        }
        reconnectAttempts = 0;
        if (status != ConnectionStatus.CONNECTED) {
          setStatus(ConnectionStatus.CONNECTED);
        }
      }
      ContractEvent event = parser.parse(raw);
      if (!config.accepts(event.kind())) {
        return;
      }
      try {
        handler.onEvent(event);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Event handler failed on subscription " + id
            + " for " + event.metadata().type(), e);
      }
    }

    void onStreamError(long gen, Throwable error) {
      synchronized (this) {
        if (!active || gen != generation) {
          return;
        }
        generation++;
        closeQuietly(stream);
        stream = null;
        if (config.reconnect() && reconnectAttempts < config.maxReconnectAttempts()) {
          reconnectAttempts++;
          long delayMs = config.reconnectDelay().toMillis();
          logger.log(Level.WARNING, "Stream error on subscription " + id + ", reconnect attempt "
              + reconnectAttempts + "/" + config.maxReconnectAttempts() + " in " + delayMs + "ms: "
              + error.getMessage());
          metrics.incrementStreamReconnect();
          setStatus(ConnectionStatus.RECONNECTING);
          try {
            pendingReconnect = scheduler.schedule(this::open, delayMs, TimeUnit.MILLISECONDS);
          } catch (RejectedExecutionException e) {
            fail(e);
          }
          return;
        }
        fail(error);
      }
    }

    private void fail(Throwable error) {
      logger.log(Level.SEVERE, "Subscription " + id + " gave up after "
          + reconnectAttempts + " reconnect attempts", error);
      active = false;
      metrics.incrementStreamFailure();
      setStatus(ConnectionStatus.ERROR);
      subscriptions.remove(id, this);
    }

    @Override
    public void unsubscribe() {
      synchronized (this) {
        if (!active) {
          return;
        }
        active = false;
        generation++;
        if (pendingReconnect != null) {
          pendingReconnect.cancel(false);
          pendingReconnect = null;
        }
        closeQuietly(stream);
        stream = null;
        setStatus(ConnectionStatus.DISCONNECTED);
      }
      subscriptions.remove(id, this);
    }

    private void setStatus(ConnectionStatus next) {
      status = next;
      logger.fine(() -> "Subscription " + id + " is " + next);
      publishStatus(id, next);
    }

    private void closeQuietly(EventStream s) {
      if (s == null) {
        return;
      }
      try {
        s.close();
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Failed to close stream for subscription " + id, e);
      }
    }

    @Override
    public String id() {
      return id;
    }

    @Override
    public SubscriptionConfig config() {
      return config;
    }

    @Override
    public synchronized boolean isActive() {
      return active;
    }

    @Override
    public synchronized ConnectionStatus status() {
      return status;
    }

    @Override
    public synchronized Optional<String> cursor() {
      return Optional.ofNullable(cursor);
    }

    @Override
    public synchronized int reconnectAttempts() {
      return reconnectAttempts;
    }

    private final class Callback implements LedgerEventCallback {
      private final long gen;

      Callback(long gen) {
        this.gen = gen;
      }

      @Override
      public void onEvent(RawLedgerEvent event) {
        onRawEvent(gen, event);
      }

      @Override
      public void onError(Throwable error) {
        onStreamError(gen, error);
      }
    }
  }

  /** Builder for {@link EventMonitor}. */
  public static final class Builder {
    private LedgerClient ledgerClient;
    private ContractEventParser parser;
    private MetricsExporter metrics;
    private ScheduledExecutorService scheduler;

    private Builder() {}

    /**
     * <b>Required.</b>
     *
     * @param ledgerClient source of event streams
     * @return this builder
     */
    public Builder ledgerClient(LedgerClient ledgerClient) {
      this.ledgerClient = ledgerClient;
      return this;
    }

    /**
     * Optional. Defaults to a parser on the system clock.
     *
     * @param parser the parser
     * @return this builder
     */
    public Builder parser(ContractEventParser parser) {
      this.parser = parser;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Scheduler for delayed reconnects. A scheduler passed here is not shut down by
     * {@link EventMonitor#close()}.
     *
     * <p>Optional. Defaults to a private single daemon thread.
     *
     * @param scheduler the scheduler
     * @return this builder
     */
    public Builder scheduler(ScheduledExecutorService scheduler) {
      this.scheduler = scheduler;
      return this;
    }

    public EventMonitor build() {
      return new EventMonitor(this);
    }
  }
}
