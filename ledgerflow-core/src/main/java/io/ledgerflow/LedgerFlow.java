package io.ledgerflow;

import io.ledgerflow.anchor.AnchorConfig;
import io.ledgerflow.anchor.AnchorService;
import io.ledgerflow.balance.BalanceValidator;
import io.ledgerflow.bid.BidProtocol;
import io.ledgerflow.crowdfunding.CrowdfundingService;
import io.ledgerflow.escrow.EscrowService;
import io.ledgerflow.event.ContractEvent;
import io.ledgerflow.event.ContractEventListener;
import io.ledgerflow.event.ContractEventParser;
import io.ledgerflow.event.EventKind;
import io.ledgerflow.event.EventMonitor;
import io.ledgerflow.event.EventPublisher;
import io.ledgerflow.event.EventSubscription;
import io.ledgerflow.event.SubscriptionConfig;
import io.ledgerflow.history.TransactionHistory;
import io.ledgerflow.notify.NotificationManager;
import io.ledgerflow.queue.AccountQueues;
import io.ledgerflow.retry.RetryEngine;
import io.ledgerflow.retry.RetryOptions;
import io.ledgerflow.retry.Sleeper;
import io.ledgerflow.spi.AnchorTransport;
import io.ledgerflow.spi.EscrowBackend;
import io.ledgerflow.spi.KeyValueStore;
import io.ledgerflow.spi.LedgerClient;
import io.ledgerflow.spi.MetricsExporter;
import io.ledgerflow.submit.LedgerWriter;
import io.ledgerflow.util.Registration;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Wires the components together and owns their lifecycle.
 *
 * <p>One instance holds the per-account queues, the event monitor, the notification log
 * and the services built on them. Closing it unsubscribes every stream, then drains the
 * queues.
 *
 * <pre>{@code
 * try (LedgerFlow flow = LedgerFlow.builder()
 *     .ledgerClient(client)
 *     .escrowFactoryContractId("C...")
 *     .poolFactoryContractId("C...")
 *     .build()) {
 *   flow.enableAutoNotifications(List.of(escrowId));
 *   String id = flow.escrow().createEscrow(params, wallet);
 * }
 * }</pre>
 */
public final class LedgerFlow implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(LedgerFlow.class.getName());

  private final LedgerClient ledgerClient;
  private final AccountQueues accountQueues;
  private final LedgerWriter writer;
  private final EventMonitor eventMonitor;
  private final NotificationManager notifications;
  private final EscrowService escrow;
  private final CrowdfundingService crowdfunding;
  private final BidProtocol bids;
  private final BalanceValidator balance;
  private final AnchorService anchor;
  private final TransactionHistory history;
  private final List<ContractEventListener> localListeners = new CopyOnWriteArrayList<>();
  private final SubscriptionConfig notificationConfig;

  private LedgerFlow(Builder builder) {
    this.ledgerClient = Objects.requireNonNull(builder.ledgerClient, "ledgerClient");
    Objects.requireNonNull(builder.escrowFactoryContractId, "escrowFactoryContractId");
    Objects.requireNonNull(builder.poolFactoryContractId, "poolFactoryContractId");
    MetricsExporter metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    Sleeper sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.SYSTEM;
    RetryOptions retryOptions = builder.retryOptions != null ? builder.retryOptions : RetryOptions.defaults();

    this.accountQueues = new AccountQueues(new RetryEngine(sleeper, metrics), retryOptions, metrics, clock,
        builder.drainTimeout);
    this.writer = LedgerWriter.builder()
        .ledgerClient(ledgerClient)
        .accountQueues(accountQueues)
        .simulate(builder.simulate)
        .defaultExpiry(builder.transactionExpiry)
        .submitTimeout(builder.submitTimeout)
        .build();
    ContractEventParser parser = new ContractEventParser(clock);
    this.eventMonitor = EventMonitor.builder()
        .ledgerClient(ledgerClient)
        .parser(parser)
        .metrics(metrics)
        .build();
    this.notifications = new NotificationManager(builder.notificationCapacity, clock, metrics);
    this.notificationConfig = builder.notificationSubscription != null
        ? builder.notificationSubscription : SubscriptionConfig.defaults();

    EventPublisher publisher = new EventPublisher(this::dispatchLocal, parser);
    this.escrow = new EscrowService(writer, builder.escrowFactoryContractId, publisher, clock,
        builder.creationExpiry);
    this.crowdfunding = new CrowdfundingService(writer, builder.poolFactoryContractId, escrow, publisher, clock,
        builder.creationExpiry);
    this.bids = builder.escrowBackend == null ? null : new BidProtocol(builder.escrowBackend, escrow, writer, clock);
    this.balance = new BalanceValidator(ledgerClient, builder.assetCode, builder.assetIssuer, builder.reserve);
    if (builder.anchorTransport != null) {
      Objects.requireNonNull(builder.anchorConfig, "anchorConfig");
      this.anchor = new AnchorService(builder.anchorTransport, builder.anchorConfig, clock, sleeper);
    } else {
      this.anchor = null;
    }
    this.history = builder.keyValueStore == null ? null : new TransactionHistory(builder.keyValueStore, clock,
        TransactionHistory.DEFAULT_CAPACITY, TransactionHistory.DEFAULT_RETENTION);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Subscribes the notification log to the known event kinds of each contract.
   */
  public List<EventSubscription> enableAutoNotifications(Collection<String> contractIds) {
    EnumSet<EventKind> kinds = EnumSet.allOf(EventKind.class);
    kinds.remove(EventKind.UNKNOWN);
    SubscriptionConfig base = notificationConfig.toBuilder().kinds(kinds).build();
    return eventMonitor.subscribeToContracts(contractIds, base, notifications.asEventListener());
  }

  /**
   * Registers a listener for events emitted locally by the services after a successful
   * write. A failing listener is logged and does not affect the write.
   */
  public Registration addLocalEventListener(ContractEventListener listener) {
    Objects.requireNonNull(listener, "listener");
    localListeners.add(listener);
    return () -> localListeners.remove(listener);
  }

  private void dispatchLocal(ContractEvent event) {
    for (ContractEventListener listener : localListeners) {
      try {
        listener.onEvent(event);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Local event listener failed for " + event.kind(), e);
      }
    }
  }

  public LedgerClient ledgerClient() {
    return ledgerClient;
  }

  public AccountQueues accountQueues() {
    return accountQueues;
  }

  public LedgerWriter writer() {
    return writer;
  }

  public EventMonitor events() {
    return eventMonitor;
  }

  public NotificationManager notifications() {
    return notifications;
  }

  public EscrowService escrow() {
    return escrow;
  }

  public CrowdfundingService crowdfunding() {
    return crowdfunding;
  }

  public BalanceValidator balance() {
    return balance;
  }

  /** Present when an escrow backend was configured. */
  public Optional<BidProtocol> bids() {
    return Optional.ofNullable(bids);
  }

  /** Present when an anchor transport was configured. */
  public Optional<AnchorService> anchor() {
    return Optional.ofNullable(anchor);
  }

  /** Present when a key-value store was configured. */
  public Optional<TransactionHistory> history() {
    return Optional.ofNullable(history);
  }

  public void setOnline(boolean online) {
    accountQueues.setOnline(online);
  }

  @Override
  public void close() {
    RuntimeException first = null;
    try {
      eventMonitor.close();
    } catch (RuntimeException e) {
      first = e;
    }
    try {
      accountQueues.close();
    } catch (RuntimeException e) {
      if (first == null) {
        first = e;
      } else {
        first.addSuppressed(e);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  public static final class Builder {
    private LedgerClient ledgerClient;
    private String escrowFactoryContractId;
    private String poolFactoryContractId;
    private EscrowBackend escrowBackend;
    private AnchorTransport anchorTransport;
    private AnchorConfig anchorConfig;
    private KeyValueStore keyValueStore;
    private MetricsExporter metrics;
    private Clock clock;
    private Sleeper sleeper;
    private RetryOptions retryOptions;
    private SubscriptionConfig notificationSubscription;
    private boolean simulate = true;
    private Duration transactionExpiry = Duration.ofSeconds(180);
    private Duration creationExpiry = Duration.ofSeconds(300);
    private Duration submitTimeout = Duration.ofSeconds(120);
    private Duration drainTimeout = Duration.ofSeconds(5);
    private int notificationCapacity = 50;
    private String assetCode = "USDC";
    private String assetIssuer;
    private BigDecimal reserve = BalanceValidator.DEFAULT_RESERVE;

    private Builder() {
    }

    /** <b>Required.</b> Ledger access. */
    public Builder ledgerClient(LedgerClient ledgerClient) {
      this.ledgerClient = ledgerClient;
      return this;
    }

    /** <b>Required.</b> Contract that creates escrows. */
    public Builder escrowFactoryContractId(String escrowFactoryContractId) {
      this.escrowFactoryContractId = escrowFactoryContractId;
      return this;
    }

    /** <b>Required.</b> Contract that creates funding pools. */
    public Builder poolFactoryContractId(String poolFactoryContractId) {
      this.poolFactoryContractId = poolFactoryContractId;
      return this;
    }

    /** Optional. Enables {@link LedgerFlow#bids()}. */
    public Builder escrowBackend(EscrowBackend escrowBackend) {
      this.escrowBackend = escrowBackend;
      return this;
    }

    /** Optional. Enables {@link LedgerFlow#anchor()}; requires an anchor config. */
    public Builder anchor(AnchorTransport transport, AnchorConfig config) {
      this.anchorTransport = transport;
      this.anchorConfig = config;
      return this;
    }

    /** Optional. Enables {@link LedgerFlow#history()}. */
    public Builder keyValueStore(KeyValueStore keyValueStore) {
      this.keyValueStore = keyValueStore;
      return this;
    }

    /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /** Optional. Defaults to the system UTC clock. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /** Optional. Defaults to {@link Sleeper#SYSTEM}. */
    public Builder sleeper(Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    /** Optional. Defaults to {@link RetryOptions#defaults()}. */
    public Builder retryOptions(RetryOptions retryOptions) {
      this.retryOptions = retryOptions;
      return this;
    }

    /** Optional. Reconnect settings for auto-notification subscriptions. */
    public Builder notificationSubscription(SubscriptionConfig notificationSubscription) {
      this.notificationSubscription = notificationSubscription;
      return this;
    }

    /** Optional. Defaults to {@code true}. */
    public Builder simulate(boolean simulate) {
      this.simulate = simulate;
      return this;
    }

    /** Optional. Defaults to 180 seconds. */
    public Builder transactionExpiry(Duration transactionExpiry) {
      this.transactionExpiry = Objects.requireNonNull(transactionExpiry, "transactionExpiry");
      return this;
    }

    /** Optional. Defaults to 300 seconds. */
    public Builder creationExpiry(Duration creationExpiry) {
      this.creationExpiry = Objects.requireNonNull(creationExpiry, "creationExpiry");
      return this;
    }

    /** Optional. Defaults to 120 seconds. */
    public Builder submitTimeout(Duration submitTimeout) {
      this.submitTimeout = Objects.requireNonNull(submitTimeout, "submitTimeout");
      return this;
    }

    /** Optional. Defaults to 5 seconds. */
    public Builder drainTimeout(Duration drainTimeout) {
      this.drainTimeout = Objects.requireNonNull(drainTimeout, "drainTimeout");
      return this;
    }

    /** Optional. Defaults to 50. */
    public Builder notificationCapacity(int notificationCapacity) {
      if (notificationCapacity < 1) {
        throw new IllegalArgumentException("notificationCapacity must be >= 1, got: " + notificationCapacity);
      }
      this.notificationCapacity = notificationCapacity;
      return this;
    }

    /** Optional. Settlement asset for balance checks; defaults to {@code USDC}, any issuer. */
    public Builder settlementAsset(String assetCode, String assetIssuer) {
      this.assetCode = Objects.requireNonNull(assetCode, "assetCode");
      this.assetIssuer = assetIssuer;
      return this;
    }

    /** Optional. Defaults to 1.0. */
    public Builder reserve(BigDecimal reserve) {
      this.reserve = Objects.requireNonNull(reserve, "reserve");
      return this;
    }

    public LedgerFlow build() {
      return new LedgerFlow(this);
    }
  }
}
