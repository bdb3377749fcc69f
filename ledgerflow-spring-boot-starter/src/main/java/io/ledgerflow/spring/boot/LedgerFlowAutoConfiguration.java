package io.ledgerflow.spring.boot;

import io.ledgerflow.LedgerFlow;
import io.ledgerflow.anchor.AnchorConfig;
import io.ledgerflow.balance.BalanceValidator;
import io.ledgerflow.crowdfunding.CrowdfundingService;
import io.ledgerflow.escrow.EscrowService;
import io.ledgerflow.event.EventMonitor;
import io.ledgerflow.event.SubscriptionConfig;
import io.ledgerflow.http.HttpAnchorTransport;
import io.ledgerflow.http.HttpEscrowBackend;
import io.ledgerflow.jdbc.store.AbstractJdbcKeyValueStore;
import io.ledgerflow.jdbc.store.JdbcKeyValueStores;
import io.ledgerflow.notify.NotificationManager;
import io.ledgerflow.queue.AccountQueues;
import io.ledgerflow.retry.RetryOptions;
import io.ledgerflow.spi.AnchorTransport;
import io.ledgerflow.spi.EscrowBackend;
import io.ledgerflow.spi.KeyValueStore;
import io.ledgerflow.spi.LedgerClient;
import io.ledgerflow.spi.MetricsExporter;
import io.ledgerflow.submit.LedgerWriter;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Auto-configuration for ledgerflow.
 *
 * <p>Owns one {@link LedgerFlow} per application context, built from the application's
 * {@link LedgerClient} bean and {@link LedgerFlowProperties}, and exposes its components
 * as beans. Optional collaborators are picked up when present:
 * <ul>
 *   <li>a JDBC key-value store when {@code ledgerflow-jdbc} and a {@link DataSource} are available</li>
 *   <li>the HTTP bid backend when {@code ledgerflow.contracts.backend-url} is set</li>
 *   <li>the HTTP anchor transport when {@code ledgerflow.anchor.transfer-server-url} is set</li>
 *   <li>any {@link MetricsExporter} bean</li>
 * </ul>
 *
 * @see LedgerFlowProperties
 * @see LedgerFlowMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(LedgerFlow.class)
@ConditionalOnBean(LedgerClient.class)
@EnableConfigurationProperties(LedgerFlowProperties.class)
public class LedgerFlowAutoConfiguration {

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass(JdbcKeyValueStores.class)
  @ConditionalOnBean(DataSource.class)
  static class JdbcKeyValueStoreConfiguration {

    @Bean
    @ConditionalOnMissingBean(KeyValueStore.class)
    public AbstractJdbcKeyValueStore keyValueStore(DataSource dataSource, LedgerFlowProperties props) {
      AbstractJdbcKeyValueStore store = JdbcKeyValueStores.create(dataSource, props.getHistory().getTableName());
      if (props.getHistory().isInitializeSchema()) {
        store.createTableIfMissing();
      }
      return store;
    }
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass(HttpEscrowBackend.class)
  @ConditionalOnProperty(prefix = "ledgerflow.contracts", name = "backend-url")
  static class HttpBackendConfiguration {

    @Bean
    @ConditionalOnMissingBean(EscrowBackend.class)
    public HttpEscrowBackend escrowBackend(LedgerFlowProperties props) {
      return HttpEscrowBackend.builder()
          .baseUrl(props.getContracts().getBackendUrl())
          .requestTimeout(props.getAnchor().getRequestTimeout())
          .build();
    }
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass(HttpAnchorTransport.class)
  @ConditionalOnProperty(prefix = "ledgerflow.anchor", name = "transfer-server-url")
  static class HttpAnchorConfiguration {

    @Bean
    @ConditionalOnMissingBean(AnchorTransport.class)
    public HttpAnchorTransport anchorTransport(LedgerFlowProperties props) {
      return HttpAnchorTransport.builder()
          .requestTimeout(props.getAnchor().getRequestTimeout())
          .build();
    }
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public LedgerFlow ledgerFlow(LedgerFlowProperties props,
      LedgerClient ledgerClient,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<KeyValueStore> keyValueStoreProvider,
      ObjectProvider<EscrowBackend> escrowBackendProvider,
      ObjectProvider<AnchorTransport> anchorTransportProvider) {
    LedgerFlowProperties.Contracts contracts = props.getContracts();
    if (contracts.getEscrowFactory() == null || contracts.getPoolFactory() == null) {
      throw new IllegalStateException(
          "ledgerflow.contracts.escrow-factory and ledgerflow.contracts.pool-factory must be set");
    }
    LedgerFlowProperties.Submission submission = props.getSubmission();
    LedgerFlowProperties.Balance balance = props.getBalance();

    LedgerFlow.Builder builder = LedgerFlow.builder()
        .ledgerClient(ledgerClient)
        .escrowFactoryContractId(contracts.getEscrowFactory())
        .poolFactoryContractId(contracts.getPoolFactory())
        .retryOptions(retryOptions(props.getRetry()))
        .notificationSubscription(baseSubscription(props))
        .notificationCapacity(props.getEvents().getNotificationCapacity())
        .simulate(submission.isSimulate())
        .transactionExpiry(submission.getTransactionExpiry())
        .creationExpiry(submission.getCreationExpiry())
        .submitTimeout(submission.getSubmitTimeout())
        .drainTimeout(props.getQueue().getDrainTimeout())
        .settlementAsset(balance.getAssetCode(), balance.getAssetIssuer())
        .reserve(balance.getReserve());

    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    KeyValueStore store = keyValueStoreProvider.getIfAvailable();
    if (store != null) {
      builder.keyValueStore(store);
    }
    EscrowBackend backend = escrowBackendProvider.getIfAvailable();
    if (backend != null) {
      builder.escrowBackend(backend);
    }
    AnchorTransport transport = anchorTransportProvider.getIfAvailable();
    if (transport != null) {
      builder.anchor(transport, anchorConfig(props.getAnchor()));
    }

    LedgerFlow flow = builder.build();
    if (!props.getEvents().getAutoNotifyContracts().isEmpty()) {
      flow.enableAutoNotifications(props.getEvents().getAutoNotifyContracts());
    }
    return flow;
  }

  @Bean
  @ConditionalOnMissingBean
  public AccountQueues accountQueues(LedgerFlow flow) {
    return flow.accountQueues();
  }

  @Bean
  @ConditionalOnMissingBean
  public LedgerWriter ledgerWriter(LedgerFlow flow) {
    return flow.writer();
  }

  @Bean
  @ConditionalOnMissingBean
  public EventMonitor eventMonitor(LedgerFlow flow) {
    return flow.events();
  }

  @Bean
  @ConditionalOnMissingBean
  public NotificationManager notificationManager(LedgerFlow flow) {
    return flow.notifications();
  }

  @Bean
  @ConditionalOnMissingBean
  public EscrowService escrowService(LedgerFlow flow) {
    return flow.escrow();
  }

  @Bean
  @ConditionalOnMissingBean
  public CrowdfundingService crowdfundingService(LedgerFlow flow) {
    return flow.crowdfunding();
  }

  @Bean
  @ConditionalOnMissingBean
  public BalanceValidator balanceValidator(LedgerFlow flow) {
    return flow.balance();
  }

  @Bean
  @ConditionalOnMissingBean
  public LedgerEventListenerRegistrar ledgerEventListenerRegistrar(
      ConfigurableListableBeanFactory beanFactory, LedgerFlow flow, LedgerFlowProperties props) {
    return new LedgerEventListenerRegistrar(beanFactory, flow, baseSubscription(props));
  }

  private static RetryOptions retryOptions(LedgerFlowProperties.Retry retry) {
    return RetryOptions.builder()
        .maxRetries(retry.getMaxAttempts())
        .initialDelay(retry.getInitialDelay())
        .multiplier(retry.getMultiplier())
        .maxDelay(retry.getMaxDelay())
        .jitter(retry.isJitter())
        .build();
  }

  private static SubscriptionConfig baseSubscription(LedgerFlowProperties props) {
    LedgerFlowProperties.Events events = props.getEvents();
    return SubscriptionConfig.builder()
        .reconnect(events.isReconnect())
        .reconnectDelay(events.getReconnectDelay())
        .maxReconnectAttempts(events.getMaxReconnectAttempts())
        .build();
  }

  private static AnchorConfig anchorConfig(LedgerFlowProperties.Anchor anchor) {
    String webAuthUrl = anchor.getWebAuthUrl() != null
        ? anchor.getWebAuthUrl() : stripSlash(anchor.getTransferServerUrl()) + "/auth";
    return AnchorConfig.builder()
        .transferServerUrl(anchor.getTransferServerUrl())
        .webAuthUrl(webAuthUrl)
        .defaultAssetCode(anchor.getDefaultAssetCode())
        .tokenTtl(anchor.getTokenTtl())
        .rateCacheTtl(anchor.getRateCacheTtl())
        .pollInitialDelay(anchor.getPollInitialDelay())
        .pollMultiplier(anchor.getPollMultiplier())
        .pollMaxDelay(anchor.getPollMaxDelay())
        .pollMaxAttempts(anchor.getPollMaxAttempts())
        .build();
  }

  private static String stripSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
