package io.ledgerflow.spring.boot;

import io.ledgerflow.LedgerFlow;
import io.ledgerflow.balance.BalanceValidator;
import io.ledgerflow.crowdfunding.CrowdfundingService;
import io.ledgerflow.escrow.EscrowService;
import io.ledgerflow.event.EventMonitor;
import io.ledgerflow.http.HttpAnchorTransport;
import io.ledgerflow.http.HttpEscrowBackend;
import io.ledgerflow.jdbc.store.AbstractJdbcKeyValueStore;
import io.ledgerflow.jdbc.store.H2KeyValueStore;
import io.ledgerflow.notify.NotificationManager;
import io.ledgerflow.queue.AccountQueues;
import io.ledgerflow.spi.AnchorTransport;
import io.ledgerflow.spi.EscrowBackend;
import io.ledgerflow.spi.KeyValueStore;
import io.ledgerflow.submit.LedgerWriter;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;

class LedgerFlowAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(LedgerFlowAutoConfiguration.class))
      .withPropertyValues(
          "ledgerflow.contracts.escrow-factory=CESCROWFACTORY",
          "ledgerflow.contracts.pool-factory=CPOOLFACTORY");

  @Test
  void createsAllBeans() {
    runner.withUserConfiguration(LedgerClientConfig.class).run(ctx -> {
      assertTrue(ctx.containsBean("ledgerFlow"));
      LedgerFlow flow = ctx.getBean(LedgerFlow.class);
      assertSame(flow.accountQueues(), ctx.getBean(AccountQueues.class));
      assertSame(flow.writer(), ctx.getBean(LedgerWriter.class));
      assertSame(flow.events(), ctx.getBean(EventMonitor.class));
      assertSame(flow.notifications(), ctx.getBean(NotificationManager.class));
      assertSame(flow.escrow(), ctx.getBean(EscrowService.class));
      assertSame(flow.crowdfunding(), ctx.getBean(CrowdfundingService.class));
      assertSame(flow.balance(), ctx.getBean(BalanceValidator.class));
      assertTrue(ctx.containsBean("ledgerEventListenerRegistrar"));
    });
  }

  @Test
  void optionalCollaboratorsAbsentByDefault() {
    runner.withUserConfiguration(LedgerClientConfig.class).run(ctx -> {
      LedgerFlow flow = ctx.getBean(LedgerFlow.class);
      assertTrue(flow.bids().isEmpty());
      assertTrue(flow.anchor().isEmpty());
      assertTrue(flow.history().isEmpty());
      assertFalse(ctx.containsBean("keyValueStore"));
      assertFalse(ctx.containsBean("escrowBackend"));
      assertFalse(ctx.containsBean("anchorTransport"));
    });
  }

  @Test
  void backsOffWithoutLedgerClient() {
    runner.run(ctx -> {
      assertNull(ctx.getStartupFailure());
      assertFalse(ctx.containsBean("ledgerFlow"));
    });
  }

  @Test
  void failsWithoutFactoryContracts() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(LedgerFlowAutoConfiguration.class))
        .withUserConfiguration(LedgerClientConfig.class)
        .run(ctx -> {
          Throwable failure = ctx.getStartupFailure();
          assertNotNull(failure);
          Throwable root = failure;
          while (root.getCause() != null) {
            root = root.getCause();
          }
          assertInstanceOf(IllegalStateException.class, root);
          assertTrue(root.getMessage().contains("ledgerflow.contracts.escrow-factory"));
        });
  }

  @Test
  void jdbcKeyValueStoreWithDataSource() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(
            DataSourceAutoConfiguration.class,
            LedgerFlowAutoConfiguration.class))
        .withUserConfiguration(LedgerClientConfig.class)
        .withPropertyValues(
            "spring.datasource.url=jdbc:h2:mem:ledgerflow_auto_test;DB_CLOSE_DELAY=-1",
            "spring.datasource.driver-class-name=org.h2.Driver",
            "ledgerflow.contracts.escrow-factory=CESCROWFACTORY",
            "ledgerflow.contracts.pool-factory=CPOOLFACTORY",
            "ledgerflow.history.table-name=custom_kv")
        .run(ctx -> {
          AbstractJdbcKeyValueStore store = ctx.getBean(AbstractJdbcKeyValueStore.class);
          assertInstanceOf(H2KeyValueStore.class, store);
          assertEquals("custom_kv", store.tableName());

          store.set("probe", "1");
          assertEquals(Optional.of("1"), store.get("probe"));
          assertTrue(ctx.getBean(LedgerFlow.class).history().isPresent());
        });
  }

  @Test
  void userKeyValueStoreWins() {
    runner.withUserConfiguration(LedgerClientConfig.class, MapStoreConfig.class).run(ctx -> {
      assertInstanceOf(MapStore.class, ctx.getBean(KeyValueStore.class));
      assertTrue(ctx.getBean(LedgerFlow.class).history().isPresent());
    });
  }

  @Test
  void httpBackendWhenUrlSet() {
    runner.withUserConfiguration(LedgerClientConfig.class)
        .withPropertyValues("ledgerflow.contracts.backend-url=http://127.0.0.1:9/api")
        .run(ctx -> {
          assertInstanceOf(HttpEscrowBackend.class, ctx.getBean(EscrowBackend.class));
          assertTrue(ctx.getBean(LedgerFlow.class).bids().isPresent());
        });
  }

  @Test
  void anchorWhenTransferServerSet() {
    runner.withUserConfiguration(LedgerClientConfig.class)
        .withPropertyValues("ledgerflow.anchor.transfer-server-url=https://anchor.example/sep24/")
        .run(ctx -> {
          assertInstanceOf(HttpAnchorTransport.class, ctx.getBean(AnchorTransport.class));
          LedgerFlow flow = ctx.getBean(LedgerFlow.class);
          assertTrue(flow.anchor().isPresent());
          assertEquals("https://anchor.example/sep24/auth", flow.anchor().get().config().webAuthUrl());
        });
  }

  @Test
  void autoNotificationsFollowConfiguredContracts() {
    runner.withUserConfiguration(LedgerClientConfig.class)
        .withPropertyValues("ledgerflow.events.auto-notify-contracts=CESCROW1,CESCROW2")
        .run(ctx -> {
          StubLedgerClient client = ctx.getBean(StubLedgerClient.class);
          assertEquals(2, client.openStreams());

          client.emit("milestone_completed", "CESCROW1", "{\"milestone_id\":\"0\"}");
          client.emit("milestone_completed", "COTHER", "{\"milestone_id\":\"1\"}");

          NotificationManager notifications = ctx.getBean(NotificationManager.class);
          assertEquals(1, notifications.getUnreadCount());
          assertEquals("Milestone Completed", notifications.getNotifications().get(0).title());
        });
  }

  @Test
  void closingContextClosesStreams() {
    StubLedgerClient[] holder = new StubLedgerClient[1];
    runner.withUserConfiguration(LedgerClientConfig.class)
        .withPropertyValues("ledgerflow.events.auto-notify-contracts=CESCROW1")
        .run(ctx -> holder[0] = ctx.getBean(StubLedgerClient.class));
    assertEquals(0, holder[0].openStreams());
  }

  @Configuration(proxyBeanMethods = false)
  static class LedgerClientConfig {
    @Bean
    StubLedgerClient ledgerClient() {
      return new StubLedgerClient();
    }
  }

  @Configuration(proxyBeanMethods = false)
  static class MapStoreConfig {
    @Bean
    MapStore mapStore() {
      return new MapStore();
    }
  }

  static class MapStore implements KeyValueStore {
    private final Map<String, String> values = new ConcurrentHashMap<>();

    @Override
    public Optional<String> get(String key) {
      return Optional.ofNullable(values.get(key));
    }

    @Override
    public void set(String key, String value) {
      values.put(key, value);
    }

    @Override
    public void remove(String key) {
      values.remove(key);
    }
  }
}
