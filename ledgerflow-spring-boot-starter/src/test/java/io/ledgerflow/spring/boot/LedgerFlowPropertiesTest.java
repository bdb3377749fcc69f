package io.ledgerflow.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LedgerFlowPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(LedgerFlowProperties.class);
            assertNull(props.getContracts().getEscrowFactory());
            assertNull(props.getContracts().getBackendUrl());
            assertEquals(3, props.getRetry().getMaxAttempts());
            assertEquals(Duration.ofSeconds(1), props.getRetry().getInitialDelay());
            assertEquals(2.0, props.getRetry().getMultiplier());
            assertEquals(Duration.ofSeconds(30), props.getRetry().getMaxDelay());
            assertFalse(props.getRetry().isJitter());
            assertEquals(Duration.ofSeconds(5), props.getQueue().getDrainTimeout());
            assertTrue(props.getSubmission().isSimulate());
            assertEquals(Duration.ofSeconds(180), props.getSubmission().getTransactionExpiry());
            assertEquals(Duration.ofSeconds(300), props.getSubmission().getCreationExpiry());
            assertTrue(props.getEvents().isReconnect());
            assertEquals(Duration.ofSeconds(5), props.getEvents().getReconnectDelay());
            assertEquals(5, props.getEvents().getMaxReconnectAttempts());
            assertEquals(50, props.getEvents().getNotificationCapacity());
            assertTrue(props.getEvents().getAutoNotifyContracts().isEmpty());
            assertEquals("USDC", props.getBalance().getAssetCode());
            assertEquals(0, BigDecimal.ONE.compareTo(props.getBalance().getReserve()));
            assertNull(props.getAnchor().getTransferServerUrl());
            assertEquals(Duration.ofHours(23), props.getAnchor().getTokenTtl());
            assertEquals(40, props.getAnchor().getPollMaxAttempts());
            assertEquals("ledgerflow_kv", props.getHistory().getTableName());
            assertTrue(props.getHistory().isInitializeSchema());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("ledgerflow", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "ledgerflow.contracts.escrow-factory=CESCROWFACTORY",
                "ledgerflow.contracts.backend-url=https://api.example/v1",
                "ledgerflow.retry.max-attempts=5",
                "ledgerflow.retry.initial-delay=250ms",
                "ledgerflow.retry.jitter=true",
                "ledgerflow.submission.simulate=false",
                "ledgerflow.events.auto-notify-contracts=CA,CB",
                "ledgerflow.balance.asset-code=EURC",
                "ledgerflow.balance.reserve=2.5",
                "ledgerflow.anchor.poll-max-delay=1m",
                "ledgerflow.history.table-name=wallet_kv",
                "ledgerflow.metrics.enabled=false",
                "ledgerflow.metrics.name-prefix=payments.ledger"
        ).run(ctx -> {
            var props = ctx.getBean(LedgerFlowProperties.class);
            assertEquals("CESCROWFACTORY", props.getContracts().getEscrowFactory());
            assertEquals("https://api.example/v1", props.getContracts().getBackendUrl());
            assertEquals(5, props.getRetry().getMaxAttempts());
            assertEquals(Duration.ofMillis(250), props.getRetry().getInitialDelay());
            assertTrue(props.getRetry().isJitter());
            assertFalse(props.getSubmission().isSimulate());
            assertEquals(List.of("CA", "CB"), props.getEvents().getAutoNotifyContracts());
            assertEquals("EURC", props.getBalance().getAssetCode());
            assertEquals(new BigDecimal("2.5"), props.getBalance().getReserve());
            assertEquals(Duration.ofMinutes(1), props.getAnchor().getPollMaxDelay());
            assertEquals("wallet_kv", props.getHistory().getTableName());
            assertFalse(props.getMetrics().isEnabled());
            assertEquals("payments.ledger", props.getMetrics().getNamePrefix());
        });
    }

    @Configuration
    @EnableConfigurationProperties(LedgerFlowProperties.class)
    static class PropsConfig {
    }
}
