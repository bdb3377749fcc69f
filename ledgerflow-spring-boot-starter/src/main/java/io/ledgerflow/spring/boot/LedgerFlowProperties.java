package io.ledgerflow.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for ledgerflow.
 *
 * @see LedgerFlowAutoConfiguration
 */
@ConfigurationProperties(prefix = "ledgerflow")
public class LedgerFlowProperties {

    private final Contracts contracts = new Contracts();
    private final Retry retry = new Retry();
    private final Queue queue = new Queue();
    private final Submission submission = new Submission();
    private final Events events = new Events();
    private final Balance balance = new Balance();
    private final Anchor anchor = new Anchor();
    private final History history = new History();
    private final Metrics metrics = new Metrics();

    public Contracts getContracts() {
        return contracts;
    }

    public Retry getRetry() {
        return retry;
    }

    public Queue getQueue() {
        return queue;
    }

    public Submission getSubmission() {
        return submission;
    }

    public Events getEvents() {
        return events;
    }

    public Balance getBalance() {
        return balance;
    }

    public Anchor getAnchor() {
        return anchor;
    }

    public History getHistory() {
        return history;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Contracts {
        /**
         * Contract that creates escrows.
         */
        private String escrowFactory;

        /**
         * Contract that creates crowdfunding pools.
         */
        private String poolFactory;

        /**
         * Root URL of the marketplace API brokering bids. Bids are disabled when unset.
         */
        private String backendUrl;

        public String getEscrowFactory() {
            return escrowFactory;
        }

        public void setEscrowFactory(String escrowFactory) {
            this.escrowFactory = escrowFactory;
        }

        public String getPoolFactory() {
            return poolFactory;
        }

        public void setPoolFactory(String poolFactory) {
            this.poolFactory = poolFactory;
        }

        public String getBackendUrl() {
            return backendUrl;
        }

        public void setBackendUrl(String backendUrl) {
            this.backendUrl = backendUrl;
        }
    }

    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialDelay = Duration.ofMillis(1000);
        private double multiplier = 2.0;
        private Duration maxDelay = Duration.ofMillis(30_000);
        private boolean jitter;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialDelay() {
            return initialDelay;
        }

        public void setInitialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public boolean isJitter() {
            return jitter;
        }

        public void setJitter(boolean jitter) {
            this.jitter = jitter;
        }
    }

    public static class Queue {
        /**
         * How long closing waits for queued operations to finish.
         */
        private Duration drainTimeout = Duration.ofSeconds(5);

        public Duration getDrainTimeout() {
            return drainTimeout;
        }

        public void setDrainTimeout(Duration drainTimeout) {
            this.drainTimeout = drainTimeout;
        }
    }

    public static class Submission {
        /**
         * Simulate transactions before asking the wallet to sign.
         */
        private boolean simulate = true;
        private Duration transactionExpiry = Duration.ofSeconds(180);
        private Duration creationExpiry = Duration.ofSeconds(300);
        private Duration submitTimeout = Duration.ofSeconds(120);

        public boolean isSimulate() {
            return simulate;
        }

        public void setSimulate(boolean simulate) {
            this.simulate = simulate;
        }

        public Duration getTransactionExpiry() {
            return transactionExpiry;
        }

        public void setTransactionExpiry(Duration transactionExpiry) {
            this.transactionExpiry = transactionExpiry;
        }

        public Duration getCreationExpiry() {
            return creationExpiry;
        }

        public void setCreationExpiry(Duration creationExpiry) {
            this.creationExpiry = creationExpiry;
        }

        public Duration getSubmitTimeout() {
            return submitTimeout;
        }

        public void setSubmitTimeout(Duration submitTimeout) {
            this.submitTimeout = submitTimeout;
        }
    }

    public static class Events {
        private boolean reconnect = true;
        private Duration reconnectDelay = Duration.ofMillis(5000);
        private int maxReconnectAttempts = 5;
        private int notificationCapacity = 50;

        /**
         * Contracts whose events are turned into notifications at startup.
         */
        private List<String> autoNotifyContracts = new ArrayList<>();

        public boolean isReconnect() {
            return reconnect;
        }

        public void setReconnect(boolean reconnect) {
            this.reconnect = reconnect;
        }

        public Duration getReconnectDelay() {
            return reconnectDelay;
        }

        public void setReconnectDelay(Duration reconnectDelay) {
            this.reconnectDelay = reconnectDelay;
        }

        public int getMaxReconnectAttempts() {
            return maxReconnectAttempts;
        }

        public void setMaxReconnectAttempts(int maxReconnectAttempts) {
            this.maxReconnectAttempts = maxReconnectAttempts;
        }

        public int getNotificationCapacity() {
            return notificationCapacity;
        }

        public void setNotificationCapacity(int notificationCapacity) {
            this.notificationCapacity = notificationCapacity;
        }

        public List<String> getAutoNotifyContracts() {
            return autoNotifyContracts;
        }

        public void setAutoNotifyContracts(List<String> autoNotifyContracts) {
            this.autoNotifyContracts = autoNotifyContracts;
        }
    }

    public static class Balance {
        private String assetCode = "USDC";
        private String assetIssuer;
        private BigDecimal reserve = new BigDecimal("1.0");

        public String getAssetCode() {
            return assetCode;
        }

        public void setAssetCode(String assetCode) {
            this.assetCode = assetCode;
        }

        public String getAssetIssuer() {
            return assetIssuer;
        }

        public void setAssetIssuer(String assetIssuer) {
            this.assetIssuer = assetIssuer;
        }

        public BigDecimal getReserve() {
            return reserve;
        }

        public void setReserve(BigDecimal reserve) {
            this.reserve = reserve;
        }
    }

    public static class Anchor {
        /**
         * Interactive transfer server. The anchor service is disabled when unset.
         */
        private String transferServerUrl;
        private String webAuthUrl;
        private String defaultAssetCode = "USDC";
        private Duration tokenTtl = Duration.ofHours(23);
        private Duration rateCacheTtl = Duration.ofSeconds(30);
        private Duration pollInitialDelay = Duration.ofSeconds(5);
        private double pollMultiplier = 1.5;
        private Duration pollMaxDelay = Duration.ofSeconds(15);
        private int pollMaxAttempts = 40;
        private Duration requestTimeout = Duration.ofSeconds(30);

        public String getTransferServerUrl() {
            return transferServerUrl;
        }

        public void setTransferServerUrl(String transferServerUrl) {
            this.transferServerUrl = transferServerUrl;
        }

        public String getWebAuthUrl() {
            return webAuthUrl;
        }

        public void setWebAuthUrl(String webAuthUrl) {
            this.webAuthUrl = webAuthUrl;
        }

        public String getDefaultAssetCode() {
            return defaultAssetCode;
        }

        public void setDefaultAssetCode(String defaultAssetCode) {
            this.defaultAssetCode = defaultAssetCode;
        }

        public Duration getTokenTtl() {
            return tokenTtl;
        }

        public void setTokenTtl(Duration tokenTtl) {
            this.tokenTtl = tokenTtl;
        }

        public Duration getRateCacheTtl() {
            return rateCacheTtl;
        }

        public void setRateCacheTtl(Duration rateCacheTtl) {
            this.rateCacheTtl = rateCacheTtl;
        }

        public Duration getPollInitialDelay() {
            return pollInitialDelay;
        }

        public void setPollInitialDelay(Duration pollInitialDelay) {
            this.pollInitialDelay = pollInitialDelay;
        }

        public double getPollMultiplier() {
            return pollMultiplier;
        }

        public void setPollMultiplier(double pollMultiplier) {
            this.pollMultiplier = pollMultiplier;
        }

        public Duration getPollMaxDelay() {
            return pollMaxDelay;
        }

        public void setPollMaxDelay(Duration pollMaxDelay) {
            this.pollMaxDelay = pollMaxDelay;
        }

        public int getPollMaxAttempts() {
            return pollMaxAttempts;
        }

        public void setPollMaxAttempts(int pollMaxAttempts) {
            this.pollMaxAttempts = pollMaxAttempts;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }
    }

    public static class History {
        /**
         * Table backing the JDBC key-value store.
         */
        private String tableName = "ledgerflow_kv";

        /**
         * Create the table at startup if it does not exist.
         */
        private boolean initializeSchema = true;

        public String getTableName() {
            return tableName;
        }

        public void setTableName(String tableName) {
            this.tableName = tableName;
        }

        public boolean isInitializeSchema() {
            return initializeSchema;
        }

        public void setInitializeSchema(boolean initializeSchema) {
            this.initializeSchema = initializeSchema;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "ledgerflow";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
