package io.ledgerflow.spi;

/**
 * Observability hook for queue, retry, stream and notification counters.
 *
 * <p>The {@link #NOOP} instance discards everything. See the {@code ledgerflow-micrometer}
 * module for a Micrometer bridge.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * An operation was added to an account queue.
     */
    void incrementQueueEnqueued();

    /**
     * A queued operation completed successfully.
     */
    void incrementQueueCompleted();

    /**
     * A queued operation exhausted its retries or failed terminally.
     */
    void incrementQueueFailed();

    /**
     * Records the number of pending operations across account queues.
     *
     * @param depth pending operations (non-negative)
     */
    void recordPendingDepth(int depth);

    /**
     * A failed attempt is about to be retried.
     */
    void incrementRetryAttempt();

    /**
     * An event stream is being reopened after an error.
     */
    default void incrementStreamReconnect() {
    }

    /**
     * An event stream gave up after exhausting its reconnect attempts.
     */
    default void incrementStreamFailure() {
    }

    /**
     * A notification was added to the log.
     */
    default void incrementNotification() {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementQueueEnqueued() {
        }

        @Override
        public void incrementQueueCompleted() {
        }

        @Override
        public void incrementQueueFailed() {
        }

        @Override
        public void recordPendingDepth(int depth) {
        }

        @Override
        public void incrementRetryAttempt() {
        }
    }
}
