package io.ledgerflow.queue;

import io.ledgerflow.ErrorClassifier;
import io.ledgerflow.ErrorCode;
import io.ledgerflow.LedgerException;
import io.ledgerflow.retry.RetryEngine;
import io.ledgerflow.retry.RetryOptions;
import io.ledgerflow.retry.RetryableOperation;
import io.ledgerflow.spi.MetricsExporter;
import io.ledgerflow.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Sequential, online/offline-aware queue of named operations.
 *
 * <p>One worker thread drains pending operations in enqueue order, running each through
 * the {@link RetryEngine}. At most one entry is {@link OperationStatus#PROCESSING} at any
 * time, which keeps ledger writes from one source account ordered on its sequence number.
 *
 * <p>Going offline stops the worker from taking the next entry; the entry already running
 * is not cancelled. Going online resumes draining.
 *
 * <p>Create instances via {@link #builder()}. Thread-safe; {@link #close()} drains
 * outstanding work within the drain timeout and cancels whatever is left.
 */
public final class TransactionQueue implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(TransactionQueue.class.getName());

  private final String name;
  private final RetryEngine retryEngine;
  private final RetryOptions defaultOptions;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final long drainTimeoutMs;
  private final ExecutorService worker;

  private final Object lock = new Object();
  private final Map<String, QueueEntry> entries = new LinkedHashMap<>();
  private final AtomicBoolean draining = new AtomicBoolean(false);
  private volatile boolean online;
  private volatile boolean closed;

  private TransactionQueue(Builder builder) {
    this.name = Objects.requireNonNull(builder.name, "name");
    this.retryEngine = builder.retryEngine != null ? builder.retryEngine : new RetryEngine();
    this.defaultOptions = builder.defaultOptions != null ? builder.defaultOptions : RetryOptions.defaults();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    if (builder.drainTimeout.isNegative()) {
      throw new IllegalArgumentException("drainTimeout must not be negative");
    }
    this.drainTimeoutMs = builder.drainTimeout.toMillis();
    this.online = builder.online;
    this.worker = Executors.newSingleThreadExecutor(new DaemonThreadFactory("ledgerflow-queue-" + name + "-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  public String name() {
    return name;
  }

  public <T> CompletableFuture<T> enqueue(String id, RetryableOperation<T> operation) {
    return enqueue(id, operation, defaultOptions);
  }

  /**
   * Adds an operation and starts processing if the queue is online.
   *
   * <p>An id may be reused once its previous entry has completed or failed; the old entry
   * is replaced.
   *
   * @return a future completed with the result, or exceptionally with the classified
   *     {@link LedgerException} once retries are exhausted
   * @throws IllegalArgumentException if an entry with this id is pending or processing
   * @throws IllegalStateException    if the queue is closed
   */
  @SuppressWarnings("unchecked")
  public <T> CompletableFuture<T> enqueue(String id, RetryableOperation<T> operation, RetryOptions options) {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(operation, "operation");
    Objects.requireNonNull(options, "options");
    QueueEntry entry;
    synchronized (lock) {
      if (closed) {
        throw new IllegalStateException("Queue " + name + " is closed");
      }
      QueueEntry existing = entries.get(id);
      if (existing != null && !existing.status.isTerminal()) {
        throw new IllegalArgumentException("Operation already queued: " + id);
      }
      entries.remove(id);
      entry = new QueueEntry(id, operation, options, clock.instant());
      entries.put(id, entry);
    }
    metrics.incrementQueueEnqueued();
    metrics.recordPendingDepth(pendingCount());
    logger.fine(() -> "Enqueued " + id + " on " + name);
    triggerProcessing();
    return (CompletableFuture<T>) (CompletableFuture<?>) entry.future;
  }

  /**
   * Resets a failed operation to pending and re-triggers processing.
   *
   * @return the new result future, or empty if there is no failed entry with this id
   */
  public Optional<CompletableFuture<Object>> retry(String id) {
    CompletableFuture<Object> future;
    synchronized (lock) {
      QueueEntry entry = entries.get(id);
      if (entry == null || entry.status != OperationStatus.FAILED) {
        return Optional.empty();
      }
      future = reset(entry);
    }
    metrics.recordPendingDepth(pendingCount());
    triggerProcessing();
    return Optional.of(future);
  }

  /**
   * Resets every failed operation to pending.
   *
   * @return the number of operations reset
   */
  public int retryAll() {
    int count = 0;
    synchronized (lock) {
      for (QueueEntry entry : entries.values()) {
        if (entry.status == OperationStatus.FAILED) {
          reset(entry);
          count++;
        }
      }
    }
    if (count > 0) {
      metrics.recordPendingDepth(pendingCount());
      triggerProcessing();
    }
    return count;
  }

  private static CompletableFuture<Object> reset(QueueEntry entry) {
    entry.status = OperationStatus.PENDING;
    entry.error = null;
    entry.future = new CompletableFuture<>();
    return entry.future;
  }

  /**
   * Removes an entry that is not currently processing. A pending entry's future is cancelled.
   *
   * @return {@code true} if the entry was removed
   */
  public boolean dequeue(String id) {
    QueueEntry removed;
    synchronized (lock) {
      QueueEntry entry = entries.get(id);
      if (entry == null || entry.status == OperationStatus.PROCESSING) {
        return false;
      }
      removed = entries.remove(id);
    }
    removed.future.cancel(false);
    metrics.recordPendingDepth(pendingCount());
    return true;
  }

  /**
   * Removes an entry only while it is still pending, so its operation never starts.
   * A processing or finished entry is left alone.
   *
   * @return {@code true} if the entry was pending and has been removed
   */
  public boolean cancelPending(String id) {
    QueueEntry removed;
    synchronized (lock) {
      QueueEntry entry = entries.get(id);
      if (entry == null || entry.status != OperationStatus.PENDING) {
        return false;
      }
      removed = entries.remove(id);
    }
    removed.future.cancel(false);
    metrics.recordPendingDepth(pendingCount());
    logger.fine(() -> "Withdrew pending operation " + id + " from " + name);
    return true;
  }

  /** Removes completed entries. */
  public int clearCompleted() {
    synchronized (lock) {
      int before = entries.size();
      entries.values().removeIf(e -> e.status == OperationStatus.COMPLETED);
      return before - entries.size();
    }
  }

  /** Removes every entry except the one processing; pending futures are cancelled. */
  public void clearAll() {
    List<QueueEntry> removed = new ArrayList<>();
    synchronized (lock) {
      Iterator<QueueEntry> it = entries.values().iterator();
      while (it.hasNext()) {
        QueueEntry entry = it.next();
        if (entry.status != OperationStatus.PROCESSING) {
          removed.add(entry);
          it.remove();
        }
      }
    }
    removed.forEach(e -> e.future.cancel(false));
    metrics.recordPendingDepth(pendingCount());
  }

  public Optional<QueuedOperation> get(String id) {
    synchronized (lock) {
      QueueEntry entry = entries.get(id);
      return entry == null ? Optional.empty() : Optional.of(entry.snapshot());
    }
  }

  /** All entries in enqueue order. */
  public List<QueuedOperation> getAll() {
    return snapshot(null);
  }

  public List<QueuedOperation> getPendingTransactions() {
    return snapshot(OperationStatus.PENDING);
  }

  public List<QueuedOperation> getFailedTransactions() {
    return snapshot(OperationStatus.FAILED);
  }

  private List<QueuedOperation> snapshot(OperationStatus filter) {
    synchronized (lock) {
      List<QueuedOperation> result = new ArrayList<>();
      for (QueueEntry entry : entries.values()) {
        if (filter == null || entry.status == filter) {
          result.add(entry.snapshot());
        }
      }
      return result;
    }
  }

  public int pendingCount() {
    synchronized (lock) {
      int count = 0;
      for (QueueEntry entry : entries.values()) {
        if (entry.status == OperationStatus.PENDING) count++;
      }
      return count;
    }
  }

  public boolean isProcessing() {
    synchronized (lock) {
      return entries.values().stream().anyMatch(e -> e.status == OperationStatus.PROCESSING);
    }
  }

  public boolean isOnline() {
    return online;
  }

  /**
   * Switches between online and offline. Going online resumes draining.
   */
  public void setOnline(boolean online) {
    this.online = online;
    logger.fine(() -> "Queue " + name + " is now " + (online ? "online" : "offline"));
    if (online) {
      triggerProcessing();
    }
  }

  private void triggerProcessing() {
    if (!online || closed) {
      return;
    }
    if (draining.compareAndSet(false, true)) {
      try {
        worker.execute(this::drain);
      } catch (RejectedExecutionException e) {
        draining.set(false);
        logger.fine(() -> "Queue " + name + " closed before processing could start");
      }
    }
  }

  private void drain() {
    try {
      while (online) {
        QueueEntry next = null;
        synchronized (lock) {
          for (QueueEntry entry : entries.values()) {
            if (entry.status == OperationStatus.PENDING) {
              next = entry;
              break;
            }
          }
          if (next == null) {
            break;
          }
          next.status = OperationStatus.PROCESSING;
        }
        process(next);
      }
    } finally {
      draining.set(false);
      // an enqueue may have seen draining=true after our last scan
      if (online && !closed && pendingCount() > 0) {
        triggerProcessing();
      }
    }
  }

  private void process(QueueEntry entry) {
    RetryableOperation<Object> counted = () -> {
      synchronized (lock) {
        entry.attempts++;
        entry.lastAttemptAt = clock.instant();
      }
      return entry.operation.run();
    };
    CompletableFuture<Object> future;
    try {
      Object result = retryEngine.withRetry(counted, entry.options);
      synchronized (lock) {
        entry.status = OperationStatus.COMPLETED;
        entry.result = result;
        future = entry.future;
      }
      metrics.incrementQueueCompleted();
      future.complete(result);
    } catch (RuntimeException e) {
      fail(entry, ErrorClassifier.classify(e));
    } catch (Error e) {
      // the operation may have reached the ledger before it broke, so its outcome is unknown
      fail(entry, new LedgerException(ErrorCode.SUBMISSION_UNKNOWN,
          "Queued operation " + entry.id + " aborted: " + e, e));
      throw e;
    } finally {
      metrics.recordPendingDepth(pendingCount());
    }
  }

  private void fail(QueueEntry entry, LedgerException failure) {
    int attempts;
    CompletableFuture<Object> future;
    synchronized (lock) {
      entry.status = OperationStatus.FAILED;
      entry.error = failure;
      attempts = entry.attempts;
      future = entry.future;
    }
    logger.log(Level.SEVERE, "Queued operation " + entry.id + " on " + name
        + " failed after " + attempts + " attempts", failure);
    metrics.incrementQueueFailed();
    future.completeExceptionally(failure);
  }

  /**
   * Stops accepting operations, lets the worker drain pending ones within the drain
   * timeout, then cancels whatever is still pending.
   */
  @Override
  public void close() {
    synchronized (lock) {
      if (closed) {
        return;
      }
      closed = true;
    }
    worker.shutdown();
    try {
      if (!worker.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded for queue " + name
            + "; pending: " + pendingCount());
        worker.shutdownNow();
      }
    } catch (InterruptedException e) {
      worker.shutdownNow();
      Thread.currentThread().interrupt();
    }
    List<CompletableFuture<Object>> abandoned = new ArrayList<>();
    synchronized (lock) {
      for (QueueEntry entry : entries.values()) {
        if (entry.status == OperationStatus.PENDING) {
          abandoned.add(entry.future);
        }
      }
    }
    abandoned.forEach(f -> f.cancel(false));
  }

  /** Builder for {@link TransactionQueue}. */
  public static final class Builder {
    private String name;
    private RetryEngine retryEngine;
    private RetryOptions defaultOptions;
    private MetricsExporter metrics;
    private Clock clock;
    private boolean online = true;
    private Duration drainTimeout = Duration.ofSeconds(5);

    private Builder() {}

    /**
     * Queue name, usually the source account address. Used in thread names and logs.
     *
     * <p><b>Required.</b>
     *
     * @param name the queue name
     * @return this builder
     */
    public Builder name(String name) {
      this.name = name;
      return this;
    }

    /**
     * Retry engine that runs each operation.
     *
     * <p>Optional. Defaults to a {@link RetryEngine} with real sleeps and no metrics.
     *
     * @param retryEngine the engine
     * @return this builder
     */
    public Builder retryEngine(RetryEngine retryEngine) {
      this.retryEngine = retryEngine;
      return this;
    }

    /**
     * Retry options for {@link #enqueue(String, RetryableOperation)}.
     *
     * <p>Optional. Defaults to {@link RetryOptions#defaults()}.
     *
     * @param defaultOptions the options
     * @return this builder
     */
    public Builder defaultOptions(RetryOptions defaultOptions) {
      this.defaultOptions = defaultOptions;
      return this;
    }

    /**
     * Metrics exporter for queue counters and pending depth.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Clock for entry timestamps.
     *
     * <p>Optional. Defaults to the UTC system clock.
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Initial connectivity.
     *
     * <p>Optional. Defaults to {@code true}.
     *
     * @param online whether to start online
     * @return this builder
     */
    public Builder online(boolean online) {
      this.online = online;
      return this;
    }

    /**
     * How long {@link #close()} waits for pending work.
     *
     * <p>Optional. Defaults to 5 seconds.
     *
     * @param drainTimeout the timeout
     * @return this builder
     */
    public Builder drainTimeout(Duration drainTimeout) {
      this.drainTimeout = Objects.requireNonNull(drainTimeout, "drainTimeout");
      return this;
    }

    public TransactionQueue build() {
      return new TransactionQueue(this);
    }
  }
}
