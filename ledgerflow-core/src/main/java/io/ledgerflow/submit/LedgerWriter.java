package io.ledgerflow.submit;

import io.ledgerflow.ErrorClassifier;
import io.ledgerflow.ErrorCode;
import io.ledgerflow.LedgerException;
import io.ledgerflow.model.ContractCall;
import io.ledgerflow.model.SimulationResult;
import io.ledgerflow.model.SubmitResult;
import io.ledgerflow.model.UnsignedTransaction;
import io.ledgerflow.queue.AccountQueues;
import io.ledgerflow.queue.TransactionQueue;
import io.ledgerflow.retry.RetryOptions;
import io.ledgerflow.spi.LedgerClient;
import io.ledgerflow.spi.WalletSigner;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;

/**
 * The single write path to the ledger: build, simulate, sign, submit.
 *
 * <p>Each write runs as one operation on the signer's account queue, so writes from one
 * account are serialized. Building happens inside the retried operation: when the ledger
 * reports a stale sequence number, the next attempt rebuilds against the fresh sequence
 * (and asks the wallet to sign again). A failed simulation is a {@code CONTRACT_ERROR}
 * and never reaches the wallet.
 *
 * <p>Blocking calls wait at most the submit timeout. When the wait ends (timeout or
 * interrupt) while the write is still pending, it is withdrawn from the queue and the
 * caller gets a retryable {@code NETWORK_ERROR}: nothing reached the ledger. When the
 * write has already started, it keeps running and the caller gets
 * {@code SUBMISSION_UNKNOWN}; retrying blindly could apply it twice.
 */
public final class LedgerWriter {
  private static final Logger logger = Logger.getLogger(LedgerWriter.class.getName());

  private final LedgerClient ledgerClient;
  private final AccountQueues accountQueues;
  private final RetryOptions retryOptions;
  private final boolean simulate;
  private final Duration defaultExpiry;
  private final Duration submitTimeout;
  private final AtomicLong counter = new AtomicLong();

  private LedgerWriter(Builder builder) {
    this.ledgerClient = Objects.requireNonNull(builder.ledgerClient, "ledgerClient");
    this.accountQueues = Objects.requireNonNull(builder.accountQueues, "accountQueues");
    this.retryOptions = builder.retryOptions != null ? builder.retryOptions : accountQueues.defaultOptions();
    this.simulate = builder.simulate;
    this.defaultExpiry = Objects.requireNonNull(builder.defaultExpiry, "defaultExpiry");
    this.submitTimeout = Objects.requireNonNull(builder.submitTimeout, "submitTimeout");
    if (defaultExpiry.isZero() || defaultExpiry.isNegative()) {
      throw new IllegalArgumentException("defaultExpiry must be positive");
    }
    if (submitTimeout.isZero() || submitTimeout.isNegative()) {
      throw new IllegalArgumentException("submitTimeout must be positive");
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  public LedgerClient ledgerClient() {
    return ledgerClient;
  }

  public SubmitResult submit(String label, WalletSigner signer, List<ContractCall> calls) {
    return submit(label, signer, calls, defaultExpiry);
  }

  /**
   * Submits {@code calls} as one transaction from the signer's account and waits for it.
   *
   * @param label  short operation name used in queue ids and logs
   * @param expiry validity window of each built transaction
   * @return the applied transaction
   * @throws LedgerException classified failure; a ledger rejection carries the code mapped
   *     from its result code
   */
  public SubmitResult submit(String label, WalletSigner signer, List<ContractCall> calls, Duration expiry) {
    return await(label, enqueueWrite(label, signer, calls, expiry));
  }

  public CompletableFuture<SubmitResult> submitAsync(String label, WalletSigner signer,
                                                     List<ContractCall> calls, Duration expiry) {
    return enqueueWrite(label, signer, calls, expiry).future();
  }

  private QueuedWrite enqueueWrite(String label, WalletSigner signer, List<ContractCall> calls, Duration expiry) {
    Objects.requireNonNull(signer, "signer");
    Objects.requireNonNull(expiry, "expiry");
    List<ContractCall> ops = List.copyOf(calls);
    if (ops.isEmpty()) {
      throw new IllegalArgumentException("calls must not be empty");
    }
    String source = signer.getPublicKey();
    TransactionQueue queue = accountQueues.queueFor(source);
    String id = nextId(label);
    CompletableFuture<SubmitResult> future = queue.enqueue(id,
        () -> buildSignSubmit(source, signer, ops, expiry), retryOptions);
    return new QueuedWrite(queue, id, future);
  }

  /**
   * Signs and submits an envelope built elsewhere (for example by the escrow backend) on
   * the signer's account queue. The wallet is asked once; network retries resubmit the
   * same signed envelope. A stale sequence cannot be repaired here and is reported as
   * {@code CONFLICT}.
   */
  public SubmitResult submitEnvelope(String label, WalletSigner signer, String envelope) {
    Objects.requireNonNull(signer, "signer");
    Objects.requireNonNull(envelope, "envelope");
    AtomicReference<String> signed = new AtomicReference<>();
    TransactionQueue queue = accountQueues.queueFor(signer.getPublicKey());
    String id = nextId(label);
    CompletableFuture<SubmitResult> future = queue.enqueue(id, () -> {
          if (signed.get() == null) {
            signed.set(sign(signer, envelope));
          }
          try {
            return checked(ledgerClient.submit(signed.get()));
          } catch (LedgerException e) {
            if (e.code() == ErrorCode.STALE_SEQUENCE) {
              throw new LedgerException(ErrorCode.CONFLICT,
                  "Envelope sequence is stale; request a new envelope", e);
            }
            throw e;
          }
        }, retryOptions);
    return await(label, new QueuedWrite(queue, id, future));
  }

  private SubmitResult buildSignSubmit(String source, WalletSigner signer, List<ContractCall> calls,
                                       Duration expiry) {
    UnsignedTransaction tx = ledgerClient.buildTransaction(source, calls, expiry);
    logger.fine(() -> "Built transaction for " + source + " at sequence " + tx.sequence()
        + ", expires " + tx.expiresAt());
    if (simulate) {
      SimulationResult simulation = ledgerClient.simulate(tx.envelope());
      if (!simulation.success()) {
        throw new LedgerException(ErrorCode.CONTRACT_ERROR, "Simulation failed: " + simulation.error());
      }
    }
    return checked(ledgerClient.submit(sign(signer, tx.envelope())));
  }

  private static String sign(WalletSigner signer, String envelope) {
    try {
      return signer.sign(envelope);
    } catch (RuntimeException e) {
      LedgerException classified = ErrorClassifier.classify(e);
      if (classified.code() == ErrorCode.USER_REJECTED || classified.code() == ErrorCode.WALLET_ERROR) {
        throw classified;
      }
      throw new LedgerException(ErrorCode.WALLET_ERROR, "Wallet failed to sign: " + e.getMessage(), e);
    }
  }

  private static SubmitResult checked(SubmitResult result) {
    if (result.success()) {
      return result;
    }
    ErrorCode code = ErrorClassifier.forResultCode(result.resultCode());
    throw new LedgerException(code, "Transaction " + result.hash() + " rejected: " + result.resultCode());
  }

  private String nextId(String label) {
    return label + "-" + counter.incrementAndGet();
  }

  private SubmitResult await(String label, QueuedWrite write) {
    try {
      return write.future().get(submitTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (ExecutionException e) {
      throw ErrorClassifier.classify(e.getCause());
    } catch (TimeoutException e) {
      return giveUp(label, write, "Timed out after " + submitTimeout.toMillis() + "ms waiting for " + label, e);
    } catch (CancellationException e) {
      throw new LedgerException(ErrorCode.NETWORK_ERROR, label + " was cancelled before it was submitted", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return giveUp(label, write, "Interrupted waiting for " + label, e);
    }
  }

  /**
   * Decides what a caller that stopped waiting may safely do next. A pending write is
   * withdrawn so a retry cannot apply it twice; a finished write reports its own outcome.
   */
  private SubmitResult giveUp(String label, QueuedWrite write, String reason, Exception cause) {
    if (write.queue().cancelPending(write.id())) {
      logger.warning(reason + "; withdrew " + write.id() + " before submission");
      throw new LedgerException(ErrorCode.NETWORK_ERROR, reason + "; nothing was submitted", cause);
    }
    CompletableFuture<SubmitResult> future = write.future();
    if (future.isCancelled()) {
      throw new LedgerException(ErrorCode.NETWORK_ERROR, label + " was cancelled before it was submitted", cause);
    }
    if (future.isDone()) {
      try {
        return future.join();
      } catch (CompletionException e) {
        throw ErrorClassifier.classify(e);
      }
    }
    logger.warning(reason + "; " + write.id() + " is already being submitted");
    throw new LedgerException(ErrorCode.SUBMISSION_UNKNOWN,
        reason + "; " + label + " is already being submitted, check its status before retrying", cause);
  }

  private record QueuedWrite(TransactionQueue queue, String id, CompletableFuture<SubmitResult> future) {
  }

  /** Builder for {@link LedgerWriter}. */
  public static final class Builder {
    private LedgerClient ledgerClient;
    private AccountQueues accountQueues;
    private RetryOptions retryOptions;
    private boolean simulate = true;
    private Duration defaultExpiry = Duration.ofSeconds(180);
    private Duration submitTimeout = Duration.ofSeconds(120);

    private Builder() {}

    /**
     * <b>Required.</b>
     *
     * @param ledgerClient the ledger client
     * @return this builder
     */
    public Builder ledgerClient(LedgerClient ledgerClient) {
      this.ledgerClient = ledgerClient;
      return this;
    }

    /**
     * Queues that serialize writes per source account.
     *
     * <p><b>Required.</b>
     *
     * @param accountQueues the queues
     * @return this builder
     */
    public Builder accountQueues(AccountQueues accountQueues) {
      this.accountQueues = accountQueues;
      return this;
    }

    /**
     * Retry options for each write.
     *
     * <p>Optional. Defaults to the queues' default options.
     *
     * @param retryOptions the options
     * @return this builder
     */
    public Builder retryOptions(RetryOptions retryOptions) {
      this.retryOptions = retryOptions;
      return this;
    }

    /**
     * Whether to dry-run each transaction before asking the wallet to sign.
     *
     * <p>Optional. Defaults to {@code true}.
     *
     * @param simulate enable simulation
     * @return this builder
     */
    public Builder simulate(boolean simulate) {
      this.simulate = simulate;
      return this;
    }

    /**
     * Validity window of built transactions.
     *
     * <p>Optional. Defaults to 180 seconds.
     *
     * @param defaultExpiry the window
     * @return this builder
     */
    public Builder defaultExpiry(Duration defaultExpiry) {
      this.defaultExpiry = defaultExpiry;
      return this;
    }

    /**
     * How long blocking calls wait for their queued write.
     *
     * <p>Optional. Defaults to 120 seconds.
     *
     * @param submitTimeout the timeout
     * @return this builder
     */
    public Builder submitTimeout(Duration submitTimeout) {
      this.submitTimeout = submitTimeout;
      return this;
    }

    public LedgerWriter build() {
      return new LedgerWriter(this);
    }
  }
}
