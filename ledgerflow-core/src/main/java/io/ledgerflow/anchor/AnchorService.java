package io.ledgerflow.anchor;

import io.ledgerflow.ErrorClassifier;
import io.ledgerflow.ErrorCode;
import io.ledgerflow.InvalidParamsException;
import io.ledgerflow.LedgerException;
import io.ledgerflow.Recovery;
import io.ledgerflow.retry.ExponentialBackoffRetryPolicy;
import io.ledgerflow.retry.RetryPolicy;
import io.ledgerflow.retry.Sleeper;
import io.ledgerflow.spi.AnchorTransport;
import io.ledgerflow.spi.WalletSigner;
import io.ledgerflow.util.Amounts;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fiat on/off-ramp through an anchor's interactive transfer server.
 *
 * <p>Authentication is challenge-response: the anchor issues a challenge envelope for the
 * account, the wallet signs it, and the signed challenge is exchanged for a bearer token.
 * Tokens are cached per account; exchange rates are cached per currency pair.
 *
 * <p>All failures surface as {@link ErrorCode#ANCHOR_ERROR}, except wallet refusals, which
 * keep their own code so the caller can prompt the user.
 */
public final class AnchorService {
  private static final Logger logger = Logger.getLogger(AnchorService.class.getName());

  private final AnchorTransport transport;
  private final AnchorConfig config;
  private final Clock clock;
  private final Sleeper sleeper;
  private final RetryPolicy pollPolicy;
  private final Map<String, CachedToken> tokens = new ConcurrentHashMap<>();
  private final Map<String, CachedRate> rates = new ConcurrentHashMap<>();

  public AnchorService(AnchorTransport transport, AnchorConfig config) {
    this(transport, config, Clock.systemUTC(), Sleeper.SYSTEM);
  }

  public AnchorService(AnchorTransport transport, AnchorConfig config, Clock clock, Sleeper sleeper) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.config = Objects.requireNonNull(config, "config");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.pollPolicy = new ExponentialBackoffRetryPolicy(
        config.pollInitialDelay().toMillis(), config.pollMultiplier(), config.pollMaxDelay().toMillis());
  }

  public AnchorConfig config() {
    return config;
  }

  /**
   * Returns a bearer token for the signer's account, running the challenge exchange
   * unless a cached token is still valid.
   */
  public String authenticate(WalletSigner signer) {
    Objects.requireNonNull(signer, "signer");
    String account = signer.getPublicKey();
    CachedToken cached = tokens.get(account);
    Instant now = clock.instant();
    if (cached != null && cached.expiresAt.isAfter(now)) {
      return cached.token;
    }
    String token = anchorCall("Failed to get authentication token", () -> {
      Map<String, String> challenge = transport.get(config.webAuthUrl(), Map.of("account", account), null);
      String envelope = challenge.get("transaction");
      if (envelope == null || envelope.isBlank()) {
        throw new LedgerException(ErrorCode.ANCHOR_ERROR, "No challenge transaction received from anchor");
      }
      String signed = signer.sign(envelope.trim());
      Map<String, String> response = transport.post(config.webAuthUrl(), Map.of("transaction", signed), null);
      String value = response.get("token");
      if (value == null || value.isBlank()) {
        throw new LedgerException(ErrorCode.ANCHOR_ERROR, "No token received from anchor");
      }
      return value;
    });
    tokens.put(account, new CachedToken(token, now.plus(config.tokenTtl())));
    logger.log(Level.FINE, "Authenticated {0} with anchor", account);
    return token;
  }

  /** Drops a cached token, forcing the next call to re-authenticate. */
  public void invalidateToken(String account) {
    tokens.remove(account);
  }

  public InteractiveSession startInteractiveDeposit(WalletSigner signer) {
    return startInteractiveDeposit(config.defaultAssetCode(), null, signer);
  }

  /**
   * Opens an interactive deposit (fiat in, asset out to the signer's account).
   *
   * @param amount optional amount to prefill; must be positive when present
   */
  public InteractiveSession startInteractiveDeposit(String assetCode, String amount, WalletSigner signer) {
    return startInteractive(InteractiveSession.Type.DEPOSIT, assetCode, amount, Map.of(), signer);
  }

  public InteractiveSession startInteractiveWithdraw(WalletSigner signer) {
    return startInteractiveWithdraw(config.defaultAssetCode(), null, signer);
  }

  /**
   * Opens an interactive withdrawal (asset in from the signer's account, fiat out).
   */
  public InteractiveSession startInteractiveWithdraw(String assetCode, String amount, WalletSigner signer) {
    return startInteractive(InteractiveSession.Type.WITHDRAW, assetCode, amount, Map.of(), signer);
  }

  /**
   * Opens a withdrawal to a known bank account. The account number goes in {@code dest};
   * routing number and account type in {@code dest_extra}.
   */
  public InteractiveSession startWithdrawToBank(String amount, BankAccount bank, WalletSigner signer) {
    Objects.requireNonNull(bank, "bank");
    if (amount == null) {
      throw new InvalidParamsException("Amount must be greater than 0");
    }
    Map<String, String> extra = new LinkedHashMap<>();
    extra.put("dest", bank.accountNumber());
    extra.put("dest_extra", bank.destExtra());
    return startInteractive(InteractiveSession.Type.WITHDRAW, config.defaultAssetCode(), amount, extra, signer);
  }

  private InteractiveSession startInteractive(InteractiveSession.Type type, String assetCode, String amount,
                                              Map<String, String> extra, WalletSigner signer) {
    Objects.requireNonNull(signer, "signer");
    if (assetCode == null || assetCode.isBlank()) {
      throw new InvalidParamsException("Asset code is required");
    }
    if (amount != null && !Amounts.isPositive(parseAmount(amount))) {
      throw new InvalidParamsException("Amount must be greater than 0");
    }
    String token = authenticate(signer);
    String path = type == InteractiveSession.Type.DEPOSIT ? "/transactions/deposit/interactive"
        : "/transactions/withdraw/interactive";
    String label = type == InteractiveSession.Type.DEPOSIT ? "Failed to start interactive deposit"
        : "Failed to start interactive withdrawal";
    return anchorCall(label, () -> {
      Map<String, String> body = new LinkedHashMap<>();
      body.put("asset_code", assetCode);
      body.put("account", signer.getPublicKey());
      if (amount != null) {
        body.put("amount", amount);
      }
      body.putAll(extra);
      body.put("lang", "en");
      Map<String, String> response = transport.post(config.transferServerUrl() + path, body, token);
      String id = response.get("id");
      String url = response.get("url");
      if (id == null || url == null) {
        throw new LedgerException(ErrorCode.ANCHOR_ERROR, "Anchor response missing id or url");
      }
      logger.log(Level.FINE, "Opened {0} session {1}", new Object[]{type, id});
      return new InteractiveSession(id, url, type, token);
    });
  }

  /**
   * One status lookup for an anchor transaction.
   *
   * @param authToken bearer token, or {@code null} for anchors that allow anonymous lookups
   */
  public AnchorTransactionStatus getTransactionStatus(String transactionId, String authToken) {
    Objects.requireNonNull(transactionId, "transactionId");
    return anchorCall("Failed to get transaction status", () -> {
      Map<String, String> response = transport.get(
          config.transferServerUrl() + "/transaction", Map.of("id", transactionId), authToken);
      String raw = response.get("transaction.status");
      return AnchorTransactionStatus.fromWire(raw).orElseThrow(() ->
          new LedgerException(ErrorCode.ANCHOR_ERROR, "Unknown anchor transaction status: " + raw));
    });
  }

  public AnchorTransactionStatus pollTransactionStatus(InteractiveSession session,
                                                       Consumer<AnchorTransactionStatus> onStatusChange) {
    return pollTransactionStatus(session.id(), session.authToken(), onStatusChange);
  }

  /**
   * Polls until the transaction reaches a terminal status, waiting between polls with
   * exponential backoff. A failed lookup counts as an attempt and is retried.
   *
   * @param onStatusChange called each time the observed status differs from the last one;
   *                       may be {@code null}
   * @throws LedgerException with {@link ErrorCode#ANCHOR_ERROR} when attempts run out
   */
  public AnchorTransactionStatus pollTransactionStatus(String transactionId, String authToken,
                                                       Consumer<AnchorTransactionStatus> onStatusChange) {
    AnchorTransactionStatus last = null;
    for (int attempt = 1; attempt <= config.pollMaxAttempts(); attempt++) {
      try {
        AnchorTransactionStatus status = getTransactionStatus(transactionId, authToken);
        if (status != last && onStatusChange != null) {
          notifyStatusChange(onStatusChange, status);
        }
        last = status;
        if (status.isTerminal()) {
          return status;
        }
      } catch (LedgerException e) {
        logger.log(Level.WARNING, "Status poll " + attempt + " for " + transactionId + " failed: " + e.getMessage());
      }
      if (attempt < config.pollMaxAttempts()) {
        pause(pollPolicy.computeDelayMs(attempt));
      }
    }
    throw new LedgerException(ErrorCode.ANCHOR_ERROR, "Transaction polling timeout");
  }

  /**
   * Conversion rate quote, served from cache while fresh. Missing members default to a
   * rate of 1.0 and a fee of 0.
   */
  public ExchangeRate getExchangeRate(String from, String to) {
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(to, "to");
    String key = from + "-" + to;
    Instant now = clock.instant();
    CachedRate cached = rates.get(key);
    if (cached != null && cached.expiresAt.isAfter(now)) {
      return cached.rate;
    }
    ExchangeRate rate = anchorCall("Failed to get exchange rate", () -> {
      Map<String, String> response = transport.get(config.transferServerUrl() + "/price",
          Map.of("sell_asset", from, "buy_asset", to), null);
      return new ExchangeRate(from, to,
          parseAmount(response.getOrDefault("buy_price", "1.0")),
          parseAmount(response.getOrDefault("fee", "0")),
          now);
    });
    rates.put(key, new CachedRate(rate, now.plus(config.rateCacheTtl())));
    return rate;
  }

  private void notifyStatusChange(Consumer<AnchorTransactionStatus> onStatusChange, AnchorTransactionStatus status) {
    try {
      onStatusChange.accept(status);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Status change observer failed", e);
    }
  }

  private void pause(long delayMs) {
    try {
      sleeper.sleep(Duration.ofMillis(delayMs));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new LedgerException(ErrorCode.ANCHOR_ERROR, "Interrupted while polling anchor", e);
    }
  }

  private static BigDecimal parseAmount(String value) {
    try {
      return Amounts.parse(value);
    } catch (IllegalArgumentException e) {
      throw new InvalidParamsException("Invalid amount: " + value);
    }
  }

  private static <T> T anchorCall(String label, Supplier<T> call) {
    try {
      return call.get();
    } catch (LedgerException e) {
      if (e.recovery() == Recovery.NEEDS_USER_ACTION || e.code() == ErrorCode.ANCHOR_ERROR
          || e.code() == ErrorCode.INVALID_PARAMS) {
        throw e;
      }
      throw new LedgerException(ErrorCode.ANCHOR_ERROR, label + ": " + e.getMessage(), e);
    } catch (RuntimeException e) {
      LedgerException classified = ErrorClassifier.classify(e);
      if (classified.recovery() == Recovery.NEEDS_USER_ACTION) {
        throw classified;
      }
      throw new LedgerException(ErrorCode.ANCHOR_ERROR, label + ": " + e.getMessage(), e);
    }
  }

  private record CachedToken(String token, Instant expiresAt) {
  }

  private record CachedRate(ExchangeRate rate, Instant expiresAt) {
  }
}
