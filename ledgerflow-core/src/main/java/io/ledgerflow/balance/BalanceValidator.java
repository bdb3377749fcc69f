package io.ledgerflow.balance;

import io.ledgerflow.model.AccountInfo;
import io.ledgerflow.model.AssetBalance;
import io.ledgerflow.spi.LedgerClient;
import io.ledgerflow.util.Amounts;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Advisory pre-flight check that an account can cover an amount of the settlement asset,
 * keeping a reserve back for fees. The ledger still enforces balances at submission time.
 *
 * <p>Failures to load the account propagate as {@link io.ledgerflow.LedgerException}.
 */
public final class BalanceValidator {
  public static final BigDecimal DEFAULT_RESERVE = new BigDecimal("1.0");

  private static final BigDecimal LOW_BALANCE_THRESHOLD = BigDecimal.TEN;
  private static final long BASE_FEE_PER_OPERATION = 100;
  private static final BigDecimal BASE_UNITS_PER_NATIVE = BigDecimal.valueOf(10_000_000L);

  private final LedgerClient ledger;
  private final String assetCode;
  private final String assetIssuer;
  private final BigDecimal reserve;

  /**
   * @param assetCode   settlement asset code
   * @param assetIssuer settlement asset issuer, or {@code null} to match any issuer
   * @param reserve     amount kept back by default
   */
  public BalanceValidator(LedgerClient ledger, String assetCode, String assetIssuer, BigDecimal reserve) {
    this.ledger = Objects.requireNonNull(ledger, "ledger");
    this.assetCode = Objects.requireNonNull(assetCode, "assetCode");
    this.assetIssuer = assetIssuer;
    this.reserve = Objects.requireNonNull(reserve, "reserve");
    if (reserve.signum() < 0) {
      throw new IllegalArgumentException("reserve must not be negative");
    }
  }

  public BalanceCheck validateBalance(String account, String requiredAmount) {
    return validateBalance(account, requiredAmount, true);
  }

  /**
   * Checks {@code balance - reserve >= required}.
   *
   * @param includeReserve whether to keep the reserve back
   */
  public BalanceCheck validateBalance(String account, String requiredAmount, boolean includeReserve) {
    return check(account, requiredAmount, includeReserve ? reserve : BigDecimal.ZERO);
  }

  /** Same as {@link #validateBalance(String, String)} with an explicit reserve. */
  public BalanceCheck validateBalance(String account, String requiredAmount, BigDecimal customReserve) {
    return check(account, requiredAmount, Objects.requireNonNull(customReserve, "customReserve"));
  }

  private BalanceCheck check(String account, String requiredAmount, BigDecimal keepBack) {
    String requiredText = requiredAmount == null ? "" : requiredAmount;
    AccountInfo info = ledger.loadAccount(account);
    Optional<AssetBalance> line = info.balance(assetCode, assetIssuer);
    if (line.isEmpty()) {
      return new BalanceCheck(false, "0", requiredText, requiredText,
          assetCode + " trustline not established. Please set up " + assetCode + " in your wallet first.",
          true, true);
    }
    BigDecimal balance = line.get().balance();
    String available = balance.toPlainString();
    BigDecimal required = parseOrNull(requiredAmount);
    if (required == null || required.signum() <= 0) {
      return new BalanceCheck(false, available, requiredText, null, "Invalid amount specified", false, false);
    }
    BigDecimal effective = balance.subtract(keepBack).max(BigDecimal.ZERO);
    if (effective.compareTo(required) >= 0) {
      return new BalanceCheck(true, available, requiredText, null, "Sufficient balance available", false, false);
    }
    String shortfall = Amounts.toFixed(required.subtract(effective), 2);
    return new BalanceCheck(false, available, requiredText, shortfall,
        "Insufficient " + assetCode + " balance. You need " + shortfall + " more " + assetCode + ".",
        true, false);
  }

  public boolean hasSufficientBalance(String account, String requiredAmount) {
    return validateBalance(account, requiredAmount).valid();
  }

  /**
   * Balance check plus warnings for the caller to show before a funds-moving operation:
   * a low-balance warning when less than 10 would remain, and one per transaction kind.
   */
  public PreTransactionCheck preTransactionValidation(String account, String amount, TransactionKind kind) {
    Objects.requireNonNull(kind, "kind");
    BalanceCheck result = validateBalance(account, amount);
    List<String> warnings = new ArrayList<>();
    if (result.valid()) {
      BigDecimal remaining = Amounts.parse(result.available()).subtract(Amounts.parse(result.required()));
      if (remaining.compareTo(LOW_BALANCE_THRESHOLD) < 0) {
        warnings.add("Your balance will be low (" + Amounts.toFixed(remaining, 2) + " " + assetCode
            + ") after this transaction");
      }
      if (kind.warning() != null) {
        warnings.add(kind.warning());
      }
    }
    return new PreTransactionCheck(result.valid(), result, warnings);
  }

  /**
   * Checks the sum of several amounts. Unparseable entries count as zero.
   */
  public MultiAmountCheck validateMultipleAmounts(String account, List<String> amounts) {
    BigDecimal total = BigDecimal.ZERO;
    for (String amount : amounts) {
      BigDecimal value = parseOrNull(amount);
      if (value != null) {
        total = total.add(value);
      }
    }
    String totalRequired = Amounts.toFixed(total, 2);
    BalanceCheck result = validateBalance(account, totalRequired);
    return new MultiAmountCheck(result.valid(), totalRequired, result);
  }

  /**
   * Fee estimate in native units: 100 base units per operation, seven decimals.
   */
  public static String estimateTransactionFee(int operationCount) {
    if (operationCount < 0) {
      throw new IllegalArgumentException("operationCount must be >= 0");
    }
    BigDecimal fee = BigDecimal.valueOf(BASE_FEE_PER_OPERATION * operationCount)
        .divide(BASE_UNITS_PER_NATIVE);
    return Amounts.toFixed(fee, 7);
  }

  private static BigDecimal parseOrNull(String value) {
    try {
      return Amounts.parse(value);
    } catch (IllegalArgumentException e) {
      return null;
    }
  }

  /**
   * @param canProceed whether the balance check passed
   * @param warnings   things to show the user before proceeding
   */
  public record PreTransactionCheck(boolean canProceed, BalanceCheck result, List<String> warnings) {
    public PreTransactionCheck {
      warnings = List.copyOf(warnings);
    }
  }

  public record MultiAmountCheck(boolean valid, String totalRequired, BalanceCheck result) {
  }
}
