package io.ledgerflow;

import java.util.Objects;
import java.util.Optional;

/**
 * User-facing wording for classified failures.
 */
public final class ErrorMessages {

  /** How loudly a message should be shown. */
  public enum Severity { INFO, WARNING, ERROR }

  /**
   * A displayable message.
   *
   * @param title    short heading
   * @param message  body text
   * @param action   what the user can do about it, if anything
   * @param severity display severity
   */
  public record Message(String title, String message, String action, Severity severity) {
    public Message {
      Objects.requireNonNull(title, "title");
      Objects.requireNonNull(message, "message");
      Objects.requireNonNull(severity, "severity");
    }

    public Optional<String> actionText() {
      return Optional.ofNullable(action);
    }

    /** Title, message and action joined into a single line. */
    public String format() {
      String text = title + ": " + message;
      return action == null ? text : text + " " + action;
    }
  }

  private ErrorMessages() {
  }

  public static Message forFailure(Throwable failure) {
    if (failure == null) {
      return new Message("Unexpected Error", "An unexpected error occurred. Please try again.",
          null, Severity.ERROR);
    }
    LedgerException e = ErrorClassifier.classify(failure);
    String detail = e.getMessage();
    return switch (e.code()) {
      case USER_REJECTED -> new Message("Transaction Cancelled",
          "You cancelled the transaction in your wallet.", null, Severity.INFO);
      case INSUFFICIENT_FUNDS -> new Message("Insufficient Funds",
          "Your wallet does not have enough funds to complete this transaction.",
          "Please add funds to your wallet and try again.", Severity.ERROR);
      case NEEDS_SETUP -> new Message("Account Setup Required",
          "Your account cannot hold the settlement asset yet.",
          "Please add a trustline for the asset and deposit funds.", Severity.WARNING);
      case SUBMISSION_UNKNOWN -> new Message("Transaction Pending",
          "Your transaction is still being submitted.",
          "Please check its status before trying again.", Severity.WARNING);
      case WALLET_ERROR -> new Message("Wallet Connection Error",
          "There was a problem connecting to your wallet.",
          "Please check that your wallet is unlocked and try again.", Severity.ERROR);
      case NETWORK_ERROR, SERVICE_UNAVAILABLE -> new Message("Network Error",
          "Unable to connect to the ledger network.",
          "Please check your internet connection and try again.", Severity.ERROR);
      case RATE_LIMITED -> new Message("Too Many Requests",
          "The service is receiving too many requests.",
          "Please wait a moment and try again.", Severity.WARNING);
      case CONTRACT_ERROR -> new Message("Smart Contract Error",
          orDefault(detail, "The smart contract operation failed."),
          "Please verify your transaction details and try again.", Severity.ERROR);
      case ANCHOR_ERROR -> new Message("Payment Processing Error",
          "There was a problem processing your payment.",
          "Please contact support if the problem persists.", Severity.ERROR);
      case UNAUTHORIZED -> new Message("Unauthorized",
          "You do not have permission to perform this action.", null, Severity.ERROR);
      case INVALID_PARAMS -> new Message("Invalid Parameters",
          orDefault(detail, "The provided parameters are invalid."),
          "Please check your input and try again.", Severity.ERROR);
      case TRANSACTION_FAILED, STALE_SEQUENCE -> new Message("Transaction Failed",
          "The transaction could not be completed.",
          "Please try again or contact support if the problem persists.", Severity.ERROR);
      case CONFLICT -> new Message("Already Processed",
          orDefault(detail, "This action has already been completed by someone else."),
          null, Severity.WARNING);
      case NOT_FOUND -> new Message("Not Found",
          orDefault(detail, "The requested item does not exist."), null, Severity.ERROR);
      case SIGNATURE_INVALID -> new Message("Invalid Signature",
          "The signature could not be verified.", null, Severity.ERROR);
    };
  }

  private static String orDefault(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value;
  }
}
