package io.ledgerflow;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps arbitrary failures from ledger clients, wallets and remote services into
 * {@link LedgerException}s with a classified {@link ErrorCode}.
 *
 * <p>Unknown failures default to {@link ErrorCode#NETWORK_ERROR} so that they are retried
 * a bounded number of times rather than dropped.
 */
public final class ErrorClassifier {

  private ErrorClassifier() {
  }

  /**
   * Classifies a throwable. A {@link LedgerException} is returned unchanged; wrapper
   * exceptions from futures are unwrapped first.
   *
   * @param failure the failure to classify
   * @return a classified exception (never {@code null})
   */
  public static LedgerException classify(Throwable failure) {
    Throwable t = unwrap(failure);
    if (t instanceof LedgerException le) {
      return le;
    }
    if (t instanceof IOException || t instanceof UncheckedIOException || t instanceof TimeoutException) {
      return new LedgerException(ErrorCode.NETWORK_ERROR, messageOf(t, "Network request failed"), t);
    }
    String message = t.getMessage() == null ? "" : t.getMessage();
    String lower = message.toLowerCase(Locale.ROOT);
    if (lower.contains("declined") || lower.contains("rejected")) {
      return new LedgerException(ErrorCode.USER_REJECTED, "User rejected the request", t);
    }
    ErrorCode fromResult = codeForResultMarker(lower);
    if (fromResult != null) {
      return new LedgerException(fromResult, message, t);
    }
    return new LedgerException(ErrorCode.NETWORK_ERROR, messageOf(t, "Unexpected failure"), t);
  }

  /**
   * Maps a ledger transaction result code to an error code.
   *
   * <ul>
   *   <li>{@code tx_bad_seq} - {@link ErrorCode#STALE_SEQUENCE}</li>
   *   <li>{@code tx_insufficient_balance} - {@link ErrorCode#INSUFFICIENT_FUNDS}</li>
   *   <li>{@code tx_bad_auth} - {@link ErrorCode#UNAUTHORIZED}</li>
   *   <li>{@code tx_too_late} - {@link ErrorCode#TRANSACTION_FAILED}</li>
   *   <li>{@code contract_conflict} - {@link ErrorCode#CONFLICT}</li>
   *   <li>{@code contract_not_found} - {@link ErrorCode#NOT_FOUND}</li>
   *   <li>anything else - {@link ErrorCode#CONTRACT_ERROR}</li>
   * </ul>
   */
  public static ErrorCode forResultCode(String resultCode) {
    if (resultCode == null) {
      return ErrorCode.CONTRACT_ERROR;
    }
    return switch (resultCode) {
      case "tx_bad_seq" -> ErrorCode.STALE_SEQUENCE;
      case "tx_insufficient_balance" -> ErrorCode.INSUFFICIENT_FUNDS;
      case "tx_bad_auth" -> ErrorCode.UNAUTHORIZED;
      case "tx_too_late" -> ErrorCode.TRANSACTION_FAILED;
      case "contract_conflict" -> ErrorCode.CONFLICT;
      case "contract_not_found" -> ErrorCode.NOT_FOUND;
      default -> ErrorCode.CONTRACT_ERROR;
    };
  }

  /**
   * Maps an HTTP status from a remote service. The body is inspected for ledger result
   * markers on 400 responses.
   */
  public static ErrorCode forHttpStatus(int status, String body) {
    if (status == 400) {
      ErrorCode marker = body == null ? null : codeForResultMarker(body.toLowerCase(Locale.ROOT));
      return marker != null ? marker : ErrorCode.TRANSACTION_FAILED;
    }
    if (status == 401 || status == 403) {
      return ErrorCode.UNAUTHORIZED;
    }
    if (status == 404) {
      return ErrorCode.NOT_FOUND;
    }
    if (status == 409) {
      return ErrorCode.CONFLICT;
    }
    if (status == 429) {
      return ErrorCode.RATE_LIMITED;
    }
    if (status == 503) {
      return ErrorCode.SERVICE_UNAVAILABLE;
    }
    if (status >= 500) {
      return ErrorCode.NETWORK_ERROR;
    }
    return ErrorCode.INVALID_PARAMS;
  }

  private static ErrorCode codeForResultMarker(String lower) {
    if (lower.contains("tx_insufficient_balance")) return ErrorCode.INSUFFICIENT_FUNDS;
    if (lower.contains("tx_bad_auth")) return ErrorCode.UNAUTHORIZED;
    if (lower.contains("tx_bad_seq")) return ErrorCode.STALE_SEQUENCE;
    return null;
  }

  private static Throwable unwrap(Throwable failure) {
    Throwable t = failure;
    while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
      t = t.getCause();
    }
    return t;
  }

  private static String messageOf(Throwable t, String fallback) {
    return t.getMessage() == null || t.getMessage().isBlank() ? fallback : t.getMessage();
  }
}
