package io.ledgerflow;

import java.util.Objects;

/**
 * Base failure type for every public ledgerflow operation.
 *
 * <p>The {@link #code()} tells what went wrong, {@link #recovery()} tells the caller
 * whether to retry, ask the user for something, or give up.
 *
 * @see ErrorClassifier
 */
public class LedgerException extends RuntimeException {
  private final ErrorCode code;

  public LedgerException(ErrorCode code, String message) {
    super(message);
    this.code = Objects.requireNonNull(code, "code");
  }

  public LedgerException(ErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
  }

  public ErrorCode code() {
    return code;
  }

  public Recovery recovery() {
    return code.recovery();
  }

  public boolean isRetryable() {
    return code.isRetryable();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + code + "]: " + getMessage();
  }
}
