package io.ledgerflow;

/**
 * Caller-side validation failure, raised before any ledger or network call.
 */
public class InvalidParamsException extends LedgerException {

  public InvalidParamsException(String message) {
    super(ErrorCode.INVALID_PARAMS, message);
  }
}
