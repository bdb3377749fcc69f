package io.ledgerflow;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class ErrorClassifierTest {

  @Test
  void ledgerExceptionsPassThroughUnchanged() {
    LedgerException original = new LedgerException(ErrorCode.CONFLICT, "taken");

    assertSame(original, ErrorClassifier.classify(original));
    assertSame(original, ErrorClassifier.classify(new CompletionException(new ExecutionException(original))));
  }

  @Test
  void ioFailuresAreNetworkErrors() {
    LedgerException e = ErrorClassifier.classify(new IOException("connection reset"));

    assertEquals(ErrorCode.NETWORK_ERROR, e.code());
    assertTrue(e.isRetryable());
    assertEquals("connection reset", e.getMessage());
  }

  @Test
  void walletRefusalsAreUserRejected() {
    assertEquals(ErrorCode.USER_REJECTED, ErrorClassifier.classify(new IllegalStateException("User declined")).code());
    assertEquals(ErrorCode.USER_REJECTED,
        ErrorClassifier.classify(new RuntimeException("Request rejected by wallet")).code());
    assertEquals(Recovery.NEEDS_USER_ACTION,
        ErrorClassifier.classify(new RuntimeException("declined")).recovery());
  }

  @Test
  void resultMarkersInMessagesAreRecognised() {
    assertEquals(ErrorCode.INSUFFICIENT_FUNDS,
        ErrorClassifier.classify(new RuntimeException("op failed: TX_INSUFFICIENT_BALANCE")).code());
    assertEquals(ErrorCode.STALE_SEQUENCE, ErrorClassifier.classify(new RuntimeException("tx_bad_seq")).code());
  }

  @Test
  void unknownFailuresAreRetriedAsNetworkErrors() {
    LedgerException e = ErrorClassifier.classify(new IllegalStateException());

    assertEquals(ErrorCode.NETWORK_ERROR, e.code());
    assertEquals("Unexpected failure", e.getMessage());
  }

  @Test
  void resultCodes() {
    assertEquals(ErrorCode.STALE_SEQUENCE, ErrorClassifier.forResultCode("tx_bad_seq"));
    assertEquals(ErrorCode.UNAUTHORIZED, ErrorClassifier.forResultCode("tx_bad_auth"));
    assertEquals(ErrorCode.CONFLICT, ErrorClassifier.forResultCode("contract_conflict"));
    assertEquals(ErrorCode.NOT_FOUND, ErrorClassifier.forResultCode("contract_not_found"));
    assertEquals(ErrorCode.CONTRACT_ERROR, ErrorClassifier.forResultCode("contract_panic"));
    assertEquals(ErrorCode.CONTRACT_ERROR, ErrorClassifier.forResultCode(null));
  }

  @Test
  void httpStatuses() {
    assertEquals(ErrorCode.INSUFFICIENT_FUNDS, ErrorClassifier.forHttpStatus(400, "{\"extras\":\"tx_insufficient_balance\"}"));
    assertEquals(ErrorCode.TRANSACTION_FAILED, ErrorClassifier.forHttpStatus(400, null));
    assertEquals(ErrorCode.UNAUTHORIZED, ErrorClassifier.forHttpStatus(403, ""));
    assertEquals(ErrorCode.NOT_FOUND, ErrorClassifier.forHttpStatus(404, ""));
    assertEquals(ErrorCode.CONFLICT, ErrorClassifier.forHttpStatus(409, ""));
    assertEquals(ErrorCode.RATE_LIMITED, ErrorClassifier.forHttpStatus(429, ""));
    assertEquals(ErrorCode.SERVICE_UNAVAILABLE, ErrorClassifier.forHttpStatus(503, ""));
    assertEquals(ErrorCode.NETWORK_ERROR, ErrorClassifier.forHttpStatus(502, ""));
    assertEquals(ErrorCode.INVALID_PARAMS, ErrorClassifier.forHttpStatus(422, ""));
  }

  @Test
  void userFacingMessages() {
    ErrorMessages.Message cancelled = ErrorMessages.forFailure(new IllegalStateException("User declined"));
    assertEquals("Transaction Cancelled", cancelled.title());
    assertEquals(ErrorMessages.Severity.INFO, cancelled.severity());
    assertTrue(cancelled.actionText().isEmpty());

    ErrorMessages.Message invalid = ErrorMessages.forFailure(new InvalidParamsException("Budget mismatch"));
    assertEquals("Invalid Parameters: Budget mismatch Please check your input and try again.", invalid.format());

    ErrorMessages.Message limited = ErrorMessages.forFailure(
        new RateLimitedException("slow down", Duration.ofSeconds(2)));
    assertEquals(ErrorMessages.Severity.WARNING, limited.severity());

    assertEquals("Unexpected Error", ErrorMessages.forFailure(null).title());
  }
}
