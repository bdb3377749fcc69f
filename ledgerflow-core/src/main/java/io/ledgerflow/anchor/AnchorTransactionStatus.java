package io.ledgerflow.anchor;

import java.util.Optional;

/**
 * Lifecycle of an anchor deposit or withdrawal, as reported by the anchor.
 */
public enum AnchorTransactionStatus {
  PENDING_USER_TRANSFER_START("pending_user_transfer_start"),
  PENDING_USER_TRANSFER_COMPLETE("pending_user_transfer_complete"),
  PENDING_EXTERNAL("pending_external"),
  PENDING_ANCHOR("pending_anchor"),
  PENDING_STELLAR("pending_stellar"),
  PENDING_TRUST("pending_trust"),
  PENDING_USER("pending_user"),
  INCOMPLETE("incomplete"),
  COMPLETED("completed"),
  ERROR("error"),
  REFUNDED("refunded"),
  EXPIRED("expired");

  private final String wireValue;

  AnchorTransactionStatus(String wireValue) {
    this.wireValue = wireValue;
  }

  public String wireValue() {
    return wireValue;
  }

  /**
   * Whether polling stops at this status.
   */
  public boolean isTerminal() {
    return this == COMPLETED || this == ERROR || this == REFUNDED || this == EXPIRED;
  }

  public static Optional<AnchorTransactionStatus> fromWire(String value) {
    for (AnchorTransactionStatus status : values()) {
      if (status.wireValue.equals(value)) {
        return Optional.of(status);
      }
    }
    return Optional.empty();
  }
}
