package io.ledgerflow.history;

/**
 * What a history record describes.
 */
public enum RecordType {
  DEPOSIT,
  WITHDRAWAL,
  ESCROW,
  PAYMENT
}
