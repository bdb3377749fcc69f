package io.ledgerflow.balance;

/**
 * What a funds-moving operation is for; selects the warnings shown before it.
 */
public enum TransactionKind {
  FUNDING("Funds will be locked in escrow until milestones are completed"),
  BID("Ensure you have sufficient balance to complete the project if your bid is accepted"),
  ESCROW("Escrow funds cannot be withdrawn until release conditions are met"),
  PAYMENT(null);

  private final String warning;

  TransactionKind(String warning) {
    this.warning = warning;
  }

  String warning() {
    return warning;
  }
}
