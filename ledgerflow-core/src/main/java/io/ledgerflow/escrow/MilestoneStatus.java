package io.ledgerflow.escrow;

public enum MilestoneStatus {
  PENDING("pending"),
  IN_PROGRESS("in_progress"),
  COMPLETED("completed"),
  APPROVED("approved");

  private final String wire;

  MilestoneStatus(String wire) {
    this.wire = wire;
  }

  public String wire() {
    return wire;
  }

  public static MilestoneStatus fromWire(String value) {
    for (MilestoneStatus status : values()) {
      if (status.wire.equals(value)) return status;
    }
    throw new IllegalArgumentException("Unknown milestone status: " + value);
  }
}
