package io.ledgerflow.escrow;

/**
 * How escrowed funds are released. The ledger stores the numeric code.
 */
public enum ReleaseType {
  TIME_BASED(0),
  MILESTONE_BASED(1);

  private final int code;

  ReleaseType(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public static ReleaseType fromCode(int code) {
    for (ReleaseType type : values()) {
      if (type.code == code) return type;
    }
    throw new IllegalArgumentException("Unknown release type: " + code);
  }
}
