package io.ledgerflow.crowdfunding;

import java.util.Optional;

/**
 * Pool status. A pool leaves {@link #FUNDING} exactly once.
 */
public enum PoolStatus {
  FUNDING(0),
  FUNDED(1),
  FAILED(2);

  private final int code;

  PoolStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public static Optional<PoolStatus> fromCode(int code) {
    for (PoolStatus status : values()) {
      if (status.code == code) return Optional.of(status);
    }
    return Optional.empty();
  }
}
