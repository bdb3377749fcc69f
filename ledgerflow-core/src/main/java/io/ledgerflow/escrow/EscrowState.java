package io.ledgerflow.escrow;

import java.util.Optional;

/**
 * Escrow lifecycle status. {@link #COMPLETED}, {@link #DISPUTED} and {@link #CANCELLED}
 * end the lifecycle; an escrow is never deleted.
 */
public enum EscrowState {
  ACTIVE(0),
  COMPLETED(1),
  DISPUTED(2),
  CANCELLED(3);

  private final int code;

  EscrowState(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public boolean isTerminal() {
    return this != ACTIVE;
  }

  public static Optional<EscrowState> fromCode(int code) {
    for (EscrowState state : values()) {
      if (state.code == code) return Optional.of(state);
    }
    return Optional.empty();
  }
}
