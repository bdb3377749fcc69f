package io.ledgerflow.balance;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of a balance sufficiency check.
 *
 * @param valid        whether the effective balance covers the required amount
 * @param available    the raw balance (before the reserve)
 * @param required     the amount asked for, as given
 * @param shortfall    what is missing, two decimals, for insufficient balances
 * @param message      human-readable summary
 * @param needsDeposit whether topping up would fix it
 * @param needsSetup   whether the account lacks a trustline for the asset
 */
public record BalanceCheck(boolean valid, String available, String required, String shortfall,
                           String message, boolean needsDeposit, boolean needsSetup) {
  public BalanceCheck {
    Objects.requireNonNull(available, "available");
    Objects.requireNonNull(required, "required");
    Objects.requireNonNull(message, "message");
  }

  public Optional<String> shortfallAmount() {
    return Optional.ofNullable(shortfall);
  }
}
