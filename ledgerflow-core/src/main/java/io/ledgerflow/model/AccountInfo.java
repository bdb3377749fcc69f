package io.ledgerflow.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Snapshot of a ledger account: its current sequence number and balance lines.
 */
public record AccountInfo(String address, long sequence, List<AssetBalance> balances) {
  public AccountInfo {
    Objects.requireNonNull(address, "address");
    balances = List.copyOf(balances);
  }

  /**
   * Finds the balance line (trustline) for an asset. An empty result means the account
   * cannot hold the asset yet.
   */
  public Optional<AssetBalance> balance(String assetCode, String assetIssuer) {
    return balances.stream().filter(b -> b.matches(assetCode, assetIssuer)).findFirst();
  }
}
