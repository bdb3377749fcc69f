package io.ledgerflow.model;

import java.util.Optional;

/**
 * Outcome of a submitted transaction.
 *
 * @param hash        transaction hash
 * @param success     whether the ledger applied it
 * @param ledger      ledger sequence it was included in (0 if not applied)
 * @param resultCode  ledger result code for failures, e.g. {@code tx_bad_seq}
 * @param returnValue contract return value, if any (e.g. the id of a created contract)
 */
public record SubmitResult(String hash, boolean success, long ledger, String resultCode, String returnValue) {

  public Optional<String> returned() {
    return Optional.ofNullable(returnValue);
  }
}
