package io.ledgerflow.model;

import java.util.Map;
import java.util.Optional;

/**
 * Reply from the escrow/bid backend. A mutating call either completed on its own
 * ({@code transactionHash} set) or handed back an envelope the caller must sign and submit.
 */
public record BackendResponse(String transactionHash, String unsignedEnvelope, Map<String, String> data) {
  public BackendResponse {
    data = data == null ? Map.of() : Map.copyOf(data);
  }

  public Optional<String> hash() {
    return Optional.ofNullable(transactionHash);
  }

  public Optional<String> envelope() {
    return Optional.ofNullable(unsignedEnvelope);
  }
}
