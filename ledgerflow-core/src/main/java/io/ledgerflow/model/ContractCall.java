package io.ledgerflow.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One contract invocation inside a transaction. Argument order is preserved.
 */
public record ContractCall(String contractId, String function, Map<String, String> args) {
  public ContractCall {
    Objects.requireNonNull(contractId, "contractId");
    Objects.requireNonNull(function, "function");
    args = Collections.unmodifiableMap(new LinkedHashMap<>(args == null ? Map.of() : args));
  }

  public static ContractCall of(String contractId, String function, Map<String, String> args) {
    return new ContractCall(contractId, function, args);
  }
}
