package io.ledgerflow.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One balance line of an account. The native asset has code {@code "native"} and no issuer.
 */
public record AssetBalance(String code, String issuer, BigDecimal balance) {
  public static final String NATIVE = "native";

  public AssetBalance {
    Objects.requireNonNull(code, "code");
    Objects.requireNonNull(balance, "balance");
  }

  public boolean isNative() {
    return NATIVE.equals(code);
  }

  public boolean matches(String assetCode, String assetIssuer) {
    return code.equals(assetCode) && (assetIssuer == null || assetIssuer.equals(issuer));
  }
}
