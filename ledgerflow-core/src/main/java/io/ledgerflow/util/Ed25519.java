package io.ledgerflow.util;

import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.Signature;
import java.security.interfaces.EdECPublicKey;
import java.security.spec.EdECPoint;
import java.security.spec.EdECPublicKeySpec;
import java.security.spec.NamedParameterSpec;

/**
 * Ed25519 verification against raw 32-byte keys, using the JDK provider.
 */
public final class Ed25519 {
  private static final int KEY_LENGTH = 32;

  private Ed25519() {
  }

  /**
   * Verifies {@code signature} over {@code message} with the key behind {@code accountId}.
   *
   * @return {@code false} for a wrong or malformed signature
   * @throws IllegalArgumentException if the account id is not a valid strkey
   */
  public static boolean verify(String accountId, byte[] message, byte[] signature) {
    PublicKey key = publicKey(StrKey.decodeAccountId(accountId));
    try {
      Signature verifier = Signature.getInstance("Ed25519");
      verifier.initVerify(key);
      verifier.update(message);
      return verifier.verify(signature);
    } catch (java.security.SignatureException e) {
      return false;
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Ed25519 is not available", e);
    }
  }

  /** Builds a JDK public key from the little-endian encoded curve point. */
  public static PublicKey publicKey(byte[] raw) {
    if (raw == null || raw.length != KEY_LENGTH) {
      throw new IllegalArgumentException("public key must be 32 bytes");
    }
    byte[] bigEndian = new byte[KEY_LENGTH];
    for (int i = 0; i < KEY_LENGTH; i++) {
      bigEndian[i] = raw[KEY_LENGTH - 1 - i];
    }
    boolean xOdd = (bigEndian[0] & 0x80) != 0;
    bigEndian[0] &= 0x7F;
    EdECPoint point = new EdECPoint(xOdd, new BigInteger(1, bigEndian));
    try {
      return KeyFactory.getInstance("Ed25519")
          .generatePublic(new EdECPublicKeySpec(NamedParameterSpec.ED25519, point));
    } catch (GeneralSecurityException e) {
      throw new IllegalArgumentException("invalid Ed25519 public key", e);
    }
  }

  /** Encodes a JDK Ed25519 public key into its raw 32-byte form. */
  public static byte[] rawPublicKey(EdECPublicKey key) {
    EdECPoint point = key.getPoint();
    byte[] y = point.getY().toByteArray();
    byte[] raw = new byte[KEY_LENGTH];
    // toByteArray is big-endian and may carry a leading sign byte
    for (int i = 0; i < KEY_LENGTH && i < y.length; i++) {
      raw[i] = y[y.length - 1 - i];
    }
    if (point.isXOdd()) {
      raw[KEY_LENGTH - 1] |= (byte) 0x80;
    }
    return raw;
  }
}
