package io.ledgerflow.util;

import java.util.Arrays;

/**
 * Account addresses in the ledger's "strkey" form: base32 of a version byte,
 * the 32-byte Ed25519 public key and a CRC16-XModem checksum (little-endian).
 * Account ids start with {@code G}.
 */
public final class StrKey {
  private static final byte ACCOUNT_ID_VERSION = (byte) (6 << 3);
  private static final char[] ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ234567".toCharArray();
  private static final int KEY_LENGTH = 32;
  private static final int ENCODED_LENGTH = 56;

  private StrKey() {
  }

  public static String encodeAccountId(byte[] publicKey) {
    if (publicKey == null || publicKey.length != KEY_LENGTH) {
      throw new IllegalArgumentException("public key must be 32 bytes");
    }
    byte[] payload = new byte[1 + KEY_LENGTH + 2];
    payload[0] = ACCOUNT_ID_VERSION;
    System.arraycopy(publicKey, 0, payload, 1, KEY_LENGTH);
    int crc = crc16(payload, 0, 1 + KEY_LENGTH);
    payload[1 + KEY_LENGTH] = (byte) (crc & 0xFF);
    payload[2 + KEY_LENGTH] = (byte) ((crc >>> 8) & 0xFF);
    return base32(payload);
  }

  /**
   * Decodes an account id into its raw public key.
   *
   * @throws IllegalArgumentException if the address is malformed or the checksum is wrong
   */
  public static byte[] decodeAccountId(String accountId) {
    if (accountId == null || accountId.length() != ENCODED_LENGTH) {
      throw new IllegalArgumentException("account id must be 56 characters");
    }
    byte[] payload = unbase32(accountId);
    if (payload.length != 1 + KEY_LENGTH + 2) {
      throw new IllegalArgumentException("account id has wrong payload length");
    }
    if (payload[0] != ACCOUNT_ID_VERSION) {
      throw new IllegalArgumentException("not an account id: " + accountId.charAt(0));
    }
    int expected = (payload[1 + KEY_LENGTH] & 0xFF) | ((payload[2 + KEY_LENGTH] & 0xFF) << 8);
    if (crc16(payload, 0, 1 + KEY_LENGTH) != expected) {
      throw new IllegalArgumentException("account id checksum mismatch");
    }
    return Arrays.copyOfRange(payload, 1, 1 + KEY_LENGTH);
  }

  public static boolean isValidAccountId(String accountId) {
    try {
      decodeAccountId(accountId);
      return true;
    } catch (IllegalArgumentException e) {
      return false;
    }
  }

  static int crc16(byte[] data, int offset, int length) {
    int crc = 0;
    for (int i = offset; i < offset + length; i++) {
      crc ^= (data[i] & 0xFF) << 8;
      for (int bit = 0; bit < 8; bit++) {
        crc = (crc & 0x8000) != 0 ? (crc << 1) ^ 0x1021 : crc << 1;
      }
      crc &= 0xFFFF;
    }
    return crc;
  }

  private static String base32(byte[] data) {
    StringBuilder sb = new StringBuilder((data.length * 8 + 4) / 5);
    int buffer = 0;
    int bits = 0;
    for (byte b : data) {
      buffer = (buffer << 8) | (b & 0xFF);
      bits += 8;
      while (bits >= 5) {
        sb.append(ALPHABET[(buffer >>> (bits - 5)) & 0x1F]);
        bits -= 5;
      }
    }
    if (bits > 0) {
      sb.append(ALPHABET[(buffer << (5 - bits)) & 0x1F]);
    }
    return sb.toString();
  }

  private static byte[] unbase32(String text) {
    byte[] out = new byte[text.length() * 5 / 8];
    int buffer = 0;
    int bits = 0;
    int index = 0;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      int value;
      if (c >= 'A' && c <= 'Z') {
        value = c - 'A';
      } else if (c >= '2' && c <= '7') {
        value = c - '2' + 26;
      } else {
        throw new IllegalArgumentException("invalid base32 character: " + c);
      }
      buffer = (buffer << 5) | value;
      bits += 5;
      if (bits >= 8) {
        out[index++] = (byte) ((buffer >>> (bits - 8)) & 0xFF);
        bits -= 8;
      }
    }
    return out;
  }
}
