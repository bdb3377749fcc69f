package io.ledgerflow.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StrKeyTest {

  private static final String ZERO_ACCOUNT = "GAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAWHF";

  @Test
  void encodesKnownVectors() {
    assertEquals(ZERO_ACCOUNT, StrKey.encodeAccountId(new byte[32]));

    byte[] counting = new byte[32];
    for (int i = 0; i < 32; i++) {
      counting[i] = (byte) i;
    }
    assertEquals("GAAACAQDAQCQMBYIBEFAWDANBYHRAEISCMKBKFQXDAMRUGY4DUPB7JZX", StrKey.encodeAccountId(counting));
    assertArrayEquals(counting, StrKey.decodeAccountId("GAAACAQDAQCQMBYIBEFAWDANBYHRAEISCMKBKFQXDAMRUGY4DUPB7JZX"));
  }

  @Test
  void rejectsMalformedIds() {
    assertTrue(StrKey.isValidAccountId(ZERO_ACCOUNT));
    assertFalse(StrKey.isValidAccountId(null));
    assertFalse(StrKey.isValidAccountId("GABC"));
    assertFalse(StrKey.isValidAccountId(ZERO_ACCOUNT.substring(0, 55) + "G"));
    assertFalse(StrKey.isValidAccountId("S" + ZERO_ACCOUNT.substring(1)));
    assertThrows(IllegalArgumentException.class, () -> StrKey.encodeAccountId(new byte[31]));
  }
}
