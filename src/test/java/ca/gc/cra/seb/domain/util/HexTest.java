package ca.gc.cra.seb.domain.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class HexTest {

  @Test
  void encodesLowercase() {
    assertEquals("00ff7f", Hex.encode(new byte[] {0, (byte) 0xFF, 0x7F}));
    assertEquals("", Hex.encode(new byte[0]));
  }

  @Test
  void recognizesSha256Digests() {
    assertTrue(Hex.isSha256Hex("a".repeat(64)));
    assertTrue(Hex.isSha256Hex("ABCDEF0123456789".repeat(4)));
    assertFalse(Hex.isSha256Hex("a".repeat(63)));
    assertFalse(Hex.isSha256Hex("g".repeat(64)));
    assertFalse(Hex.isSha256Hex(null));
  }
}
