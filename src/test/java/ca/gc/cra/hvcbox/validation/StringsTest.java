package ca.gc.cra.hvcbox.validation;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("in.mp4", Strings.requireNonBlank("in", "  in.mp4 "));
  }

  @Test
  void requireNonBlankRejectsBlankAndControl() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("in", "   "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("in", "a\u0000b"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("in", null));
  }

  @Test
  void requireHexAcceptsSeparators() {
    byte[] expected = {0x40, 0x01, (byte) 0xFF};
    assertArrayEquals(expected, Strings.requireHex("vps", "40 01 ff"));
    assertArrayEquals(expected, Strings.requireHex("vps", "40:01:FF"));
    assertArrayEquals(expected, Strings.requireHex("vps", "0x4001ff"));
    assertArrayEquals(new byte[0], Strings.requireHex("vps", " "));
  }

  @Test
  void requireHexRejectsMalformedText() {
    IllegalArgumentException odd = assertThrows(IllegalArgumentException.class,
        () -> Strings.requireHex("sps[0]", "abc"));
    assertTrue(odd.getMessage().startsWith("sps[0]"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireHex("sps[0]", "zz"));
  }
}
