package ca.gc.cra.hvcbox.domain.io;

import static org.junit.jupiter.api.Assertions.*;

import java.io.EOFException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BoxInputTest {
  @TempDir Path tempDir;

  @Test
  void readsBigEndianScalars() throws Exception {
    byte[] bytes = {
        (byte) 0xFE,
        0x12, 0x34,
        (byte) 0xFF, (byte) 0xFF,
        (byte) 0x89, (byte) 0xAB, (byte) 0xCD, (byte) 0xEF,
        0, 0, 0, 0, 0, 0, 0x01, 0x02};
    try (BoxInput in = BoxInput.wrap(bytes)) {
      assertEquals(0xFE, in.readU8());
      assertEquals(0x1234, in.readU16());
      assertEquals(-1, in.readI16());
      assertEquals(0x89ABCDEFL, in.readU32());
      assertEquals(0x0102L, in.readU64());
      assertEquals(bytes.length, in.position());
    }
  }

  @Test
  void shortReadIsEofNotTruncation() throws Exception {
    try (BoxInput in = BoxInput.wrap(new byte[] {1, 2, 3})) {
      EOFException ex = assertThrows(EOFException.class, () -> in.readFully(4));
      assertTrue(ex.getMessage().contains("needed 4 bytes"));
    }
  }

  @Test
  void skipToMovesBackwardsAndForwards() throws Exception {
    try (BoxInput in = BoxInput.wrap(new byte[] {10, 11, 12, 13, 14})) {
      in.skipTo(3);
      assertEquals(13, in.readU8());
      in.skipTo(1);
      assertEquals(11, in.readU8());
      in.skipTo(5);
      assertEquals(5, in.position());
    }
  }

  @Test
  void skipPastEndFails() throws Exception {
    try (BoxInput in = BoxInput.wrap(new byte[4])) {
      assertThrows(EOFException.class, () -> in.skipTo(5));
      assertThrows(EOFException.class, () -> in.skip(10));
      assertEquals(0, in.position());
    }
  }

  @Test
  void boxStartSubtractsHeaderLength() throws Exception {
    try (BoxInput in = BoxInput.wrap(new byte[32])) {
      in.skipTo(20);
      assertEquals(12, in.boxStart(8));
    }
  }

  @Test
  void wrapCopiesSource() throws Exception {
    byte[] bytes = {7};
    try (BoxInput in = BoxInput.wrap(bytes)) {
      bytes[0] = 9;
      assertEquals(7, in.readU8());
    }
  }

  @Test
  void opensFiles() throws Exception {
    Path file = Files.write(tempDir.resolve("box.bin"), new byte[] {0, 0, 0, 42});
    try (BoxInput in = BoxInput.open(file)) {
      assertEquals(4, in.size());
      assertEquals(42L, in.readU32());
    }
  }
}
