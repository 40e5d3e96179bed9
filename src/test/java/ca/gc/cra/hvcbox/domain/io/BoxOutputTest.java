package ca.gc.cra.hvcbox.domain.io;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import org.junit.jupiter.api.Test;

class BoxOutputTest {

  @Test
  void writesBigEndianAndCountsBytes() throws Exception {
    ByteArrayOutputStream sink = new ByteArrayOutputStream();
    try (BoxOutput out = new BoxOutput(sink)) {
      out.writeU8(0x1FF);
      out.writeU16(0xF000);
      out.writeI16((short) -1);
      out.writeU32(0x00480000L);
      out.writeU64(1L);
      out.write(new byte[] {9, 8});
      assertEquals(1 + 2 + 2 + 4 + 8 + 2, out.count());
    }
    assertArrayEquals(new byte[] {
        (byte) 0xFF,
        (byte) 0xF0, 0x00,
        (byte) 0xFF, (byte) 0xFF,
        0x00, 0x48, 0x00, 0x00,
        0, 0, 0, 0, 0, 0, 0, 1,
        9, 8}, sink.toByteArray());
  }

  @Test
  void writeZerosSpansSeveralChunks() throws Exception {
    ByteArrayOutputStream sink = new ByteArrayOutputStream();
    try (BoxOutput out = new BoxOutput(sink)) {
      out.writeU8(1);
      out.writeZeros(150);
      assertEquals(151, out.count());
    }
    byte[] bytes = sink.toByteArray();
    assertEquals(151, bytes.length);
    for (int i = 1; i < bytes.length; i++) {
      assertEquals(0, bytes[i]);
    }
  }
}
