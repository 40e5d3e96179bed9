package ca.gc.cra.hvcbox.domain.hevc;

import ca.gc.cra.hvcbox.domain.box.Mp4Box;
import ca.gc.cra.hvcbox.domain.io.BoxOutput;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

/** Shared payloads and encoding helpers for box tests. */
public final class HevcFixtures {
  /** 24-byte sequence parameter set. */
  public static final byte[] SPS = {
      0x67, 0x64, 0x00, 0x1F, (byte) 0xAC, (byte) 0xD9, 0x40, 0x50,
      0x05, (byte) 0xBB, 0x01, 0x6A, 0x02, 0x02, 0x02, (byte) 0x80,
      0x00, 0x00, 0x03, 0x00, (byte) 0x80, 0x00, 0x00, 0x1E};
  /** 6-byte picture parameter set. */
  public static final byte[] PPS = {0x68, (byte) 0xEB, (byte) 0xE3, (byte) 0xCB, 0x22, (byte) 0xC0};

  private HevcFixtures() {}

  /** 1920x1080 descriptor with one SPS and one PPS. */
  public static HevcConfig fullHd() {
    return new HevcConfig(1920, 1080, List.of(), List.of(SPS), List.of(PPS), List.of());
  }

  public static byte[] encode(Mp4Box box) {
    ByteArrayOutputStream sink = new ByteArrayOutputStream();
    try (BoxOutput out = new BoxOutput(sink)) {
      box.write(out);
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
    return sink.toByteArray();
  }

  public static byte[] concat(byte[]... parts) {
    int length = 0;
    for (byte[] part : parts) {
      length += part.length;
    }
    byte[] joined = new byte[length];
    int offset = 0;
    for (byte[] part : parts) {
      System.arraycopy(part, 0, joined, offset, part.length);
      offset += part.length;
    }
    return joined;
  }

  public static void putU32(byte[] target, int offset, long value) {
    target[offset] = (byte) (value >>> 24);
    target[offset + 1] = (byte) (value >>> 16);
    target[offset + 2] = (byte) (value >>> 8);
    target[offset + 3] = (byte) value;
  }
}
