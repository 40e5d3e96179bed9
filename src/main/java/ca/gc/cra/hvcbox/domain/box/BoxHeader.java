package ca.gc.cra.hvcbox.domain.box;

import ca.gc.cra.hvcbox.domain.io.BoxInput;
import ca.gc.cra.hvcbox.domain.io.BoxOutput;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * <strong>What:</strong> Type tag and declared size that prefix every ISO base media box.
 * <p><strong>Why:</strong> Decoders confirm nested box types and compute box boundaries from the header.</p>
 * <p><strong>Role:</strong> Framing primitive shared by all box codecs.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param type four-character box type, e.g. {@code hvcC}
 * @param size declared size in bytes, header included
 * @param largeSize {@code true} when the header carries a 64-bit {@code largesize} field
 * @since 0.1.0
 */
public record BoxHeader(String type, long size, boolean largeSize) {
  /** Size of the compact header: 32-bit size plus 4-byte type. */
  public static final int HEADER_SIZE = 8;
  /** Size of a header carrying a 64-bit {@code largesize}. */
  public static final int LARGE_HEADER_SIZE = 16;

  private static final long MAX_COMPACT_SIZE = 0xFFFF_FFFFL;

  /**
   * Validates the four-character type and the declared size.
   */
  public BoxHeader {
    Objects.requireNonNull(type, "type");
    if (type.length() != 4) {
      throw new IllegalArgumentException("box type must be 4 characters (was '" + type + "')");
    }
    if (size < (largeSize ? LARGE_HEADER_SIZE : HEADER_SIZE)) {
      throw new IllegalArgumentException("box size " + size + " is smaller than its header");
    }
  }

  /**
   * Creates a header for a box of {@code size} bytes, picking the compact form when it fits.
   *
   * @param type four-character box type
   * @param size total box size including the header
   * @return header ready to be written
   */
  public static BoxHeader of(String type, long size) {
    return new BoxHeader(type, size, size > MAX_COMPACT_SIZE);
  }

  /**
   * Returns the number of bytes this header occupies on the wire.
   *
   * @return {@value #HEADER_SIZE} or {@value #LARGE_HEADER_SIZE}
   */
  public int headerSize() {
    return largeSize ? LARGE_HEADER_SIZE : HEADER_SIZE;
  }

  /**
   * Returns the payload length, i.e. the declared size minus the header.
   *
   * @return content size in bytes
   */
  public long contentSize() {
    return size - headerSize();
  }

  /**
   * Tests whether this header carries the given box type.
   *
   * @param boxType expected type
   * @return {@code true} when the four-character codes match exactly
   */
  public boolean is(BoxType boxType) {
    return boxType.fourcc().equals(type);
  }

  /**
   * Reads a header at the current position.
   *
   * <p>A 32-bit size of {@code 1} is followed by a 64-bit {@code largesize}; a size of {@code 0}
   * means the box extends to the end of the stream.</p>
   *
   * @param in input positioned at the first header byte
   * @return decoded header
   * @throws MalformedBoxException if the type contains non-printable bytes or the size is smaller than the header
   * @throws IOException if reading fails
   */
  public static BoxHeader read(BoxInput in) throws IOException {
    long start = in.position();
    long size = in.readU32();
    byte[] rawType = in.readFully(4);
    for (byte b : rawType) {
      if (b < 0x20 || b > 0x7E) {
        throw new MalformedBoxException("Box type at offset " + start + " contains non-printable bytes");
      }
    }
    String type = new String(rawType, StandardCharsets.ISO_8859_1);
    boolean large = false;
    if (size == 1) {
      size = in.readU64();
      large = true;
    } else if (size == 0) {
      size = in.size() - start;
    }
    if (size < (large ? LARGE_HEADER_SIZE : HEADER_SIZE)) {
      throw new MalformedBoxException(
          "Box '" + type + "' at offset " + start + " declares size " + size + " smaller than its header");
    }
    return new BoxHeader(type, size, large);
  }

  /**
   * Writes this header at the current position.
   *
   * @param out destination
   * @return number of bytes written
   * @throws IOException if writing fails
   */
  public long write(BoxOutput out) throws IOException {
    if (largeSize) {
      out.writeU32(1);
      out.write(type.getBytes(StandardCharsets.ISO_8859_1));
      out.writeU64(size);
    } else {
      out.writeU32(size);
      out.write(type.getBytes(StandardCharsets.ISO_8859_1));
    }
    return headerSize();
  }
}
