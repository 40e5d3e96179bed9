package ca.gc.cra.hvcbox.domain.hevc;

import ca.gc.cra.hvcbox.domain.io.BoxInput;
import ca.gc.cra.hvcbox.domain.io.BoxOutput;
import java.io.IOException;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * <strong>What:</strong> Length-prefixed opaque NAL unit carried inside an {@code hvcC} array.
 * <p><strong>Why:</strong> Parameter sets and SEI messages travel as raw bytes; this codec never interprets them.</p>
 * <p><strong>Role:</strong> Leaf value of the decoder configuration record.</p>
 * <p><strong>Thread-safety:</strong> Immutable; bytes are copied in and out.</p>
 *
 * @param bytes raw unit bytes, at most {@value #MAX_LENGTH}; copied on construction and on access
 * @since 0.1.0
 */
public record NalUnit(byte[] bytes) {
  /** Largest payload a 16-bit length prefix can describe. */
  public static final int MAX_LENGTH = 0xFFFF;

  private static final int LENGTH_PREFIX = 2;

  /**
   * Copies {@code bytes} and checks that the length fits the 16-bit prefix.
   */
  public NalUnit {
    bytes = bytes != null ? bytes.clone() : new byte[0];
    if (bytes.length > MAX_LENGTH) {
      throw new IllegalArgumentException(
          "NAL unit length must be at most " + MAX_LENGTH + " bytes (was " + bytes.length + ")");
    }
  }

  @Override
  public byte[] bytes() {
    return bytes.clone();
  }

  public int length() {
    return bytes.length;
  }

  /**
   * Returns the serialized size: 16-bit length prefix plus payload.
   *
   * @return {@code 2 + length()}
   */
  public int size() {
    return LENGTH_PREFIX + bytes.length;
  }

  /**
   * Reads a 16-bit length and then exactly that many bytes.
   *
   * @param in input positioned at the length prefix
   * @return decoded unit
   * @throws java.io.EOFException if the stream ends before the payload is complete
   * @throws IOException if reading fails
   */
  public static NalUnit read(BoxInput in) throws IOException {
    int length = in.readU16();
    return new NalUnit(in.readFully(length));
  }

  /**
   * Writes the 16-bit length followed by the payload.
   *
   * @param out destination
   * @return number of bytes written, equal to {@link #size()}
   * @throws IOException if writing fails
   */
  public int write(BoxOutput out) throws IOException {
    out.writeU16(bytes.length);
    out.write(bytes);
    return size();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof NalUnit that)) {
      return false;
    }
    return Arrays.equals(bytes, that.bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return "NalUnit{"
        + "length=" + bytes.length
        + ", bytes=" + HexFormat.of().formatHex(bytes)
        + '}';
  }
}
