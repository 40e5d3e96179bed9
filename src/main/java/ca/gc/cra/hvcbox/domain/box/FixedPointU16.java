package ca.gc.cra.hvcbox.domain.box;

/**
 * Unsigned 16.16 fixed-point number as stored in sample-entry resolution fields.
 *
 * @param raw 32-bit raw representation; the upper 16 bits are the integer part
 * @since 0.1.0
 */
public record FixedPointU16(long raw) {
  private static final long MAX_RAW = 0xFFFF_FFFFL;

  /**
   * Validates that {@code raw} fits in 32 unsigned bits.
   */
  public FixedPointU16 {
    if (raw < 0 || raw > MAX_RAW) {
      throw new IllegalArgumentException("raw value must fit in 32 unsigned bits (was " + raw + ")");
    }
  }

  /**
   * Creates a value with the given integer part and a zero fraction.
   *
   * @param integer integer part in {@code [0, 65535]}
   * @return fixed-point value
   */
  public static FixedPointU16 of(int integer) {
    if (integer < 0 || integer > 0xFFFF) {
      throw new IllegalArgumentException("integer part must be between 0 and 65535 (was " + integer + ")");
    }
    return new FixedPointU16((long) integer << 16);
  }

  public static FixedPointU16 ofRaw(long raw) {
    return new FixedPointU16(raw);
  }

  public int integer() {
    return (int) (raw >>> 16);
  }

  public int fraction() {
    return (int) (raw & 0xFFFF);
  }

  public double doubleValue() {
    return raw / 65536.0;
  }

  @Override
  public String toString() {
    return Double.toString(doubleValue());
  }
}
