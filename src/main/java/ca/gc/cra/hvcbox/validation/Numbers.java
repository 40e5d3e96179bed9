package ca.gc.cra.hvcbox.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by box constructors, configuration parsing, and the CLI.
 * <p><strong>Why:</strong> Box fields are narrow unsigned integers; values outside their bit width cannot be
 * represented on the wire and must be rejected before encoding.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Enforce inclusive numeric bounds.</li>
 *   <li>Express unsigned bit-width limits (u8, u16, 2-bit, 3-bit fields) as bounds.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.
 * <p><strong>Observability:</strong> Emits no logs; throws {@link IllegalArgumentException} when validation fails.
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name)
              + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates that a value fits in an unsigned field of {@code bits} bits.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate value
   * @param bits field width in bits, {@code 1..31}
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} is negative or needs more than {@code bits} bits
   */
  public static int requireUnsigned(String name, int value, int bits) {
    return (int) requireRange(name, value, 0, (1L << bits) - 1);
  }
}
