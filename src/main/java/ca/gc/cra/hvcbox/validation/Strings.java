package ca.gc.cra.hvcbox.validation;

import java.util.HexFormat;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validation utilities for strings supplied through CLI arguments and configuration files.
 * <p><strong>Why:</strong> Rejects blank or control-character inputs before they reach file or codec layers.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject blank or control-character inputs.</li>
 *   <li>Decode hex-encoded NAL unit payloads used by build configurations.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 *
 * @implNote Control characters are detected via {@link Character#isISOControl(char)}.
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  private static final Pattern HEX_SEPARATORS = Pattern.compile("[\\s:]+");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Decodes a hex string into bytes, tolerating whitespace and colon separators.
   *
   * @param name logical parameter name for diagnostics
   * @param value hex text such as {@code "40 01 0c"} or {@code "40010c"}; must not be {@code null}
   * @return decoded bytes; empty when {@code value} contains only separators
   * @throws IllegalArgumentException if the text has an odd digit count or non-hex characters
   */
  public static byte[] requireHex(String name, String value) {
    Objects.requireNonNull(value, name == null ? "value" : name);
    String compact = HEX_SEPARATORS.matcher(value).replaceAll("");
    if (compact.startsWith("0x") || compact.startsWith("0X")) {
      compact = compact.substring(2);
    }
    if ((compact.length() & 1) != 0) {
      throw new IllegalArgumentException(message(name, "must contain an even number of hex digits"));
    }
    try {
      return HexFormat.of().parseHex(compact);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(message(name, "must only contain hex digits"), ex);
    }
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
