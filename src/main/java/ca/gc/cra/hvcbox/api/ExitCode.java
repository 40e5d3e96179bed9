package ca.gc.cra.hvcbox.api;

/**
 * <strong>What:</strong> Exit codes shared by HVCBOX command-line tools.
 * <p><strong>Why:</strong> Lets scripts distinguish bad arguments, unreadable files, and malformed boxes.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** IO failure occurred while reading or writing a file. */
  IO_ERROR(3),
  /** Configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** Input bytes were not a well-formed box. */
  MALFORMED_INPUT(6);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value reported to the operating system.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
