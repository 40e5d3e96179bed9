package ca.gc.cra.hvcbox.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Console output for command results (summaries, JSON dumps) and usage text.
 *
 * <p>Writes to the stdout file descriptor so results stay separate from log output.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  /**
   * Prints a single line to stdout.
   *
   * @param message line to emit
   */
  public static void println(String message) {
    PrintWriter writer = writer();
    writer.println(message);
    writer.flush();
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter writer() {
    return override != null ? override : STDOUT;
  }
}
