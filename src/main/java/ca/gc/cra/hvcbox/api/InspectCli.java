package ca.gc.cra.hvcbox.api;

import ca.gc.cra.hvcbox.application.SampleEntryUseCase;
import ca.gc.cra.hvcbox.domain.box.MalformedBoxException;
import ca.gc.cra.hvcbox.domain.hevc.Hvc1SampleEntry;
import ca.gc.cra.hvcbox.infrastructure.json.BoxJsonWriter;
import ca.gc.cra.hvcbox.logging.LoggingConfigurator;
import ca.gc.cra.hvcbox.validation.Numbers;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CLI command that decodes one {@code hvc1} box from a file and prints its summary or JSON dump.
 */
public final class InspectCli {
  private static final Logger log = LoggerFactory.getLogger(InspectCli.class);
  private static final String SUMMARY_USAGE =
      "usage: inspect in=FILE [offset=0 format=summary|json] [--pretty]";
  private static final String HELP_TEXT = """
      HVCBOX inspect

      Usage:
        inspect in=FILE [offset=0 format=summary|json] [--pretty]

      Required options:
        in=FILE                    File holding an hvc1 box

      Common options:
        offset=N                   Byte offset of the hvc1 box header (default 0)
        format=summary|json        One-line summary or full structural dump (default summary)
        --pretty                   Indent JSON output
        --help                     Show detailed help
        --verbose                  Enable DEBUG logging for troubleshooting

      Example:
        inspect in=./track1.hvc1 format=json --pretty
      """;

  private InspectCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the command and returns the resulting exit code.
   *
   * @param args command-line arguments
   * @return exit code for the inspection
   */
  public static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for inspect CLI");
    }

    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String inRaw = kv.get("in");
    if (inRaw == null) {
      log.error("Missing required argument in=FILE");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    Path in = Path.of(inRaw);
    if (!Files.isRegularFile(in) || !Files.isReadable(in)) {
      log.error("Input file {} does not exist or is not readable", in);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    long offset;
    try {
      offset = Numbers.requireRange("offset", Long.parseLong(kv.getOrDefault("offset", "0")), 0, Long.MAX_VALUE);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid offset value: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String format = kv.getOrDefault("format", "summary").toLowerCase(Locale.ROOT);
    if (!format.equals("summary") && !format.equals("json")) {
      log.error("Invalid format value: {}", format);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Hvc1SampleEntry entry;
    try {
      entry = new SampleEntryUseCase().inspect(in, offset);
    } catch (MalformedBoxException ex) {
      log.error("Malformed hvc1 box in {}: {}", in, ex.getMessage());
      return ExitCode.MALFORMED_INPUT;
    } catch (IOException ex) {
      log.error("Failed to read {} due to I/O error", in, ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure during inspect", ex);
      return ExitCode.RUNTIME_FAILURE;
    }

    if (format.equals("json")) {
      CliPrinter.println(new BoxJsonWriter(input.hasFlag("--pretty")).toJson(entry));
    } else {
      CliPrinter.println(entry.summary() + " " + entry.hvcC().summary());
    }
    return ExitCode.SUCCESS;
  }
}
