package ca.gc.cra.hvcbox.api;

import ca.gc.cra.hvcbox.logging.LoggingConfigurator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HVCBOX CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: hvcbox <inspect|build> [options]";
  private static final String HELP_TEXT = """
      HVCBOX command dispatcher

      Usage:
        hvcbox <command> [options]

      Commands:
        inspect     Decode an hvc1 box and print its summary or JSON dump
        build       Encode an hvc1 box from a YAML descriptor

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to subcommand
      """;

  private Main() {}

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
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments (first token is the subcommand)
   * @return exit code reported by the delegated command
   */
  static ExitCode run(String[] args) {
    String[] safeArgs = args == null ? new String[0] : args;
    CliInput input = CliInput.parse(safeArgs);
    String[] remainder = input.keyValueArgs();
    if (remainder.length == 0) {
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    String command = remainder[0].toLowerCase(Locale.ROOT);
    String[] delegateArgs = withoutCommand(safeArgs, remainder[0]);

    return switch (command) {
      case "inspect" -> InspectCli.run(delegateArgs);
      case "build" -> BuildCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  // Flags stay in place so subcommands see --help, --verbose and their own switches.
  private static String[] withoutCommand(String[] args, String command) {
    List<String> out = new ArrayList<>(args.length);
    boolean removed = false;
    for (String arg : args) {
      if (!removed && arg != null && arg.trim().equals(command)) {
        removed = true;
        continue;
      }
      out.add(arg);
    }
    return out.toArray(String[]::new);
  }
}
