package ca.gc.cra.hvcbox.api;

import ca.gc.cra.hvcbox.application.SampleEntryUseCase;
import ca.gc.cra.hvcbox.config.HevcConfigLoader;
import ca.gc.cra.hvcbox.domain.hevc.HevcConfig;
import ca.gc.cra.hvcbox.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CLI command that builds an {@code hvc1} box from a YAML descriptor and writes it to a file.
 */
public final class BuildCli {
  private static final Logger log = LoggerFactory.getLogger(BuildCli.class);
  private static final String SUMMARY_USAGE = "usage: build config=FILE.yaml out=FILE";
  private static final String HELP_TEXT = """
      HVCBOX build

      Usage:
        build config=FILE.yaml out=FILE

      Required options:
        config=FILE.yaml           Descriptor with width, height and hex vps/sps/pps/sei lists
        out=FILE                   Destination file; replaced if it exists

      Common options:
        --help                     Show detailed help
        --verbose                  Enable DEBUG logging for troubleshooting

      Example:
        build config=./track1.yaml out=./track1.hvc1
      """;

  private BuildCli() {}

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
   * @return exit code for the build
   */
  public static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for build CLI");
    }

    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String configRaw = kv.get("config");
    String outRaw = kv.get("out");
    if (configRaw == null || outRaw == null) {
      log.error("Missing required argument{}", configRaw == null ? " config=FILE.yaml" : " out=FILE");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    Path out = Path.of(outRaw);
    Path parent = out.toAbsolutePath().getParent();
    if (parent == null || !Files.isDirectory(parent) || Files.isDirectory(out)) {
      log.error("Output path {} is not a file in an existing directory", out);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Path configPath = Path.of(configRaw);
    HevcConfig config;
    try {
      Optional<HevcConfig> loaded = HevcConfigLoader.load(configPath);
      if (loaded.isEmpty()) {
        log.error("Config file {} not found", configPath);
        return ExitCode.CONFIG_ERROR;
      }
      config = loaded.get();
    } catch (IllegalArgumentException ex) {
      log.error("Invalid build configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Failed to read config {} due to I/O error", configPath, ex);
      return ExitCode.IO_ERROR;
    }

    long written;
    try {
      written = new SampleEntryUseCase().build(config, out);
    } catch (IOException ex) {
      log.error("Failed to write {} due to I/O error", out, ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Configuration cannot be encoded: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure during build", ex);
      return ExitCode.RUNTIME_FAILURE;
    }

    CliPrinter.println("wrote " + written + " bytes to " + out);
    return ExitCode.SUCCESS;
  }
}
