package ca.gc.cra.hvcbox.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts HVCBOX logging for CLI runs.
 * <p><strong>Why:</strong> {@code --verbose} surfaces codec DEBUG output (skipped arrays, realignment) without
 * editing {@code logback.xml}.
 * <p><strong>Thread-safety:</strong> Intended for single-threaded CLI startup.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to a warning and keep their defaults.
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Lowers the root logger level to DEBUG within the running JVM.
   */
  public static void enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!Level.DEBUG.equals(root.getLevel())) {
        root.setLevel(Level.DEBUG);
      }
      return;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
  }
}
