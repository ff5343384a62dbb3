package ca.gc.cra.helio.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts HELIO logging for CLI-driven runs.
 * <p><strong>Why:</strong> Lets operators see per-channel request and timestamp detail without editing
 * {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded CLI startup.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings log a warning and keep their defaults.
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  /** Logger name covering every HELIO class. */
  public static final String HELIO_LOGGER = "ca.gc.cra.helio";

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Raises HELIO loggers to DEBUG; third-party libraries keep their configured levels.
   */
  public static void enableVerboseLogging() {
    setLevel(HELIO_LOGGER, Level.DEBUG);
  }

  /**
   * Returns the effective level of the HELIO logger hierarchy.
   *
   * @return effective level name, or {@code null} when the backend is not Logback
   */
  public static String effectiveHelioLevel() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      return context.getLogger(HELIO_LOGGER).getEffectiveLevel().toString();
    }
    return null;
  }

  private static void setLevel(String loggerName, Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger logger = context.getLogger(loggerName);
      if (!level.equals(logger.getLevel())) {
        logger.setLevel(level);
      }
      return;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
  }
}
