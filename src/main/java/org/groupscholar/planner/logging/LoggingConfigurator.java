package org.groupscholar.planner.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Configures planner runtime logging for CLI-driven runs.
 * <p><strong>Why:</strong> Lets operators see per-stage DEBUG output with {@code --verbose} without editing
 * {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for the single CLI bootstrap thread.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to a warning and keep their defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the root logger level to DEBUG within the running JVM.
   *
   * @return previous root level, or {@code null} when the backend is not Logback
   */
  public static Level enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      Level previous = root.getLevel();
      if (!Level.DEBUG.equals(previous)) {
        root.setLevel(Level.DEBUG);
      }
      return previous;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
    return null;
  }

  /**
   * Restores the root logger level, typically the value returned by {@link #enableVerboseLogging()}.
   *
   * @param level level to apply; {@code null} is ignored
   */
  public static void restoreRootLevel(Level level) {
    if (level == null) {
      return;
    }
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).setLevel(level);
    }
  }
}
