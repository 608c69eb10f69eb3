package org.cerespp.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runtime adjustments to the Logback configuration loaded from {@code logback.xml}.
 * <p><strong>Role:</strong> Called by the CLI entry points when {@code --verbose} is present.</p>
 * <p><strong>Thread-safety:</strong> Logback level changes are atomic; safe to call from any thread.</p>
 *
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Raises the root logger to {@code DEBUG} so per-step timings and fit diagnostics are printed.
   *
   * <p>Falls back to a warning when SLF4J is bound to a backend other than Logback.</p>
   */
  public static void enableVerboseLogging() {
    setRootLevel(Level.DEBUG);
  }

  /**
   * Sets the root logger level.
   *
   * @param level new level; ignored when {@code null}
   * @return {@code true} if the level was applied
   */
  public static boolean setRootLevel(Level level) {
    if (level == null) {
      return false;
    }
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!level.equals(root.getLevel())) {
        root.setLevel(level);
      }
      return true;
    }
    log.warn("Log level change to {} requested but backend {} does not support dynamic level updates",
        level, factory.getClass().getName());
    return false;
  }
}
