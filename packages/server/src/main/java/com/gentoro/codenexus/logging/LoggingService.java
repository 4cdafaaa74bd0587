package com.gentoro.codenexus.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logger lookup plus the {@code logging.level.*} overrides from {@code application.yaml}.
 *
 * <p>Everything is written to stderr by {@code logback.xml}; stdout belongs to the MCP stdio
 * transport and must never receive log lines.
 */
public final class LoggingService {
  private static final Logger log = LoggerFactory.getLogger(LoggingService.class);

  static final String LEVEL_PREFIX = "logging.level";
  private static final String ROOT_KEY = "root";

  private LoggingService() {}

  public static Logger getLogger(Class<?> clazz) {
    return LoggerFactory.getLogger(clazz);
  }

  /**
   * Apply the levels configured under {@code logging.level}, for example:
   *
   * <pre>
   * logging:
   *   level:
   *     root: INFO
   *     com.gentoro.codenexus.query: DEBUG
   * </pre>
   *
   * Unknown level names are skipped with a warning; the levels from {@code logback.xml} stay in
   * effect for them.
   *
   * @return logger name to the level that was set, {@code ROOT} for the root logger
   */
  public static Map<String, Level> applyConfiguration(Configuration cfg) {
    Map<String, Level> applied = new LinkedHashMap<>();
    if (cfg == null) {
      return applied;
    }
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.warn(
          "Logging backend {} is not logback, ignoring {}.* settings",
          factory.getClass().getName(),
          LEVEL_PREFIX);
      return applied;
    }

    Iterator<String> keys = cfg.getKeys(LEVEL_PREFIX);
    while (keys.hasNext()) {
      String key = keys.next();
      if (key.length() <= LEVEL_PREFIX.length() + 1) {
        continue;
      }
      String loggerName = loggerName(key.substring(LEVEL_PREFIX.length() + 1));
      String value = cfg.getString(key, null);
      if (value == null || value.isBlank()) {
        continue;
      }
      Level level = Level.toLevel(value.trim(), null);
      if (level == null) {
        log.warn("Unknown log level '{}' for logger {}, ignoring", value, loggerName);
        continue;
      }
      context.getLogger(loggerName).setLevel(level);
      applied.put(loggerName, level);
    }
    if (!applied.isEmpty()) {
      log.debug("Applied configured log levels {}", applied);
    }
    return applied;
  }

  // Hierarchical configurations escape the dots of a key segment by doubling them.
  private static String loggerName(String key) {
    if (ROOT_KEY.equalsIgnoreCase(key)) {
      return Logger.ROOT_LOGGER_NAME;
    }
    return key.replace("..", ".");
  }
}
