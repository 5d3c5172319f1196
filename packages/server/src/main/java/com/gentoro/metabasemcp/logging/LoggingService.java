package com.gentoro.metabasemcp.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single access point for loggers.
 *
 * <p>Log levels can be overridden from the application configuration under {@code logging.level},
 * using the logger name as the key suffix, e.g. {@code logging.level.com.gentoro.metabasemcp:
 * DEBUG} or {@code logging.level.root: WARN}.
 */
public final class LoggingService {
  private static final String LEVEL_PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /** Apply {@code logging.level.*} overrides. Unknown level names are ignored with a warning. */
  public static void applyConfiguration(Configuration configuration) {
    if (configuration == null) {
      return;
    }
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
      return;
    }
    Logger log = getLogger(LoggingService.class);
    Iterator<String> keys = configuration.getKeys(LEVEL_PREFIX);
    while (keys.hasNext()) {
      String key = keys.next();
      if (key.length() <= LEVEL_PREFIX.length() + 1) {
        continue;
      }
      String loggerName = key.substring(LEVEL_PREFIX.length() + 1);
      String levelName = configuration.getString(key);
      Level level = Level.toLevel(levelName, null);
      if (level == null) {
        log.warn("Ignoring unknown log level '{}' for logger '{}'", levelName, loggerName);
        continue;
      }
      String target =
          "root".equalsIgnoreCase(loggerName) ? org.slf4j.Logger.ROOT_LOGGER_NAME : loggerName;
      context.getLogger(target).setLevel(level);
      log.trace("Log level for {} set to {}", target, level);
    }
  }
}
