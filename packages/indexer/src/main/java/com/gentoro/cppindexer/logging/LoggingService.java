package com.gentoro.cppindexer.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single access point for loggers. Levels declared under {@code logging.level} in the
 * application configuration are pushed into Logback by {@link #applyConfiguration}.
 *
 * <pre>
 * logging:
 *   level:
 *     root: INFO
 *     com.gentoro.cppindexer.incremental: DEBUG
 * </pre>
 */
public final class LoggingService {
  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  public static void applyConfiguration(Configuration configuration) {
    if (configuration == null) return;
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      return;
    }

    Configuration levels = configuration.subset("logging.level");
    Iterator<String> keys = levels.getKeys();
    while (keys.hasNext()) {
      String key = keys.next();
      String value = levels.getString(key);
      Level level = Level.toLevel(value, null);
      // YAML keys containing dots come back escaped as '..'
      String loggerName = key.replace("..", ".");
      if (level == null) {
        getLogger(LoggingService.class)
            .warn("Ignoring unknown log level '{}' for logger '{}'", value, loggerName);
        continue;
      }
      if ("root".equalsIgnoreCase(loggerName)) {
        loggerName = Logger.ROOT_LOGGER_NAME;
      }
      context.getLogger(loggerName).setLevel(level);
    }
  }
}
