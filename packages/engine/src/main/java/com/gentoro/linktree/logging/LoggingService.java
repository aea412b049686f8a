package com.gentoro.linktree.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logger factory for the link tree engine and the bridge from {@code logging.level.*} keys in
 * {@code application.yaml} to Logback.
 *
 * <p>Levels are applied once at startup, after {@code logback.xml} has configured the appenders:
 *
 * <pre>
 * logging:
 *   level:
 *     root: INFO
 *     com.gentoro.linktree.storage: DEBUG
 * </pre>
 */
public final class LoggingService {
  static final String LEVELS_PREFIX = "logging.level";

  private static final Logger log = LoggerFactory.getLogger(LoggingService.class);

  private LoggingService() {}

  public static Logger getLogger(Class<?> clazz) {
    return LoggerFactory.getLogger(clazz);
  }

  /**
   * Push the configured levels into the Logback context. Unknown level names are skipped with a
   * warning; when the SLF4J binding is not Logback the call only logs and returns.
   *
   * @return number of loggers whose level was changed
   */
  public static int applyConfiguration(Configuration cfg) {
    if (cfg == null) return 0;
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext ctx)) {
      log.warn("SLF4J is not bound to Logback, keeping default log levels");
      return 0;
    }

    int applied = 0;
    Configuration levels = cfg.subset(LEVELS_PREFIX);
    Iterator<String> keys = levels.getKeys();
    while (keys.hasNext()) {
      String name = keys.next();
      String level = levels.getString(name, "");
      String loggerName = "root".equalsIgnoreCase(name) ? Logger.ROOT_LOGGER_NAME : name;
      if (!level.isBlank() && setLevel(ctx.getLogger(loggerName), level)) {
        applied++;
      }
    }
    return applied;
  }

  private static boolean setLevel(ch.qos.logback.classic.Logger logger, String levelName) {
    Level level = Level.toLevel(levelName.trim(), null);
    if (level == null) {
      log.warn("Unknown log level '{}' for logger {}, ignored", levelName, logger.getName());
      return false;
    }
    logger.setLevel(level);
    log.debug("Logger '{}' set to {}", logger.getName(), level);
    return true;
  }
}
