package com.gentoro.specops.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Logger lookup for the analyzer and the bridge from {@code logging.level.*} keys to Logback. */
public final class LoggingService {
  private static final Logger log = LoggerFactory.getLogger(LoggingService.class);
  private static final String LEVEL_PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> clazz) {
    return LoggerFactory.getLogger(clazz);
  }

  /**
   * Sets one Logback level per key under {@code logging.level}; the key {@code root} addresses
   * the root logger, any other key is a logger name such as {@code com.gentoro.specops}.
   * Unknown level names are skipped with a warning and {@code logback.xml} stays in charge of
   * everything not listed.
   */
  public static void applyConfiguration(Configuration cfg) {
    if (cfg == null) return;
    Configuration levels = cfg.subset(LEVEL_PREFIX);
    if (levels.isEmpty()) return;
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext ctx)) {
      log.warn("Logback is not the active SLF4J backend; ignoring {} keys", LEVEL_PREFIX);
      return;
    }
    Iterator<String> keys = levels.getKeys();
    while (keys.hasNext()) {
      String key = keys.next();
      String name = "root".equalsIgnoreCase(key) ? Logger.ROOT_LOGGER_NAME : key;
      setLevel(ctx.getLogger(name), levels.getString(key, ""));
    }
  }

  private static void setLevel(ch.qos.logback.classic.Logger logger, String levelStr) {
    if (levelStr.isBlank()) return;
    Level level = Level.toLevel(levelStr.trim(), null);
    if (level == null) {
      log.warn("Unknown log level '{}' for logger {}", levelStr, logger.getName());
      return;
    }
    logger.setLevel(level);
    log.debug("Logger '{}' set to {}", logger.getName(), level);
  }
}
