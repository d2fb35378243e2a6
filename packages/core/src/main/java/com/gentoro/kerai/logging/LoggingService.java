package com.gentoro.kerai.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Central place to obtain SLF4J loggers and to apply level overrides from configuration. */
public final class LoggingService {
  private static final Logger log = LoggerFactory.getLogger(LoggingService.class);

  private LoggingService() {}

  public static Logger getLogger(Class<?> clazz) {
    return LoggerFactory.getLogger(clazz);
  }

  /**
   * Apply logger levels from the {@code logging.level} subtree, e.g.
   *
   * <pre>
   * logging:
   *   level:
   *     root: INFO
   *     com.gentoro.kerai.crdt: DEBUG
   * </pre>
   *
   * Unknown levels are ignored with a warning; logback.xml remains the baseline.
   */
  public static void applyConfiguration(Configuration cfg) {
    if (cfg == null) return;
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext ctx)) {
      log.debug("Logging backend is not logback; skipping level overrides");
      return;
    }
    Configuration levels = cfg.subset("logging.level");
    Iterator<String> it = levels.getKeys();
    while (it.hasNext()) {
      String key = it.next();
      String lvl = levels.getString(key, null);
      if (lvl == null || lvl.isBlank()) continue;
      // Dotted YAML keys come back with the delimiter escaped as "..".
      String name =
          "root".equalsIgnoreCase(key) ? Logger.ROOT_LOGGER_NAME : key.replace("..", ".");
      setLevel(ctx.getLogger(name), lvl);
    }
  }

  private static void setLevel(ch.qos.logback.classic.Logger logger, String levelStr) {
    Level level = Level.toLevel(levelStr.trim(), null);
    if (level == null) {
      log.warn("Unknown log level '{}'; ignoring for logger {}", levelStr, logger.getName());
      return;
    }
    logger.setLevel(level);
    log.debug("Set logger '{}' to level {}", logger.getName(), level);
  }
}
