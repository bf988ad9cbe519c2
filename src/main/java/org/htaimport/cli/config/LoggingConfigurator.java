package org.htaimport.cli.config;

import java.util.Map;

import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

/**
 * Applies per-logger levels from the {@code logging.levels} config block.
 * <p>
 * Example:
 * <pre>
 * logging {
 *   levels {
 *     "org.htaimport.datapipeline" = DEBUG
 *     "com.zaxxer.hikari" = WARN
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    public static void configure(Config config) {
        if (!config.hasPath("logging.levels")) {
            return;
        }
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        for (Map.Entry<String, ConfigValue> entry : config.getObject("logging.levels").entrySet()) {
            String loggerName = unquote(entry.getKey());
            String level = String.valueOf(entry.getValue().unwrapped());
            Logger logger = "ROOT".equalsIgnoreCase(loggerName)
                ? context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME)
                : context.getLogger(loggerName);
            logger.setLevel(Level.toLevel(level, Level.INFO));
        }
    }

    private static String unquote(String key) {
        if (key.length() >= 2 && key.startsWith("\"") && key.endsWith("\"")) {
            return key.substring(1, key.length() - 1);
        }
        return key;
    }
}
