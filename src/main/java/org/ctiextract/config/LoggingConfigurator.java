package org.ctiextract.config;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;

import ch.qos.logback.classic.Level;

/**
 * Applies logger levels from the {@code logging} block of the library configuration:
 * <pre>
 * logging {
 *   default-level = INFO
 *   levels { "org.ctiextract.extract" = DEBUG }
 * }
 * </pre>
 * Only takes effect when Logback is the SLF4J backend.
 */
public final class LoggingConfigurator {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingConfigurator.class);

    private LoggingConfigurator() {
    }

    /**
     * @param libraryConfig The {@code cti-extract} block.
     * @throws IllegalArgumentException if a level is not a Logback level name.
     */
    public static void configure(Config libraryConfig) {
        if (libraryConfig.hasPath("logging.default-level")) {
            apply(Logger.ROOT_LOGGER_NAME, libraryConfig.getString("logging.default-level"));
        }
        if (!libraryConfig.hasPath("logging.levels")) {
            return;
        }
        for (Map.Entry<String, ConfigValue> entry : libraryConfig.getConfig("logging.levels").root().entrySet()) {
            ConfigValue value = entry.getValue();
            if (value.valueType() != ConfigValueType.STRING) {
                throw new IllegalArgumentException("Log level of '" + entry.getKey() + "' must be a string, got "
                    + value.valueType());
            }
            apply(entry.getKey(), (String) value.unwrapped());
        }
    }

    private static void apply(String loggerName, String levelName) {
        Level level = Level.toLevel(levelName, null);
        if (level == null) {
            throw new IllegalArgumentException("Unknown log level '" + levelName + "' for logger " + loggerName);
        }
        if (LoggerFactory.getLogger(loggerName) instanceof ch.qos.logback.classic.Logger logbackLogger) {
            logbackLogger.setLevel(level);
            LOG.debug("Set log level of {} to {}", loggerName, level);
        } else {
            LOG.warn("Logback is not the logging backend, ignoring level {} for {}", level, loggerName);
        }
    }
}
