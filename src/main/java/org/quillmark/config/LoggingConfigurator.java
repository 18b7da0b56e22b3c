package org.quillmark.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigUtil;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies the logging settings of the HOCON configuration to Logback at runtime.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * logging {
 *   default-level = "WARN"  # Default log level for all loggers
 *   levels {
 *     # Specific logger levels, overriding the default for particular components
 *     "org.quillmark.rewrite" = "DEBUG"
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);
    private static final String LOGGING_CONFIG_PATH = "logging";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";

    private LoggingConfigurator() {}

    /**
     * Configures the logging system based on the provided configuration.
     * Settings that are not present leave the Logback defaults untouched.
     *
     * @param config The application configuration containing logging settings.
     */
    public static void configure(final Config config) {
        if (!config.hasPath(LOGGING_CONFIG_PATH)) {
            LOGGER.debug("No logging configuration found, using Logback defaults.");
            return;
        }
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            LOGGER.debug("Logback is not the active SLF4J binding, skipping logging configuration.");
            return;
        }

        try {
            final Config loggingConfig = config.getConfig(LOGGING_CONFIG_PATH);
            configureDefaultLevel(loggingConfig, context);
            configureSpecificLevels(loggingConfig, context);
            LOGGER.debug("Logging configuration applied successfully.");
        } catch (final ConfigException e) {
            LOGGER.error("Failed to configure logging, using Logback defaults.", e);
        }
    }

    private static void configureDefaultLevel(final Config loggingConfig, final LoggerContext context) {
        if (loggingConfig.hasPath(DEFAULT_LEVEL_KEY)) {
            final Level level = Level.toLevel(loggingConfig.getString(DEFAULT_LEVEL_KEY), Level.WARN);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
            LOGGER.debug("Configured default log level: {}", level);
        }
    }

    private static void configureSpecificLevels(final Config loggingConfig, final LoggerContext context) {
        if (!loggingConfig.hasPath(LEVELS_KEY)) {
            return;
        }

        final Config levelsConfig = loggingConfig.getConfig(LEVELS_KEY);
        int configuredCount = 0;
        for (final Map.Entry<String, ConfigValue> entry : levelsConfig.entrySet()) {
            // quoted ("org.quillmark.css") and nested keys both name the same logger
            final String loggerName = String.join(".", ConfigUtil.splitPath(entry.getKey()));
            final String levelName = String.valueOf(entry.getValue().unwrapped());
            final Level level = Level.toLevel(levelName, null);
            if (level == null) {
                LOGGER.warn("Unknown log level '{}' for logger '{}'", levelName, loggerName);
                continue;
            }
            context.getLogger(loggerName).setLevel(level);
            configuredCount++;
            LOGGER.debug("Configured logger '{}' to level: {}", loggerName, level);
        }
        LOGGER.debug("Configured {} specific logger levels.", configuredCount);
    }
}
