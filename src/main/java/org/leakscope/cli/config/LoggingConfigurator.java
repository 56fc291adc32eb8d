package org.leakscope.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies the {@code logging} configuration block to Logback at runtime.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * logging {
 *   format = "PLAIN"        # "PLAIN" or "JSON", defaults to PLAIN
 *   default-level = "WARN"  # root logger level
 *   levels {
 *     "org.leakscope.parser" = "DEBUG"
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    /** Context and system property read by {@code logback.xml} to pick the appender. */
    public static final String FORMAT_PROPERTY = "leakscope.logging.format";

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);
    private static final String LOGGING_CONFIG_PATH = "logging";
    private static final String FORMAT_KEY = "format";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";

    private static boolean loggingConfigured = false;

    private LoggingConfigurator() {}

    /**
     * Configures logging from the given configuration. Calling it again has no effect until {@link #reset()}.
     *
     * @param config The application configuration.
     */
    public static void configure(final Config config) {
        if (loggingConfigured) {
            LOGGER.debug("Logging already configured, skipping.");
            return;
        }
        if (!config.hasPath(LOGGING_CONFIG_PATH)) {
            LOGGER.debug("No logging configuration found, using Logback defaults.");
            loggingConfigured = true;
            return;
        }

        try {
            final Config loggingConfig = config.getConfig(LOGGING_CONFIG_PATH);
            final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
            configureFormat(loggingConfig, context);
            configureDefaultLevel(loggingConfig, context);
            configureSpecificLevels(loggingConfig, context);
            LOGGER.debug("Logging configuration applied.");
        } catch (final RuntimeException e) {
            LOGGER.error("Failed to configure logging, using Logback defaults.", e);
        }
        loggingConfigured = true;
    }

    /**
     * @param format The configured format name.
     * @return The appender name {@code logback.xml} routes to for it.
     */
    public static String appenderFor(final String format) {
        return "JSON".equalsIgnoreCase(format) ? "STDOUT" : "STDOUT_PLAIN";
    }

    /**
     * Raises the root logger to DEBUG, for the {@code --verbose} switch.
     */
    public static void enableVerbose() {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.DEBUG);
    }

    private static void configureFormat(final Config loggingConfig, final LoggerContext context) {
        final String format = loggingConfig.hasPath(FORMAT_KEY) ? loggingConfig.getString(FORMAT_KEY) : "PLAIN";
        final String appender = appenderFor(format);
        context.putProperty(FORMAT_PROPERTY, appender);
        System.setProperty(FORMAT_PROPERTY, appender);
        LOGGER.debug("Configured logging format: {}", format);
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
        int configuredCount = 0;
        for (final Map.Entry<String, ConfigValue> entry : loggingConfig.getConfig(LEVELS_KEY).root().entrySet()) {
            final String loggerName = entry.getKey();
            final String levelName = entry.getValue().unwrapped().toString();
            context.getLogger(loggerName).setLevel(Level.toLevel(levelName));
            configuredCount++;
            LOGGER.debug("Configured logger '{}' to level: {}", loggerName, levelName);
        }
        LOGGER.debug("Configured {} specific logger levels.", configuredCount);
    }

    /**
     * Resets the configured flag so tests can apply a fresh configuration.
     */
    public static void reset() {
        loggingConfigured = false;
    }
}
