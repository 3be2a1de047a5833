package org.ppvariant.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies log levels from the {@code logging} section of the configuration to Logback.
 * Logger names contain dots and must be quoted so HOCON does not split them into paths.
 * <pre>
 * logging {
 *   default-level = "WARN"
 *   levels { "org.ppvariant.compiler" = "DEBUG" }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    /**
     * Sets the root level and any per-logger levels found in the configuration.
     * Unknown level names fall back to DEBUG, as Logback's own parser does.
     *
     * @param config The resolved configuration.
     */
    public static void configure(Config config) {
        if (!(LoggerFactory.getILoggerFactory() instanceof ch.qos.logback.classic.LoggerContext)) {
            return;
        }
        if (config.hasPath("logging.default-level")) {
            rootLogger().setLevel(Level.toLevel(config.getString("logging.default-level")));
        }
        if (config.hasPath("logging.levels")) {
            for (Map.Entry<String, ConfigValue> entry : config.getObject("logging.levels").entrySet()) {
                Logger logger = (Logger) LoggerFactory.getLogger(entry.getKey());
                logger.setLevel(Level.toLevel(String.valueOf(entry.getValue().unwrapped())));
            }
        }
    }

    private static Logger rootLogger() {
        return (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    }
}
