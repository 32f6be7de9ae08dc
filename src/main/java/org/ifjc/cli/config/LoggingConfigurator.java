package org.ifjc.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URL;
import java.util.Map;

/**
 * Applies the {@code logging} block of the configuration to Logback.
 * <p>
 * {@code logging.levels} maps logger names to level names, e.g.
 * <pre>
 * logging.levels {
 *   "org.ifjc.compiler.frontend.semantics" = DEBUG
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

    private LoggingConfigurator() {
    }

    /**
     * Sets the level of every logger named under {@code logging.levels}.
     *
     * @param config The resolved application configuration.
     */
    public static void configure(Config config) {
        if (!config.hasPath("logging.levels")) {
            return;
        }
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            log.warn("Logback is not the active SLF4J backend; ignoring logging.levels");
            return;
        }
        for (Map.Entry<String, ConfigValue> entry : config.getObject("logging.levels").entrySet()) {
            String loggerName = stripQuotes(entry.getKey());
            String levelName = String.valueOf(entry.getValue().unwrapped());
            Level level = Level.toLevel(levelName, null);
            if (level == null) {
                log.warn("Unknown log level '{}' for logger '{}'", levelName, loggerName);
                continue;
            }
            context.getLogger(loggerName).setLevel(level);
        }
    }

    /**
     * Re-reads {@code logback.xml} from the classpath, picking up changed system properties.
     */
    public static void reloadLogback() {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        URL configUrl = LoggingConfigurator.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        try {
            configurator.doConfigure(configUrl);
        } catch (JoranException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }

    private static String stripQuotes(String key) {
        return key.length() > 1 && key.startsWith("\"") && key.endsWith("\"")
                ? key.substring(1, key.length() - 1) : key;
    }
}
