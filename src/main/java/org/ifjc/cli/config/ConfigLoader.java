package org.ifjc.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;

/**
 * Central configuration loader for the command line.
 * <p>
 * Composes HOCON configuration from multiple sources with the following precedence
 * (highest to lowest):
 * <ol>
 *   <li>Java system properties ({@code -Dkey=value})</li>
 *   <li>Environment variables</li>
 *   <li>User configuration file (see {@link #resolve(File, ConfigMessageHandler)})</li>
 *   <li>Default reference configuration ({@code reference.conf} on the classpath)</li>
 * </ol>
 * Substitutions are resolved after all layers are composed, so a user override of a value
 * that {@code reference.conf} refers to reaches every reference.
 */
public final class ConfigLoader {

    static final String CONFIG_DIR = "config";
    static final String CONFIG_FILE_NAME = "ifjc.conf";

    private ConfigLoader() {
    }

    /**
     * Message severity levels for configuration resolution feedback.
     */
    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Callback for receiving progress messages during configuration file resolution.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {

        /**
         * @param level   the severity of the message.
         * @param message the human-readable description.
         */
        void log(MessageLevel level, String message);
    }

    /**
     * Resolves configuration, taking the first configuration file found:
     * <ol>
     *   <li>the file passed via {@code --config}</li>
     *   <li>the file named by the {@code -Dconfig.file} JVM argument</li>
     *   <li>{@code config/ifjc.conf} relative to the working directory</li>
     *   <li>none: {@code reference.conf} only</li>
     * </ol>
     *
     * @param explicitConfigFile config file from CLI option, or {@code null} for auto-discovery.
     * @param handler            callback for resolution progress messages.
     * @return the fully resolved application {@link Config}.
     * @throws IllegalArgumentException                if an explicitly specified config file does not exist.
     * @throws com.typesafe.config.ConfigException     if the configuration cannot be parsed or resolved.
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            if (!explicitConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file not found: " + explicitConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO, "Using configuration file " + explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file specified via -Dconfig.file not found: " + systemConfigFile);
            }
            handler.log(MessageLevel.INFO, "Using configuration file from -Dconfig.file: " + systemConfigFile);
            return loadFromFile(systemConfigFile);
        }

        final File cwdConfigFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (cwdConfigFile.isFile()) {
            handler.log(MessageLevel.INFO, "Using configuration file " + cwdConfigFile.getAbsolutePath());
            return loadFromFile(cwdConfigFile);
        }
        if (cwdConfigFile.exists()) {
            handler.log(MessageLevel.WARN, "Ignoring '" + cwdConfigFile + "': not a regular file.");
        }

        handler.log(MessageLevel.INFO, "No '" + CONFIG_DIR + "/" + CONFIG_FILE_NAME
                + "' found, using the default configuration.");
        return loadDefaults();
    }

    /**
     * Loads configuration from a file, merged with classpath defaults.
     */
    static Config loadFromFile(final File configFile) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.parseFile(configFile))
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    /**
     * Loads configuration from classpath defaults only.
     */
    static Config loadDefaults() {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }
}
