package org.ifjc.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.ifjc.cli.commands.AnalyzeCommand;
import org.ifjc.cli.config.ConfigLoader;
import org.ifjc.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "ifjc",
    mixinStandardHelpOptions = true,
    version = "ifjc 1.0",
    description = "IFJ25 compiler front end - semantic analysis of parsed programs",
    subcommands = {
        AnalyzeCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/ifjc.conf)"
    )
    private File configFile;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // No subcommand: show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = createCommandLine();
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates a fully configured CommandLine instance.
     * <p>
     * Use this method in tests to get the same configuration as the CLI entry point.
     *
     * @return A configured CommandLine instance.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("ifjc");
        return commandLine;
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        try {
            this.config = ConfigLoader.resolve(this.configFile, (level, message) -> {
                switch (level) {
                    case INFO -> logger.info(message);
                    case WARN -> logger.warn(message);
                }
            });
        } catch (ConfigException e) {
            logger.error("Failed to load or parse configuration: {}", e.getMessage());
            throw e;
        }

        if (config.hasPath("logging.format")) {
            final String format = config.getString("logging.format");
            final String appender = "PLAIN".equalsIgnoreCase(format) ? "STDERR_PLAIN" : "STDERR";
            if (!appender.equals(System.getProperty("ifjc.logging.format"))) {
                System.setProperty("ifjc.logging.format", appender);
                LoggingConfigurator.reloadLogback();
            }
        }
        LoggingConfigurator.configure(config);

        initialized = true;
    }

    /**
     * Returns the resolved configuration, loading it on first use.
     *
     * @return The application configuration.
     * @throws IllegalArgumentException if an explicitly named configuration file does not exist.
     * @throws ConfigException if the configuration cannot be parsed or resolved.
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
