package org.ppvariant.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.ppvariant.cli.commands.FlowGraphCommand;
import org.ppvariant.cli.commands.VariantsCommand;
import org.ppvariant.cli.config.ConfigLoader;
import org.ppvariant.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "ppvariant",
    mixinStandardHelpOptions = true,
    version = "ppvariant 1.0",
    description = "Enumerates the preprocessing variants of sources with `ifdef/`ifndef blocks",
    subcommands = {
        VariantsCommand.class,
        FlowGraphCommand.class,
        CommandLine.HelpCommand.class
    },
    footer = {
        "",
        "JVM Options:",
        "  Deeply nested or very long sources need a larger traversal stack.",
        "  Pass it as a system property to the JVM, not to ppvariant:",
        "",
        "    java -Dppvariant.traversal.stack-size=256M -jar ppvariant.jar variants -f top.sv",
        "",
        "  or set it in the configuration file (ppvariant.traversal.stack-size)."
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/ppvariant.conf)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
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
        commandLine.setCommandName("ppvariant");
        return commandLine;
    }

    /**
     * Resolves the configuration on first use and applies its logging settings.
     *
     * @return The resolved configuration.
     * @throws IllegalArgumentException if an explicitly given config file does not exist.
     * @throws ConfigException if the configuration cannot be parsed.
     */
    public Config getConfig() {
        if (config != null) {
            return config;
        }
        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);
        try {
            config = ConfigLoader.resolve(configFile, (level, message) -> {
                switch (level) {
                    case INFO -> logger.info(message);
                    case WARN -> logger.warn(message);
                }
            });
        } catch (ConfigException e) {
            logger.error("Failed to load or parse configuration: {}", e.getMessage());
            throw e;
        }
        LoggingConfigurator.configure(config);
        return config;
    }
}
