package org.sugarscape.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sugarscape.cli.commands.RunCommand;
import org.sugarscape.cli.config.ConfigLoader;
import org.sugarscape.cli.config.LoggingConfigurator;

import com.typesafe.config.Config;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "sugarscape",
    mixinStandardHelpOptions = true,
    version = "Sugarscape 1.0",
    description = "Sugarscape - agent-based population simulation on a resource landscape",
    subcommands = {
        RunCommand.class,
        CommandLine.HelpCommand.class
    },
    footer = {
        "",
        "Configuration:",
        "  Defaults come from reference.conf. Override them in config/sugarscape.conf,",
        "  with --config, or per value with -D, e.g.",
        "",
        "    java -Dsimulation.parallelism=1 -jar sugarscape.jar run"
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/sugarscape.conf)"
    )
    private File configFile;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // Without a subcommand, show the usage.
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
        commandLine.setCommandName("sugarscape");
        return commandLine;
    }

    private void initialize() {
        if (initialized) {
            return;
        }
        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);
        this.config = ConfigLoader.resolve(this.configFile, (level, message) -> {
            switch (level) {
                case INFO -> logger.info(message);
                case WARN -> logger.warn(message);
            }
        });
        LoggingConfigurator.configure(config);
        initialized = true;
    }

    /**
     * Returns the resolved configuration, loading it on first access.
     *
     * @return the configuration
     * @throws IllegalArgumentException                if an explicitly named config file is missing
     * @throws com.typesafe.config.ConfigException     if the configuration cannot be parsed
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
