package org.hdldoc.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.hdldoc.cli.commands.ParseCommand;
import org.hdldoc.cli.commands.TokensCommand;
import org.hdldoc.cli.config.ConfigLoader;
import org.hdldoc.cli.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "hdldoc",
    mixinStandardHelpOptions = true,
    version = "hdldoc 1.0",
    description = "Extracts documentation from Verilog sources",
    subcommands = {
        ParseCommand.class,
        TokensCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    @Spec
    private CommandSpec spec;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates the configured command line, shared by {@link #main(String[])} and tests.
     * @return A new command line for a fresh {@link CommandLineInterface}.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("hdldoc");
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        return commandLine;
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     * @return The resolved configuration.
     * @throws CommandLine.ParameterException if the configuration file is missing or invalid.
     */
    public Config getConfig() {
        if (config == null) {
            try {
                config = ConfigLoader.load(configFile);
            } catch (IllegalArgumentException | ConfigException e) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "Failed to load configuration: " + e.getMessage(), e);
            }
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}
