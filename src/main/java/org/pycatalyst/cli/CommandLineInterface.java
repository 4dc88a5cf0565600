package org.pycatalyst.cli;

import com.typesafe.config.Config;
import org.pycatalyst.cli.commands.TranslateCommand;
import org.pycatalyst.cli.config.ConfigLoader;
import org.pycatalyst.cli.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "pycatalyst",
    mixinStandardHelpOptions = true,
    version = "PyCatalyst 1.0",
    description = "PyCatalyst - translates Python scripts into C++",
    subcommands = {
        TranslateCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: pycatalyst.conf)"
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
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("pycatalyst");
        System.exit(commandLine.execute(args));
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     *
     * @return The merged configuration.
     * @throws IllegalArgumentException if the file given with {@code --config} does not exist.
     */
    public Config getConfig() {
        if (config == null) {
            config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}
