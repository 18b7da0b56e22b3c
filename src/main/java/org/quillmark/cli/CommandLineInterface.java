package org.quillmark.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.quillmark.cli.commands.CheckCommand;
import org.quillmark.cli.commands.DumpCommand;
import org.quillmark.cli.commands.StylesCommand;
import org.quillmark.config.ConfigLoader;
import org.quillmark.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "quillmark",
    mixinStandardHelpOptions = true,
    version = "Quillmark 1.0",
    description = "Quillmark - markup documents with extensible directives",
    subcommands = {
        CheckCommand.class,
        DumpCommand.class,
        StylesCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    /** All documents were processed without problems. */
    public static final int EXIT_OK = 0;
    /** At least one document or style sheet contains invalid content. */
    public static final int EXIT_INVALID_CONTENT = 1;
    /** A file or the configuration could not be read. */
    public static final int EXIT_ERROR = 2;

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return EXIT_OK;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("quillmark");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     *
     * @return The merged configuration.
     * @throws ConfigException if the configuration file is missing or malformed.
     */
    public Config getConfig() {
        if (config != null) {
            return config;
        }
        final Config loaded;
        if (configFile != null) {
            if (!configFile.isFile()) {
                LOG.error("Configuration file specified via --config was not found: {}", configFile.getAbsolutePath());
                throw new ConfigException.Generic("Configuration file not found: " + configFile.getPath());
            }
            loaded = ConfigLoader.load(configFile);
        } else {
            loaded = ConfigLoader.load();
        }
        LoggingConfigurator.configure(loaded);
        config = loaded;
        return config;
    }
}
