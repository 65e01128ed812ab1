package org.tessera.cli;

import com.typesafe.config.Config;
import org.tessera.cli.commands.CompileCommand;
import org.tessera.cli.config.LoggingConfigurator;
import org.tessera.compiler.config.CompilerConfigLoader;
import org.tessera.compiler.diagnostics.CompilerLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "tessera",
    mixinStandardHelpOptions = true,
    version = "Tessera 1.0",
    description = "Tessera - compiles directive-annotated HTML templates to Java",
    subcommands = {
        CompileCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final String CONFIG_FILE_NAME = "tessera.conf";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: tessera.conf if present)"
    )
    private File configFile;

    @Option(
        names = {"-v", "--verbosity"},
        description = "Compiler log verbosity: 0=error, 1=warn, 2=info, 3=debug, 4=trace (default: 2)"
    )
    private Integer verbosity;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("tessera");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use: the file given with {@code --config}, otherwise
     * {@code tessera.conf} in the working directory if it exists, layered over the classpath defaults.
     *
     * @return The resolved configuration.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be loaded.
     */
    public Config getConfig() {
        if (config != null) {
            return config;
        }
        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        File source = configFile;
        if (source == null) {
            final File cwdConfigFile = new File(CONFIG_FILE_NAME);
            if (cwdConfigFile.isFile()) {
                logger.debug("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
                source = cwdConfigFile;
            }
        }
        config = CompilerConfigLoader.loadConfig(source);
        LoggingConfigurator.configure(config);
        if (verbosity != null) {
            CompilerLogger.setLevel(verbosity);
        }
        return config;
    }
}
