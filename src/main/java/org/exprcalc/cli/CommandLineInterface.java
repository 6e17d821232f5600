package org.exprcalc.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import org.exprcalc.cli.commands.EvalCommand;
import org.exprcalc.cli.commands.ReplCommand;
import org.exprcalc.cli.config.LoggingConfigurator;
import org.exprcalc.cli.console.ConsoleOptions;
import org.exprcalc.engine.Calculator;
import org.exprcalc.engine.CalculatorOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "exprcalc",
    mixinStandardHelpOptions = true,
    version = "exprcalc 1.0",
    description = "Evaluates arithmetic expressions with + - * / % ^ and parentheses.",
    subcommands = {
        EvalCommand.class,
        ReplCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    /** Exit code when the configuration cannot be loaded. */
    public static final int EXIT_CONFIG_ERROR = 2;

    static final String CONFIG_FILE_NAME = "exprcalc.conf";

    private static final ConfigParseOptions REQUIRED = ConfigParseOptions.defaults().setAllowMissing(false);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: exprcalc.conf)"
    )
    private File configFile;

    @Spec
    private CommandSpec spec;

    private Config config;
    private boolean initialized = false;

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
     * Builds the command line with all subcommands and the configuration error handling.
     * @return A ready-to-execute command line.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("exprcalc");
        // Lets "eval -2^2" pass the expression instead of failing on an unknown option.
        commandLine.setUnmatchedOptionsArePositionalParams(true);
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            if (ex instanceof ConfigException) {
                LoggerFactory.getLogger(CommandLineInterface.class)
                        .error("Failed to load or parse configuration: {}", ex.getMessage());
                cmd.getErr().println("Configuration error: " + ex.getMessage());
                cmd.getErr().flush();
                return EXIT_CONFIG_ERROR;
            }
            throw ex;
        });
        return commandLine;
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        // Initialize logger early for config loading feedback
        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        // 1) Highest precedence: explicit CLI option --config
        if (this.configFile != null) {
            logger.info("Using configuration file specified via --config: {}", this.configFile.getAbsolutePath());
            this.config = layered(ConfigFactory.parseFile(this.configFile, REQUIRED));
        } else {
            // 2) Next: standard Typesafe Config system property -Dconfig.file
            final String systemConfigPath = System.getProperty("config.file");
            if (systemConfigPath != null && !systemConfigPath.isBlank()) {
                final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
                logger.info("Using configuration file specified via -Dconfig.file: {}", systemConfigFile);
                this.config = layered(ConfigFactory.parseFile(systemConfigFile, REQUIRED));
            } else {
                // 3) Then: exprcalc.conf in the current working directory
                final File cwdConfigFile = new File(CONFIG_FILE_NAME);
                if (cwdConfigFile.exists()) {
                    logger.info("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
                    this.config = layered(ConfigFactory.parseFile(cwdConfigFile, REQUIRED));
                } else {
                    // 4) Finally: fall back to classpath defaults only
                    logger.debug("No '{}' found in current directory. Using default configuration from classpath.", CONFIG_FILE_NAME);
                    this.config = layered(ConfigFactory.empty());
                }
            }
        }

        LoggingConfigurator.configure(config);
        initialized = true;
    }

    private static Config layered(final Config fileConfig) {
        // Config load order: System Props > Env Vars > File > Classpath defaults
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.defaultReference())
                .resolve();
    }

    /**
     * Gets the merged configuration, loading it on first use.
     * @return The configuration.
     * @throws ConfigException if the configuration file is missing or malformed.
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }

    /**
     * Creates a calculator with the limits from {@code exprcalc.calculator}.
     * @return A new calculator.
     */
    public Calculator createCalculator() {
        return new Calculator(CalculatorOptions.fromConfig(getConfig().getConfig("exprcalc.calculator")));
    }

    /**
     * Gets the console settings from {@code exprcalc.console}.
     * @return The console options.
     */
    public ConsoleOptions getConsoleOptions() {
        return ConsoleOptions.fromConfig(getConfig().getConfig("exprcalc.console"));
    }
}
