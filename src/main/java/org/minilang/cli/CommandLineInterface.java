package org.minilang.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.minilang.cli.commands.AstCommand;
import org.minilang.cli.commands.CfgCommand;
import org.minilang.cli.commands.CheckCommand;
import org.minilang.cli.commands.RunCommand;
import org.minilang.cli.commands.TacCommand;
import org.minilang.cli.commands.TokensCommand;
import org.minilang.cli.config.LoggingConfigurator;
import org.minilang.compiler.Compiler;
import org.minilang.runtime.InterpreterOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "minilang",
    mixinStandardHelpOptions = true,
    version = "MiniLang 1.0",
    description = "MiniLang - compiler front end, TAC/CFG inspector and interpreter",
    subcommands = {
        RunCommand.class,
        CheckCommand.class,
        TokensCommand.class,
        AstCommand.class,
        TacCommand.class,
        CfgCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    private static final String CONFIG_FILE_NAME = "minilang.conf";
    private static final String VERBOSITY_PATH = "minilang.compiler.verbosity";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: minilang.conf)"
    )
    private File configFile;

    @Option(
        names = {"-v", "--verbosity"},
        description = "Compiler log verbosity, 0=errors ... 4=trace (default: from configuration)"
    )
    private Integer verbosity;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("minilang");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use and applies its logging section.
     * @return The resolved configuration.
     */
    public Config getConfig() {
        if (config != null) {
            return config;
        }
        try {
            // Config load order: System Props > Env Vars > File > Classpath defaults
            Config base = ConfigFactory.systemProperties().withFallback(ConfigFactory.systemEnvironment());
            if (configFile != null) {
                if (!configFile.exists()) {
                    throw new CommandLine.ParameterException(spec.commandLine(),
                            "Configuration file specified via --config was not found: " + configFile.getAbsolutePath());
                }
                LOG.info("Using configuration file specified via --config: {}", configFile.getAbsolutePath());
                base = base.withFallback(ConfigFactory.parseFile(configFile));
            } else {
                File cwdConfigFile = new File(CONFIG_FILE_NAME);
                if (cwdConfigFile.exists()) {
                    LOG.info("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
                    base = base.withFallback(ConfigFactory.parseFile(cwdConfigFile));
                } else {
                    LOG.debug("No '{}' found in current directory. Using default configuration from classpath.", CONFIG_FILE_NAME);
                }
            }
            config = base.withFallback(ConfigFactory.load()).resolve();
        } catch (ConfigException e) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Failed to load or parse configuration: " + e.getMessage(), e, null, null);
        }
        LoggingConfigurator.configure(config);
        return config;
    }

    /**
     * Creates a compiler configured from the command line and the configuration.
     * @return A fresh compiler.
     */
    public Compiler createCompiler() {
        Config cfg = getConfig();
        Compiler compiler = new Compiler(InterpreterOptions.fromConfig(cfg));
        if (verbosity != null) {
            compiler.setVerbosity(verbosity);
        } else if (cfg.hasPath(VERBOSITY_PATH)) {
            compiler.setVerbosity(cfg.getInt(VERBOSITY_PATH));
        }
        return compiler;
    }
}
