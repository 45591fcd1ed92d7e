package org.replaymem.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.replaymem.cli.commands.BenchCommand;
import org.replaymem.config.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "replaymem", mixinStandardHelpOptions = true,
        version = "replaymem 1.0",
        description = "Experience replay memories for reinforcement learning.",
        subcommands = {
                BenchCommand.class
        })
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(names = {"-c", "--config"}, description = "Path to the configuration file (default: replaymem.conf).")
    private File configFile;

    private Config config;
    private boolean loggingConfigured = false;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public CommandLineInterface() {
        // Default constructor for production
    }

    /**
     * Constructor for tests that supply a ready configuration.
     */
    public CommandLineInterface(Config config) {
        this.config = config;
        this.loggingConfigured = true;
    }

    @Override
    public Integer call() {
        getConfig();
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    /**
     * Loads the configuration on first use and applies its logging section.
     *
     * @return the resolved configuration
     */
    public Config getConfig() {
        if (config == null) {
            config = configFile != null ? ConfigLoader.load(configFile) : ConfigLoader.load();
        }
        configureLogging();
        return config;
    }

    private void configureLogging() {
        if (loggingConfigured) return;
        loggingConfigured = true;
        if (!config.hasPath("logging")) {
            return;
        }

        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Config loggingConfig = config.getConfig("logging");

        if (loggingConfig.hasPath("level")) {
            ch.qos.logback.classic.Logger rootLogger = context.getLogger(Logger.ROOT_LOGGER_NAME);
            rootLogger.setLevel(Level.toLevel(loggingConfig.getString("level"), Level.WARN));
        }

        if (loggingConfig.hasPath("loggers")) {
            Config loggersConfig = loggingConfig.getConfig("loggers");
            for (Map.Entry<String, ConfigValue> entry : loggersConfig.root().entrySet()) {
                String levelName = entry.getValue().unwrapped().toString();
                context.getLogger(entry.getKey()).setLevel(Level.toLevel(levelName));
            }
        }
        log.debug("Applied logging configuration");
    }

    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = new CommandLine(new CommandLineInterface()).execute(args);
        } catch (Exception e) {
            // Fallback for exceptions not caught by picocli
            System.err.println("An unexpected error occurred: " + e.getMessage());
            e.printStackTrace();
            exitCode = 1;
        }
        System.exit(exitCode);
    }
}
