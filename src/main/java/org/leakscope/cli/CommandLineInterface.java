package org.leakscope.cli;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.leakscope.cli.commands.AnalyzeCommand;
import org.leakscope.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.net.URL;
import java.util.concurrent.Callable;

@Command(
    name = "leakscope",
    mixinStandardHelpOptions = true,
    version = "leakscope 1.0",
    description = "Extracts, classifies and reports memory issues from Valgrind Memcheck logs",
    subcommands = {
        AnalyzeCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final String CONFIG_FILE_NAME = "leakscope.conf";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: leakscope.conf)"
    )
    private File configFile;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // No subcommand given.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("leakscope");
        System.exit(commandLine.execute(args));
    }

    /**
     * Loads the configuration on first use and applies its logging block.
     * Load order: system properties > environment > config file > classpath defaults.
     *
     * @return The resolved configuration.
     * @throws ConfigException if the configuration file is missing or invalid.
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }

    private void initialize() {
        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        final File file = resolveConfigFile(logger);
        Config fileConfig = ConfigFactory.empty();
        if (file != null) {
            fileConfig = ConfigFactory.parseFile(file);
        } else {
            logger.debug("No '{}' found in current directory. Using default configuration from classpath.", CONFIG_FILE_NAME);
        }
        this.config = ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.load())
                .resolve();

        if (config.hasPath("logging.format")) {
            System.setProperty(LoggingConfigurator.FORMAT_PROPERTY,
                    LoggingConfigurator.appenderFor(config.getString("logging.format")));
            reconfigureLogback(logger);
        }
        LoggingConfigurator.configure(config);
        initialized = true;
    }

    private File resolveConfigFile(final Logger logger) {
        // 1) explicit --config
        if (configFile != null) {
            if (!configFile.exists()) {
                throw new ConfigException.Generic(
                        "Configuration file specified via --config was not found: " + configFile.getAbsolutePath());
            }
            logger.info("Using configuration file specified via --config: {}", configFile.getAbsolutePath());
            return configFile;
        }
        // 2) -Dconfig.file
        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                throw new ConfigException.Generic(
                        "Configuration file specified via -Dconfig.file was not found: " + systemConfigFile);
            }
            logger.info("Using configuration file specified via -Dconfig.file: {}", systemConfigFile);
            return systemConfigFile;
        }
        // 3) leakscope.conf in the working directory
        final File cwdConfigFile = new File(CONFIG_FILE_NAME);
        if (cwdConfigFile.exists()) {
            logger.info("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
            return cwdConfigFile;
        }
        return null;
    }

    private void reconfigureLogback(final Logger logger) {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        final URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        try {
            configurator.doConfigure(configUrl);
        } catch (JoranException e) {
            logger.warn("Failed to reconfigure Logback: {}", e.getMessage());
        }
    }
}
