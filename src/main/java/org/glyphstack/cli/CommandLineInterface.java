package org.glyphstack.cli;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.glyphstack.cli.commands.CheckCommand;
import org.glyphstack.cli.commands.RunCommand;
import org.glyphstack.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Callable;

@Command(
    name = "glyphstack",
    mixinStandardHelpOptions = true,
    version = "glyphstack 1.0",
    description = "Runs programs for the glyph stack machine with exact rational arithmetic",
    subcommands = {
        RunCommand.class,
        CheckCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    public static final String CONFIG_FILE_NAME = "glyphstack.conf";

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: glyphstack.conf)"
    )
    private File configFile;

    private Config config;
    private boolean initialized = false;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        // no subcommand given
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final int exitCode = createCommandLine(System.out).execute(args);
        System.exit(exitCode);
    }

    /**
     * Builds the command line with program output encoded as UTF-8, independent of the
     * platform charset, so that written code points match the UTF-8 decoded input.
     *
     * @param stdout The stream program output and usage text are written to.
     * @return The configured command line.
     */
    public static CommandLine createCommandLine(final OutputStream stdout) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("glyphstack");
        commandLine.setOut(new PrintWriter(new OutputStreamWriter(stdout, StandardCharsets.UTF_8), true));
        return commandLine;
    }

    /**
     * Loads the configuration. Sources are tried in this order: {@code --config}, the
     * {@code config.file} system property, {@code glyphstack.conf} in the working directory,
     * and finally the classpath defaults alone. System properties and environment variables
     * override file values in every case.
     *
     * @throws ConfigException if a named file is missing or any source fails to parse.
     */
    private void initialize() {
        if (initialized) {
            return;
        }

        if (this.configFile != null) {
            if (!this.configFile.exists()) {
                throw new ConfigException.Generic("Configuration file specified via --config was not found: "
                        + this.configFile.getAbsolutePath());
            }
            LOG.info("Using configuration file specified via --config: {}", this.configFile.getAbsolutePath());
            this.config = loadWithFile(this.configFile);
        } else {
            final String systemConfigPath = System.getProperty("config.file");
            if (systemConfigPath != null && !systemConfigPath.isBlank()) {
                final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
                if (!systemConfigFile.exists()) {
                    throw new ConfigException.Generic("Configuration file specified via -Dconfig.file was not found: "
                            + systemConfigFile.getAbsolutePath());
                }
                LOG.info("Using configuration file specified via -Dconfig.file: {}", systemConfigFile.getAbsolutePath());
                this.config = loadWithFile(systemConfigFile);
            } else {
                final File cwdConfigFile = new File(CONFIG_FILE_NAME);
                if (cwdConfigFile.exists()) {
                    LOG.info("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
                    this.config = loadWithFile(cwdConfigFile);
                } else {
                    LOG.debug("No '{}' found in current directory. Using default configuration from classpath.",
                            CONFIG_FILE_NAME);
                    this.config = ConfigFactory.systemProperties()
                            .withFallback(ConfigFactory.systemEnvironment())
                            .withFallback(ConfigFactory.load())
                            .resolve();
                }
            }
        }

        if (config.hasPath("logging.format")) {
            // logback.xml defaults to the plain appender; only a change needs a reload
            final String appender = LoggingConfigurator.appenderFor(config.getString("logging.format"));
            final String current = System.getProperty(LoggingConfigurator.FORMAT_PROPERTY,
                    LoggingConfigurator.PLAIN_APPENDER);
            if (!appender.equals(current)) {
                System.setProperty(LoggingConfigurator.FORMAT_PROPERTY, appender);
                reconfigureLogback();
            }
        }
        LoggingConfigurator.configure(config);

        initialized = true;
    }

    private static Config loadWithFile(final File file) {
        // System Props > Env Vars > File > Classpath defaults
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(ConfigFactory.parseFile(file))
                .withFallback(ConfigFactory.load())
                .resolve();
    }

    private void reconfigureLogback() {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        final URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        try {
            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            configurator.doConfigure(configUrl);
        } catch (JoranException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }

    /**
     * Returns the application configuration, loading it on first use.
     * @return The resolved configuration.
     * @throws ConfigException if the configuration cannot be loaded.
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
