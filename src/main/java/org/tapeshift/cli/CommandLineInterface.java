package org.tapeshift.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.tapeshift.cli.config.LoggingConfigurator;
import org.tapeshift.converter.ConverterRunner;
import org.tapeshift.converter.api.ConversionException;
import org.tapeshift.converter.model.ConverterSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "tapeshift",
    mixinStandardHelpOptions = true,
    version = "tapeshift 1.0",
    description = "Converts a Turing machine transition table between the doubly-infinite and the Sipser tape model."
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(CommandLineInterface.class);
    private static final String CONFIG_FILE_NAME = "tapeshift.conf";
    private static final String DEFAULT_INPUT_PATH = "tapeshift.files.default-input";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    @Parameters(
        index = "0",
        arity = "0..1",
        paramLabel = "<input>",
        description = "The table to convert; must end with '.in' (default: example.in)"
    )
    private String input;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private Config config;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        final ConverterSettings settings;
        try {
            config = loadConfig();
            LoggingConfigurator.configure(config);
            settings = ConverterSettings.fromConfig(config);
        } catch (ConfigException e) {
            LOGGER.error("Failed to load or parse configuration: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        }

        final String inputPath = input != null ? input : config.getString(DEFAULT_INPUT_PATH);

        try {
            final ConverterRunner.Report report = new ConverterRunner(settings).run(Path.of(inputPath));
            out.printf("Successfully converted to %s model.%n Input: %s%n Output: %s%n",
                    report.result().targetType().displayName(), report.inputPath(), report.outputPath());
            return 0;
        } catch (ConversionException e) {
            LOGGER.error("Conversion of {} failed [{}]: {}", inputPath, e.getErrorCode(), e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration. Load order: System Props > Env Vars > File > Classpath defaults.
     * The file is the one given via {@code --config}, otherwise {@value #CONFIG_FILE_NAME} in the
     * current directory if present.
     */
    private Config loadConfig() {
        final Config base = ConfigFactory.systemProperties().withFallback(ConfigFactory.systemEnvironment());

        if (configFile != null) {
            if (!configFile.exists()) {
                throw new ConfigException.Generic(
                        "Configuration file specified via --config was not found: " + configFile.getAbsolutePath());
            }
            LOGGER.info("Using configuration file specified via --config: {}", configFile.getAbsolutePath());
            return base.withFallback(ConfigFactory.parseFile(configFile))
                    .withFallback(ConfigFactory.load())
                    .resolve();
        }

        final File cwdConfigFile = new File(CONFIG_FILE_NAME);
        if (cwdConfigFile.exists()) {
            LOGGER.info("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
            return base.withFallback(ConfigFactory.parseFile(cwdConfigFile))
                    .withFallback(ConfigFactory.load())
                    .resolve();
        }

        LOGGER.debug("No '{}' found in current directory. Using default configuration from classpath.", CONFIG_FILE_NAME);
        return base.withFallback(ConfigFactory.load()).resolve();
    }

    public Config getConfig() {
        return config;
    }
}
