package org.pseudoforge.cli;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import org.pseudoforge.cli.commands.ConvertCommand;
import org.pseudoforge.cli.commands.FlowchartCommand;
import org.pseudoforge.cli.config.ConfigLoader;
import org.pseudoforge.cli.config.LoggingConfigurator;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.net.URL;
import java.util.concurrent.Callable;

@Command(
    name = "pseudoforge",
    mixinStandardHelpOptions = true,
    version = "Pseudoforge 1.0",
    description = "Pseudoforge - converts pseudocode into code, canonical pseudocode and flowcharts",
    subcommands = {
        ConvertCommand.class,
        FlowchartCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

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
        final int exitCode = newCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates the command line with all subcommands. Enum options such as {@code --format}
     * accept any case.
     *
     * @return A ready-to-execute command line.
     */
    public static CommandLine newCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("pseudoforge");
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        return commandLine;
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
            if (config.hasPath("logging.format")) {
                System.setProperty(LoggingConfigurator.FORMAT_PROPERTY,
                        LoggingConfigurator.appenderFor(config.getString("logging.format")));
                reconfigureLogback();
            }
            LoggingConfigurator.configure(config);
        }
        return config;
    }

    private void reconfigureLogback() {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        final URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        try {
            configurator.doConfigure(configUrl);
        } catch (JoranException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }
}
