package org.metric.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.metric.cli.commands.AstCommand;
import org.metric.cli.commands.CheckCommand;
import org.metric.cli.commands.RunCommand;
import org.metric.cli.config.ConfigLoader;
import org.metric.cli.config.LoggingConfigurator;
import org.metric.cli.config.MetricSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(
    name = "metric",
    mixinStandardHelpOptions = true,
    version = "Metric 1.0",
    description = "Metric - a small, strictly typed scripting language with operation counting",
    subcommands = {
        RunCommand.class,
        CheckCommand.class,
        AstCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    private static final String RED = "\u001B[31m";
    private static final String RESET = "\u001B[0m";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    @Option(names = "--no-color", description = "Print errors without ANSI colours.")
    private boolean noColor;

    private final PrintStream out;
    private final PrintStream err;
    private MetricSettings settings;

    public CommandLineInterface() {
        this(System.out, System.err);
    }

    /**
     * @param out Receives program output and reports.
     * @param err Receives error messages.
     */
    public CommandLineInterface(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, out);
        return 0;
    }

    public static void main(final String[] args) {
        final int exitCode = createCommandLine(new CommandLineInterface()).execute(args);
        System.exit(exitCode);
    }

    /**
     * Wires a picocli command line to the given interface, routing picocli's own output
     * (usage, version, parameter errors) to the same streams.
     * @param cli The root command.
     * @return The command line, ready to execute.
     */
    public static CommandLine createCommandLine(CommandLineInterface cli) {
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setCommandName("metric");
        commandLine.setOut(new PrintWriter(cli.out, true));
        commandLine.setErr(new PrintWriter(cli.err, true));
        return commandLine;
    }

    /**
     * Loads the configuration and applies its logging block on first use.
     * @return The settings, or null if the configuration could not be loaded (the reason has
     *         been reported on the error stream).
     */
    public MetricSettings settings() {
        if (settings != null) {
            return settings;
        }
        final Config config;
        try {
            config = ConfigLoader.load(configFile);
            settings = MetricSettings.from(config);
        } catch (IllegalArgumentException | ConfigException e) {
            LOG.debug("Configuration loading failed", e);
            printError("Error: " + e.getMessage(), !noColor);
            return null;
        }
        LoggingConfigurator.configure(config);
        if (noColor) {
            settings = settings.withColor(false);
        }
        return settings;
    }

    public PrintStream out() {
        return out;
    }

    public PrintStream err() {
        return err;
    }

    /**
     * Prints an error line, in red when colour is enabled.
     * @param message The message.
     */
    public void printError(String message) {
        printError(message, settings == null ? !noColor : settings.color());
    }

    private void printError(String message, boolean color) {
        err.println(color ? RED + message + RESET : message);
    }
}
