package org.metric.cli.commands;

import org.metric.cli.CommandLineInterface;
import org.metric.cli.config.MetricSettings;
import org.metric.compiler.MetricRunner;
import org.metric.compiler.api.MetricException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

/**
 * Shared behaviour of the subcommands that take one Metric source file: extension and
 * existence checks, reading the file, and mapping pipeline errors to exit code 1.
 */
abstract class SourceFileCommand implements Callable<Integer> {

    @ParentCommand
    CommandLineInterface parent;

    @Parameters(index = "0", paramLabel = "FILE", description = "The Metric source file.")
    File file;

    @Override
    public final Integer call() {
        MetricSettings settings = parent.settings();
        if (settings == null) {
            return 1;
        }

        String path = file.getPath();
        if (!path.endsWith(settings.sourceExtension())) {
            parent.printError("Error: File '" + path + "' does not have " + settings.sourceExtension() + " extension");
            parent.err().println("Metric programs should use the " + settings.sourceExtension() + " file extension");
            return 1;
        }
        if (!file.isFile()) {
            parent.printError("Error: File '" + path + "' not found");
            return 1;
        }

        final String source;
        try {
            source = Files.readString(file.toPath(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            parent.printError("Error reading file '" + path + "': " + e.getMessage());
            return 1;
        }

        try {
            return execute(new MetricRunner(parent.out(), settings.styleEnabled()), source, settings);
        } catch (MetricException e) {
            parent.printError(e.formatted());
            return 1;
        }
    }

    /**
     * Runs the command on the file's contents.
     * @param runner A runner printing to the command's output stream.
     * @param source The program text.
     * @param settings The active settings.
     * @return The exit code.
     * @throws MetricException on any pipeline error.
     */
    protected abstract int execute(MetricRunner runner, String source, MetricSettings settings);
}
