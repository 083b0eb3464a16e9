package org.metric.cli.commands;

import org.metric.cli.config.MetricSettings;
import org.metric.compiler.MetricRunner;
import picocli.CommandLine.Command;

@Command(name = "check", description = "Tokenizes, style checks, parses and type checks a Metric program without running it.")
public class CheckCommand extends SourceFileCommand {

    @Override
    protected int execute(MetricRunner runner, String source, MetricSettings settings) {
        runner.check(source);
        parent.out().println("OK");
        return 0;
    }
}
