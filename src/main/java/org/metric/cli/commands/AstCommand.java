package org.metric.cli.commands;

import org.metric.cli.config.MetricSettings;
import org.metric.compiler.MetricRunner;
import org.metric.compiler.util.AstJsonWriter;
import picocli.CommandLine.Command;

@Command(name = "ast", description = "Prints the checked syntax tree of a Metric program as JSON.")
public class AstCommand extends SourceFileCommand {

    @Override
    protected int execute(MetricRunner runner, String source, MetricSettings settings) {
        parent.out().println(AstJsonWriter.toJson(runner.check(source)));
        return 0;
    }
}
