package org.metric.cli.commands;

import org.metric.cli.config.MetricSettings;
import org.metric.compiler.MetricRunner;
import org.metric.compiler.frontend.parser.ParseResult;
import org.metric.runtime.ExecutionResult;
import picocli.CommandLine.Command;

import java.io.PrintStream;
import java.util.Locale;

@Command(name = "run", description = "Checks and executes a Metric program, then reports its operation count.")
public class RunCommand extends SourceFileCommand {

    @Override
    protected int execute(MetricRunner runner, String source, MetricSettings settings) {
        ParseResult program = runner.check(source);

        long start = System.nanoTime();
        ExecutionResult result = runner.execute(program);
        double seconds = (System.nanoTime() - start) / 1_000_000_000.0;

        if (settings.showTiming()) {
            PrintStream out = parent.out();
            out.println(String.format(Locale.ROOT, "Execution time: %.4f seconds", seconds));
            out.println("Operation count: " + result.cost());
        }
        return 0;
    }
}
