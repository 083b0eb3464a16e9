package org.metric.runtime;

import java.util.List;

/**
 * The observable outcome of running a program.
 *
 * @param printResults Every value passed to {@code print}, in execution order.
 * @param cost The total operation count.
 */
public record ExecutionResult(List<Value> printResults, long cost) {

    public ExecutionResult {
        printResults = List.copyOf(printResults);
    }

    /**
     * @return The print results as rendered lines, as they appeared on the output stream.
     */
    public List<String> renderedOutput() {
        return printResults.stream().map(Value::render).toList();
    }
}
