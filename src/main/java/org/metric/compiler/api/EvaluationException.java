package org.metric.compiler.api;

/**
 * Thrown by the evaluator on a runtime violation, such as division by zero or an out-of-bounds index.
 */
public class EvaluationException extends MetricException {

    /**
     * @param message The error message.
     * @param line The 1-based line of the error.
     * @param column The 1-based column of the error.
     */
    public EvaluationException(String message, int line, int column) {
        super(message, line, column);
    }

    /**
     * @param message The error message.
     * @param position The position of the error.
     */
    public EvaluationException(String message, SourcePosition position) {
        super(message, position);
    }

    /**
     * Attaches a position to an error raised where none was known, such as inside
     * the runtime environment. Errors that already carry a position are returned unchanged.
     * @param position The position of the statement being executed.
     * @return A positioned exception.
     */
    public EvaluationException at(SourcePosition position) {
        if (line() != 0 || SourcePosition.UNKNOWN.equals(position)) {
            return this;
        }
        EvaluationException positioned = new EvaluationException(getMessage(), position);
        positioned.setStackTrace(getStackTrace());
        return positioned;
    }

    @Override
    public Kind kind() {
        return Kind.EVALUATION;
    }
}
