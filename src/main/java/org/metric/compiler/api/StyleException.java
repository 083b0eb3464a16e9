package org.metric.compiler.api;

/**
 * Thrown by the style validator when the source violates a whitespace or formatting rule.
 */
public class StyleException extends MetricException {

    /**
     * @param message The error message.
     * @param line The 1-based line of the error.
     * @param column The 1-based column of the error.
     */
    public StyleException(String message, int line, int column) {
        super(message, line, column);
    }

    /**
     * @param message The error message.
     * @param position The position of the error.
     */
    public StyleException(String message, SourcePosition position) {
        super(message, position);
    }

    @Override
    public Kind kind() {
        return Kind.STYLE;
    }
}
