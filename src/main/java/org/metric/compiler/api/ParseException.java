package org.metric.compiler.api;

/**
 * Thrown by the parser when the token stream does not match the grammar.
 */
public class ParseException extends MetricException {

    /**
     * @param message The error message.
     * @param line The 1-based line of the error.
     * @param column The 1-based column of the error.
     */
    public ParseException(String message, int line, int column) {
        super(message, line, column);
    }

    /**
     * @param message The error message.
     * @param position The position of the error.
     */
    public ParseException(String message, SourcePosition position) {
        super(message, position);
    }

    @Override
    public Kind kind() {
        return Kind.PARSE;
    }
}
