package org.metric.compiler.api;

/**
 * Thrown by the type checker when a program is statically ill-typed.
 */
public class TypeCheckException extends MetricException {

    /**
     * @param message The error message.
     * @param line The 1-based line of the error.
     * @param column The 1-based column of the error.
     */
    public TypeCheckException(String message, int line, int column) {
        super(message, line, column);
    }

    /**
     * @param message The error message.
     * @param position The position of the error.
     */
    public TypeCheckException(String message, SourcePosition position) {
        super(message, position);
    }

    @Override
    public Kind kind() {
        return Kind.TYPE_CHECK;
    }
}
