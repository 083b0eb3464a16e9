package org.metric.compiler.api;

/**
 * Thrown by the tokenizer when the source contains malformed input such as a bad indent or an unknown character.
 */
public class TokenizerException extends MetricException {

    /**
     * @param message The error message.
     * @param line The 1-based line of the error.
     * @param column The 1-based column of the error.
     */
    public TokenizerException(String message, int line, int column) {
        super(message, line, column);
    }

    /**
     * @param message The error message.
     * @param position The position of the error.
     */
    public TokenizerException(String message, SourcePosition position) {
        super(message, position);
    }

    @Override
    public Kind kind() {
        return Kind.TOKENIZER;
    }
}
