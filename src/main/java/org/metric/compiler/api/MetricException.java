package org.metric.compiler.api;

/**
 * Base class for every error raised by the Metric pipeline.
 * <p>
 * Each stage (tokenizer, style validator, parser, type checker, evaluator) throws its own
 * subclass. All of them carry the raw message plus the source position, and render through
 * the same template: {@code [Line L, Column C] <Kind> Error | <message>}.
 */
public abstract class MetricException extends RuntimeException {

    /**
     * The pipeline stage an error originates from.
     */
    public enum Kind {
        /** Lexical analysis. */
        TOKENIZER("Tokenizer"),
        /** Whitespace and formatting rules. */
        STYLE("Style"),
        /** Syntax analysis. */
        PARSE("Parse"),
        /** Static type checking. */
        TYPE_CHECK("TypeCheck"),
        /** Program execution. */
        EVALUATION("Evaluation");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        /**
         * @return The label used in formatted error messages, without the "Error" suffix.
         */
        public String label() {
            return label;
        }
    }

    private final int line;
    private final int column;

    /**
     * Constructs a new exception.
     * @param message The raw, human-readable message.
     * @param line The 1-based line, or 0 if unknown.
     * @param column The 1-based column, or 0 if unknown.
     */
    protected MetricException(String message, int line, int column) {
        super(message);
        this.line = line;
        this.column = column;
    }

    /**
     * Constructs a new exception positioned at the given source location.
     * @param message The raw, human-readable message.
     * @param position The source position, may be {@link SourcePosition#UNKNOWN}.
     */
    protected MetricException(String message, SourcePosition position) {
        this(message, position.line(), position.column());
    }

    /**
     * @return The stage this error belongs to.
     */
    public abstract Kind kind();

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    /**
     * Renders the error in the uniform CLI format.
     * @return e.g. {@code [Line 2, Column 1] Tokenizer Error | Invalid indentation: expected multiples of 4 spaces}
     */
    public String formatted() {
        return String.format("[Line %d, Column %d] %s Error | %s", line, column, kind().label(), getMessage());
    }

    @Override
    public String toString() {
        return formatted();
    }
}
