package org.metric.compiler.frontend.parser.ast;

/**
 * Prefix operators.
 */
public enum UnaryOperator {
    /** Logical negation. */
    NOT("not");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
