package org.metric.compiler.frontend.parser.ast;

/**
 * Infix operators, grouped by the typing rule that applies to them.
 */
public enum BinaryOperator {
    ADDITION("+", Category.ARITHMETIC),
    SUBTRACTION("-", Category.ARITHMETIC),
    MULTIPLICATION("*", Category.ARITHMETIC),
    DIVISION("/", Category.ARITHMETIC),
    MODULUS("%", Category.MODULUS),
    LESS_THAN("<", Category.ORDERING),
    GREATER_THAN(">", Category.ORDERING),
    LESS_THAN_OR_EQUAL("<=", Category.ORDERING),
    GREATER_THAN_OR_EQUAL(">=", Category.ORDERING),
    EQUAL_EQUAL("==", Category.EQUALITY),
    NOT_EQUAL("!=", Category.EQUALITY),
    AND("and", Category.LOGICAL),
    OR("or", Category.LOGICAL);

    /**
     * The typing rule an operator follows.
     */
    public enum Category {
        /** Numeric operands, float if either operand is float. */
        ARITHMETIC,
        /** Integer operands only. */
        MODULUS,
        /** Numeric operands, boolean result. */
        ORDERING,
        /** Operands of the same type, boolean result. */
        EQUALITY,
        /** Boolean operands, boolean result, short-circuiting. */
        LOGICAL
    }

    private final String symbol;
    private final Category category;

    BinaryOperator(String symbol, Category category) {
        this.symbol = symbol;
        this.category = category;
    }

    /**
     * @return The operator as written in source code.
     */
    public String symbol() {
        return symbol;
    }

    public Category category() {
        return category;
    }
}
