package org.metric.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Keywords.
    LET,
    PRINT,
    TRUE,
    FALSE,
    IF,
    WHILE,
    SET,
    DEF,
    RETURNS,
    RETURN,
    LIST,
    OF,
    REPEAT,
    LEN,
    AND,
    OR,
    NOT,
    /** The {@code integer} type keyword. */
    INTEGER_TYPE,
    /** The {@code boolean} type keyword. */
    BOOLEAN_TYPE,
    /** The {@code float} type keyword. */
    FLOAT_TYPE,

    // Operators and punctuation.
    PLUS,
    MINUS,
    MULTIPLY,
    DIVIDE,
    MODULUS,
    LEFT_PARENTHESIS,
    RIGHT_PARENTHESIS,
    LEFT_BRACKET,
    RIGHT_BRACKET,
    COMMA,
    /** The assignment '='. */
    EQUALS,
    LESS_THAN,
    GREATER_THAN,
    LESS_THAN_OR_EQUAL,
    GREATER_THAN_OR_EQUAL,
    EQUAL_EQUAL,
    NOT_EQUAL,

    // Literals.
    /** An integer literal; the token value is a {@link Long}. */
    INTEGER,
    /** A float literal; the token value is a {@link Double}. */
    FLOAT,
    /** An identifier; the token value is its name. */
    IDENTIFIER,

    // Layout.
    /** Entry into a deeper indentation level. */
    INDENT,
    /** Exit from an indentation level. */
    DEDENT,
    /** Separates two non-empty source lines. */
    STATEMENT_SEPARATOR,
    /** Stands in for a {@code #} comment and everything after it on the line. */
    COMMENT
}
