package org.metric.compiler.frontend.lexer;

import org.metric.compiler.api.SourcePosition;

import java.util.Objects;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 * <p>
 * Two tokens are equal when their type and value match; the source text and position
 * are carried for diagnostics only.
 *
 * @param type The type of the token.
 * @param text The exact text of the token from the source code (empty for layout tokens).
 * @param value The processed value: a {@link Long}, {@link Double} or identifier name, else null.
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column
) {

    /**
     * Creates a payload-free token at an unknown position, mainly for tests.
     * @param type The token type.
     * @return The token.
     */
    public static Token of(TokenType type) {
        return new Token(type, "", null, 0, 0);
    }

    public static Token integer(long value) {
        return new Token(TokenType.INTEGER, Long.toString(value), value, 0, 0);
    }

    public static Token floating(double value) {
        return new Token(TokenType.FLOAT, Double.toString(value), value, 0, 0);
    }

    public static Token identifier(String name) {
        return new Token(TokenType.IDENTIFIER, name, name, 0, 0);
    }

    /**
     * @return The position of the token's first character.
     */
    public SourcePosition position() {
        return new SourcePosition(line, column);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token other)) return false;
        return type == other.type && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        return value == null ? type.name() : type.name() + "(" + value + ")";
    }
}
