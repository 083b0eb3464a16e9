package org.metric.compiler.frontend.parser.ast;

/**
 * An AST node that represents a float literal.
 *
 * @param value The 64-bit floating point value.
 */
public record FloatLiteral(double value) implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitFloatLiteral(this);
    }
}
