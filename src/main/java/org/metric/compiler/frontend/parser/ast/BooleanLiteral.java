package org.metric.compiler.frontend.parser.ast;

/**
 * {@code true} or {@code false}.
 *
 * @param value The literal value.
 */
public record BooleanLiteral(boolean value) implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitBooleanLiteral(this);
    }
}
