package org.metric.compiler.frontend.parser.ast;

/**
 * A read of a variable.
 *
 * @param name The variable name.
 */
public record Variable(String name) implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }
}
