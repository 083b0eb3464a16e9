package org.metric.compiler.frontend.parser.ast;

/**
 * An AST node that represents an integer literal.
 *
 * @param value The 64-bit value.
 */
public record IntegerLiteral(long value) implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitIntegerLiteral(this);
    }

    // This node has no children and inherits the empty list from getChildren().
}
