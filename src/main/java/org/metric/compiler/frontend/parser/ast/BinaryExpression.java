package org.metric.compiler.frontend.parser.ast;

import java.util.List;

/**
 * An infix operator applied to two operands.
 *
 * @param left The left operand, always evaluated first.
 * @param operator The operator.
 * @param right The right operand.
 */
public record BinaryExpression(Expression left, BinaryOperator operator, Expression right) implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitBinaryExpression(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }
}
