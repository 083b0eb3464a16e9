package org.metric.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A prefix operator applied to an operand.
 *
 * @param operator The operator.
 * @param operand The operand expression.
 */
public record UnaryExpression(UnaryOperator operator, Expression operand) implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitUnaryExpression(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(operand);
    }
}
