package org.metric.compiler.frontend.parser.ast;

import java.util.List;

/**
 * The built-in {@code len(list)}.
 *
 * @param list The list expression.
 */
public record LenCall(Expression list) implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitLenCall(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(list);
    }
}
