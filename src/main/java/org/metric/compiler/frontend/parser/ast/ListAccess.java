package org.metric.compiler.frontend.parser.ast;

import java.util.List;

/**
 * Element access, {@code name[index]}.
 *
 * @param list The list expression (a {@link Variable} when produced by the parser).
 * @param index The index expression.
 */
public record ListAccess(Expression list, Expression index) implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitListAccess(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(list, index);
    }
}
