package org.metric.compiler.frontend.parser.ast;

import java.util.List;

/**
 * Leaves the enclosing function with a value.
 *
 * @param expression The returned value.
 */
public record Return(Expression expression) implements Statement {

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitReturn(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(expression);
    }
}
