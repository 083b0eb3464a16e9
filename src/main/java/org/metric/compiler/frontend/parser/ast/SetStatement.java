package org.metric.compiler.frontend.parser.ast;

import java.util.List;

/**
 * Reassigns an existing variable, {@code set name = expression}.
 *
 * @param name The variable name.
 * @param expression The new value.
 */
public record SetStatement(String name, Expression expression) implements Statement {

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitSet(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(expression);
    }
}
