package org.metric.compiler.frontend.parser.ast;

import java.util.List;

/**
 * Replaces one element of a list variable, {@code set name[index] = value}.
 *
 * @param listName The list variable.
 * @param index The index expression.
 * @param value The new element value.
 */
public record ListAssignment(String listName, Expression index, Expression value) implements Statement {

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitListAssignment(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(index, value);
    }
}
