package org.metric.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Conditional block. The body does not open a scope.
 *
 * @param condition The boolean condition.
 * @param body The statements run when the condition holds.
 */
public record If(Expression condition, List<Statement> body) implements Statement {

    public If {
        body = List.copyOf(body);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitIf(this);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        children.add(condition);
        children.addAll(body);
        return children;
    }
}
