package org.metric.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Loop block. The condition is re-tested before every iteration; the body does not open a scope.
 *
 * @param condition The boolean condition.
 * @param body The loop body.
 */
public record While(Expression condition, List<Statement> body) implements Statement {

    public While {
        body = List.copyOf(body);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitWhile(this);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        children.add(condition);
        children.addAll(body);
        return children;
    }
}
