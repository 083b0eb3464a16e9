package org.metric.compiler.frontend.parser.ast;

import org.metric.compiler.types.Type;

import java.util.List;

/**
 * Declares and initializes a variable, {@code let name type = expression}.
 *
 * @param name The variable name.
 * @param type The declared type.
 * @param expression The initializer.
 */
public record Let(String name, Type type, Expression expression) implements Statement {

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitLet(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(expression);
    }
}
