package org.metric.compiler.frontend.parser.ast;

import java.util.List;

/**
 * Writes a value to the program's output.
 *
 * @param expression The value to print.
 */
public record Print(Expression expression) implements Statement {

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitPrint(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(expression);
    }
}
