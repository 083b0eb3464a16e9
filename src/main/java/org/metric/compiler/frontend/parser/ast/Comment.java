package org.metric.compiler.frontend.parser.ast;

/**
 * Placeholder for a source comment. Has no effect and no cost.
 */
public record Comment() implements Statement {

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitComment(this);
    }
}
