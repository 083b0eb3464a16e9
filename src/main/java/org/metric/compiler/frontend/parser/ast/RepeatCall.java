package org.metric.compiler.frontend.parser.ast;

import java.util.List;

/**
 * The built-in {@code repeat(value, count)}, which builds a list of {@code count} copies of {@code value}.
 *
 * @param value The scalar to repeat.
 * @param count The number of copies.
 */
public record RepeatCall(Expression value, Expression count) implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitRepeatCall(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(value, count);
    }
}
