package org.metric.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A bracketed list of element expressions, e.g. {@code [1, 2, 3]}.
 *
 * @param elements The element expressions. The parser accepts an empty list; the type checker rejects it.
 */
public record ListLiteral(List<Expression> elements) implements Expression {

    public ListLiteral {
        elements = List.copyOf(elements);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitListLiteral(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(elements);
    }
}
