package org.metric.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A call of a user-defined function.
 *
 * @param name The function name.
 * @param arguments The argument expressions, evaluated left to right.
 */
public record FunctionCall(String name, List<Expression> arguments) implements Expression {

    public FunctionCall {
        arguments = List.copyOf(arguments);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(arguments);
    }
}
