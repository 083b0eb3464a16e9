package org.metric.compiler.frontend.parser.ast;

import org.metric.compiler.types.Type;

import java.util.List;

/**
 * Declares a function, {@code def name(params) returns type} followed by an indented body.
 *
 * @param name The function name.
 * @param parameters The formal parameters in declaration order.
 * @param returnType The declared return type.
 * @param body The function body.
 */
public record FunctionDeclaration(
        String name,
        List<Parameter> parameters,
        Type returnType,
        List<Statement> body
) implements Statement {

    public FunctionDeclaration {
        parameters = List.copyOf(parameters);
        body = List.copyOf(body);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitFunctionDeclaration(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(body);
    }
}
