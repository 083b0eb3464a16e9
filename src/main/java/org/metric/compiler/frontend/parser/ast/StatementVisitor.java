package org.metric.compiler.frontend.parser.ast;

/**
 * Visitor over every statement node type.
 * @param <R> The result type of the pass.
 */
public interface StatementVisitor<R> {
    R visitLet(Let node);
    R visitSet(SetStatement node);
    R visitListAssignment(ListAssignment node);
    R visitPrint(Print node);
    R visitIf(If node);
    R visitWhile(While node);
    R visitComment(Comment node);
    R visitFunctionDeclaration(FunctionDeclaration node);
    R visitReturn(Return node);
}
