package org.metric.compiler.frontend.parser.ast;

/**
 * Visitor over every expression node type. Each compiler pass implements it once.
 * @param <R> The result type of the pass.
 */
public interface ExpressionVisitor<R> {
    R visitIntegerLiteral(IntegerLiteral node);
    R visitFloatLiteral(FloatLiteral node);
    R visitBooleanLiteral(BooleanLiteral node);
    R visitVariable(Variable node);
    R visitUnaryExpression(UnaryExpression node);
    R visitBinaryExpression(BinaryExpression node);
    R visitFunctionCall(FunctionCall node);
    R visitListLiteral(ListLiteral node);
    R visitListAccess(ListAccess node);
    R visitRepeatCall(RepeatCall node);
    R visitLenCall(LenCall node);
}
