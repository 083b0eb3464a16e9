package org.metric.compiler.frontend.parser.ast;

/**
 * An AST node that produces a value.
 */
public interface Expression extends AstNode {

    /**
     * Dispatches to the visitor method for this node's concrete type.
     * @param visitor The visitor.
     * @param <R> The visitor's result type.
     * @return The visitor's result.
     */
    <R> R accept(ExpressionVisitor<R> visitor);
}
