package org.metric.compiler.frontend.parser.ast;

/**
 * An AST node that is executed for its effect. A program is an ordered list of statements.
 */
public interface Statement extends AstNode {

    /**
     * Dispatches to the visitor method for this node's concrete type.
     * @param visitor The visitor.
     * @param <R> The visitor's result type.
     * @return The visitor's result.
     */
    <R> R accept(StatementVisitor<R> visitor);
}
