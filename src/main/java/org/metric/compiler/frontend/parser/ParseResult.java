package org.metric.compiler.frontend.parser;

import org.metric.compiler.api.SourcePosition;
import org.metric.compiler.frontend.parser.ast.AstNode;
import org.metric.compiler.frontend.parser.ast.Statement;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * The output of the {@link Parser}: the top-level statements of a program plus the source
 * position of every node the parser created.
 * <p>
 * Positions live beside the tree instead of inside the nodes so that nodes stay plain values
 * and a hand-built AST compares equal to a parsed one. The table is keyed by node identity.
 *
 * @param statements The top-level statements in program order.
 * @param positions Node to position of its first token.
 */
public record ParseResult(List<Statement> statements, Map<AstNode, SourcePosition> positions) {

    public ParseResult {
        statements = List.copyOf(statements);
        IdentityHashMap<AstNode, SourcePosition> copy = new IdentityHashMap<>(positions);
        positions = Collections.unmodifiableMap(copy);
    }

    /**
     * Wraps statements that did not come from the parser, e.g. an AST built in a test.
     * @param statements The statements.
     * @return A result without position information.
     */
    public static ParseResult of(List<Statement> statements) {
        return new ParseResult(statements, new IdentityHashMap<>());
    }

    /**
     * Looks up where a node starts in the source.
     * @param node The node.
     * @return Its position, or {@link SourcePosition#UNKNOWN}.
     */
    public SourcePosition positionOf(AstNode node) {
        return positions.getOrDefault(node, SourcePosition.UNKNOWN);
    }
}
