package org.metric.compiler.frontend;

import org.metric.compiler.frontend.parser.ast.AstNode;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * A generic class for traversing an Abstract Syntax Tree.
 * Instead of a full visitor, this walker uses a handler-based system so that
 * passes interested in only a few node kinds stay small.
 */
public class TreeWalker {

    private final Map<Class<? extends AstNode>, Consumer<AstNode>> handlers;
    private final Set<Class<? extends AstNode>> opaque;

    /**
     * Constructs a new TreeWalker.
     * @param handlers A map from AST node classes to their corresponding handlers.
     */
    public TreeWalker(Map<Class<? extends AstNode>, Consumer<AstNode>> handlers) {
        this(handlers, Set.of());
    }

    /**
     * Constructs a new TreeWalker that does not descend into nodes of the given classes.
     * Such nodes are still passed to their handler.
     * @param handlers A map from AST node classes to their corresponding handlers.
     * @param opaque The node classes whose children are skipped.
     */
    public TreeWalker(Map<Class<? extends AstNode>, Consumer<AstNode>> handlers, Set<Class<? extends AstNode>> opaque) {
        this.handlers = handlers;
        this.opaque = opaque;
    }

    /**
     * Walks a list of AST nodes.
     * @param nodes The list of nodes to walk.
     */
    public void walk(List<? extends AstNode> nodes) {
        for (AstNode node : nodes) {
            walk(node);
        }
    }

    /**
     * Walks a single AST node and its children recursively.
     * @param node The node to walk.
     */
    public void walk(AstNode node) {
        if (node == null) {
            return;
        }

        handlers.getOrDefault(node.getClass(), n -> {}).accept(node);
        if (opaque.contains(node.getClass())) {
            return;
        }

        for (AstNode child : node.getChildren()) {
            walk(child);
        }
    }

    /**
     * Checks whether any node of the given class occurs in the given subtrees.
     * @param nodes The roots to search.
     * @param type The node class to look for.
     * @param opaque Node classes whose children are not searched.
     * @return true if at least one node of that class is reachable.
     */
    public static boolean contains(List<? extends AstNode> nodes, Class<? extends AstNode> type,
                                   Set<Class<? extends AstNode>> opaque) {
        boolean[] found = {false};
        new TreeWalker(Map.of(type, n -> found[0] = true), opaque).walk(nodes);
        return found[0];
    }
}
