package org.metric.compiler.frontend.semantics;

import org.metric.compiler.types.Type;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A symbol table for variable types during type checking.
 * <p>
 * Scopes are not nested lexically: entering a scope starts from a copy of the current one,
 * and leaving it discards everything bound since. Function bodies are the only construct
 * that enters a scope; {@code if} and {@code while} bodies bind into the current one.
 */
public class SymbolTable {

    private final Deque<Map<String, Type>> scopes = new ArrayDeque<>();

    /**
     * Constructs a symbol table with an empty global scope.
     */
    public SymbolTable() {
        scopes.push(new HashMap<>());
    }

    /**
     * Enters a new scope that starts with every binding of the current one.
     */
    public void enterScope() {
        scopes.push(new HashMap<>(current()));
    }

    /**
     * Leaves the current scope, restoring the bindings that were visible before it was entered.
     */
    public void leaveScope() {
        if (scopes.size() > 1) {
            scopes.pop();
        }
    }

    /**
     * Binds a name in the current scope, replacing any previous binding.
     * @param name The variable name.
     * @param type Its type.
     */
    public void define(String name, Type type) {
        current().put(name, type);
    }

    /**
     * @param name The variable name.
     * @return true if the name is bound in the current scope.
     */
    public boolean isDefined(String name) {
        return current().containsKey(name);
    }

    /**
     * Resolves a variable in the current scope.
     * @param name The variable name.
     * @return The type, or empty if the name is unbound.
     */
    public Optional<Type> resolve(String name) {
        return Optional.ofNullable(current().get(name));
    }

    /**
     * @return The number of active scopes, 1 at top level.
     */
    public int depth() {
        return scopes.size();
    }

    private Map<String, Type> current() {
        return scopes.peek();
    }
}
