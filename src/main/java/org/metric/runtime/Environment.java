package org.metric.runtime;

import org.metric.compiler.api.EvaluationException;
import org.metric.compiler.api.SourcePosition;
import org.metric.compiler.frontend.parser.ast.FunctionDeclaration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The bindings visible to executing code: variables, declared functions and the shared
 * {@link CostCounter}.
 * <p>
 * Environments are persistent. Every binding operation returns a new environment with
 * copied maps and leaves the receiver untouched, while the cost counter is shared by
 * reference so that every derived environment sees the same running total.
 */
public final class Environment {

    private final Map<String, Value> variables;
    private final Map<String, FunctionDeclaration> functions;
    private final CostCounter cost;

    private Environment(Map<String, Value> variables, Map<String, FunctionDeclaration> functions, CostCounter cost) {
        this.variables = Collections.unmodifiableMap(variables);
        this.functions = Collections.unmodifiableMap(functions);
        this.cost = cost;
    }

    /**
     * @return An environment with no bindings and a fresh cost counter at zero.
     */
    public static Environment empty() {
        return new Environment(new HashMap<>(), new HashMap<>(), new CostCounter());
    }

    /**
     * Creates the environment a function body runs in: no variables, the caller's functions,
     * the caller's cost counter.
     * @return The call environment.
     */
    public Environment childForCall() {
        return new Environment(new HashMap<>(), new HashMap<>(functions), cost);
    }

    /**
     * Binds a new variable.
     * @param name The variable name.
     * @param value The value.
     * @return The derived environment.
     */
    public Environment add(String name, Value value) {
        Map<String, Value> copy = new HashMap<>(variables);
        copy.put(name, value);
        return new Environment(copy, functions, cost);
    }

    /**
     * Rebinds an existing variable.
     * @param name The variable name.
     * @param value The new value.
     * @return The derived environment.
     * @throws EvaluationException if the variable is not bound.
     */
    public Environment set(String name, Value value) {
        if (!variables.containsKey(name)) {
            throw new EvaluationException("Cannot set undefined variable: " + name, SourcePosition.UNKNOWN);
        }
        return add(name, value);
    }

    /**
     * Replaces one element of a list variable, copying the list.
     * @param name The list variable.
     * @param index The element index.
     * @param value The new element, which must be a scalar.
     * @return The derived environment.
     * @throws EvaluationException if the variable is unbound or not a list, the index is out of
     *         bounds, or the value is a list.
     */
    public Environment setListElement(String name, long index, Value value) {
        Value current = variables.get(name);
        if (current == null) {
            throw new EvaluationException("Cannot set undefined variable: " + name, SourcePosition.UNKNOWN);
        }
        if (!(current instanceof Value.ListValue list)) {
            throw new EvaluationException("Variable '" + name + "' is not a list", SourcePosition.UNKNOWN);
        }
        if (index < 0 || index >= list.size()) {
            throw new EvaluationException("List index " + index + " out of bounds (list length: " + list.size() + ")",
                    SourcePosition.UNKNOWN);
        }
        if (value instanceof Value.ListValue) {
            throw new EvaluationException("Cannot assign list to list element", SourcePosition.UNKNOWN);
        }
        List<Value> elements = new ArrayList<>(list.elements());
        elements.set((int) index, value);
        return add(name, new Value.ListValue(elements));
    }

    /**
     * Registers a function.
     * @param declaration The declaration.
     * @return The derived environment.
     */
    public Environment addFunction(FunctionDeclaration declaration) {
        Map<String, FunctionDeclaration> copy = new HashMap<>(functions);
        copy.put(declaration.name(), declaration);
        return new Environment(variables, copy, cost);
    }

    public Optional<Value> find(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    public boolean isBound(String name) {
        return variables.containsKey(name);
    }

    public Optional<FunctionDeclaration> function(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    public boolean hasFunction(String name) {
        return functions.containsKey(name);
    }

    /**
     * Counts one operation on the shared counter.
     */
    public void incrementCost() {
        cost.increment();
    }

    /**
     * @return The running operation count shared by all environments of this execution.
     */
    public long cost() {
        return cost.get();
    }
}
