package org.metric.compiler.frontend.semantics;

import org.metric.compiler.types.Type;

import java.util.List;

/**
 * The statically known shape of a declared function.
 *
 * @param parameterTypes The parameter types in declaration order.
 * @param returnType The declared return type.
 */
public record FunctionSignature(List<Type> parameterTypes, Type returnType) {

    public FunctionSignature {
        parameterTypes = List.copyOf(parameterTypes);
    }

    public int arity() {
        return parameterTypes.size();
    }
}
