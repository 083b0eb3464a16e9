package org.metric.compiler.types;

import java.util.Objects;

/**
 * A homogeneous list type. Lists cannot nest, so the element type is always a scalar.
 *
 * @param elementType The type of every element.
 */
public record ListType(ScalarType elementType) implements Type {

    public ListType {
        Objects.requireNonNull(elementType, "elementType");
    }

    @Override
    public String displayName() {
        return "list of " + elementType.displayName();
    }

    @Override
    public String toString() {
        return displayName();
    }
}
