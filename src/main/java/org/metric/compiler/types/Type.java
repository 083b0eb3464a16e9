package org.metric.compiler.types;

/**
 * A static Metric type: one of the scalars or a list of a scalar.
 * Types compare structurally and render the way they are written in source code.
 */
public sealed interface Type permits ScalarType, ListType {

    /**
     * @return true for {@code integer} and {@code float}.
     */
    default boolean isNumeric() {
        return this == ScalarType.INTEGER || this == ScalarType.FLOAT;
    }

    /**
     * @return The source spelling, e.g. {@code integer} or {@code list of float}.
     */
    String displayName();
}
