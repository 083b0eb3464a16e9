package org.metric.compiler.types;

/**
 * The three scalar types.
 */
public enum ScalarType implements Type {
    INTEGER("integer"),
    BOOLEAN("boolean"),
    FLOAT("float");

    private final String displayName;

    ScalarType(String displayName) {
        this.displayName = displayName;
    }

    @Override
    public String displayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
