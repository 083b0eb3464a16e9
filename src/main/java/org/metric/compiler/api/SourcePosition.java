package org.metric.compiler.api;

/**
 * A position in Metric source code.
 *
 * @param line The 1-based line number.
 * @param column The 1-based column number.
 */
public record SourcePosition(int line, int column) {

    /** Placeholder for nodes that were not produced by the parser (e.g. hand-built ASTs). */
    public static final SourcePosition UNKNOWN = new SourcePosition(0, 0);

    @Override
    public String toString() {
        return "line " + line + ", column " + column;
    }
}
