package org.metric.compiler.frontend.parser.ast;

import org.metric.compiler.types.Type;

/**
 * A formal parameter of a function declaration.
 *
 * @param name The parameter name.
 * @param type The declared parameter type.
 */
public record Parameter(String name, Type type) {
}
