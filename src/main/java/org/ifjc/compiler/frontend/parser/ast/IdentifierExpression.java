package org.ifjc.compiler.frontend.parser.ast;

/**
 * Read of a local, a parameter, a getter-backed property or a global.
 *
 * @param name The identifier.
 */
public record IdentifierExpression(String name) implements Expression {
}
