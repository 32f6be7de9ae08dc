package org.ifjc.compiler.frontend.parser.ast;

/**
 * A formal parameter of a function or setter.
 *
 * @param name The parameter name.
 */
public record ParameterNode(String name) implements AstNode {
}
