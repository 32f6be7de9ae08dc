package org.ifjc.compiler.frontend.parser.ast;

/**
 * Assignment to a local, a parameter, a setter-backed property or a global.
 *
 * @param name  The assignment target.
 * @param value The assigned expression.
 */
public record AssignmentNode(String name, Expression value) implements AstNode {
}
