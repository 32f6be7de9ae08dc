package org.ifjc.compiler.frontend.parser.ast;

/**
 * Return statement.
 *
 * @param value The returned expression, or null for a bare {@code return}.
 */
public record ReturnNode(Expression value) implements AstNode {
}
