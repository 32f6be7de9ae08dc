package org.ifjc.compiler.frontend.parser.ast;

/**
 * Local variable declaration ({@code var name}).
 *
 * @param name The declared identifier.
 */
public record VarDeclarationNode(String name) implements AstNode {
}
