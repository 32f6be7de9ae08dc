package org.ifjc.compiler.frontend.parser.ast;

/**
 * {@code continue} statement.
 */
public record ContinueNode() implements AstNode {
}
