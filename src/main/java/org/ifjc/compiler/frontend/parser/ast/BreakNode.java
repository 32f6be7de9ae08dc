package org.ifjc.compiler.frontend.parser.ast;

/**
 * {@code break} statement.
 */
public record BreakNode() implements AstNode {
}
