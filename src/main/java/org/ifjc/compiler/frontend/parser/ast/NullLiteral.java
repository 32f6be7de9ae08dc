package org.ifjc.compiler.frontend.parser.ast;

/**
 * The {@code null} literal.
 */
public record NullLiteral() implements Expression {
}
