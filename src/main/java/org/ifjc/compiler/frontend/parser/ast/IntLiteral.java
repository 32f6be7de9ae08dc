package org.ifjc.compiler.frontend.parser.ast;

/**
 * Integer literal.
 *
 * @param value The literal value.
 */
public record IntLiteral(long value) implements Expression {
}
