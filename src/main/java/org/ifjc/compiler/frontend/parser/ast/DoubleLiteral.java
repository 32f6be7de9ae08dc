package org.ifjc.compiler.frontend.parser.ast;

/**
 * Floating-point literal.
 *
 * @param value The literal value.
 */
public record DoubleLiteral(double value) implements Expression {
}
