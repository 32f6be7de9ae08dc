package org.ifjc.compiler.frontend.parser.ast;

/**
 * Unary operation.
 *
 * @param operator The operator.
 * @param operand  The operand.
 */
public record UnaryExpression(UnaryOperator operator, Expression operand) implements Expression {
}
