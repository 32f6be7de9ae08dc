package org.ifjc.compiler.frontend.parser.ast;

/**
 * Binary operation.
 *
 * @param operator The operator.
 * @param left     The left operand.
 * @param right    The right operand.
 */
public record BinaryExpression(BinaryOperator operator, Expression left, Expression right) implements Expression {
}
