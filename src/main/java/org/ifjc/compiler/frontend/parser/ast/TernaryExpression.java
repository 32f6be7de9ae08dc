package org.ifjc.compiler.frontend.parser.ast;

/**
 * Conditional expression {@code condition ? thenValue : elseValue}.
 *
 * @param condition The condition.
 * @param thenValue Value when the condition holds.
 * @param elseValue Value otherwise.
 */
public record TernaryExpression(Expression condition, Expression thenValue, Expression elseValue) implements Expression {
}
