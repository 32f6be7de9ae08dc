package org.ifjc.compiler.frontend.parser.ast;

/**
 * An expression evaluated for its side effects, typically a call.
 *
 * @param expression The expression.
 */
public record ExpressionStatementNode(Expression expression) implements AstNode {
}
