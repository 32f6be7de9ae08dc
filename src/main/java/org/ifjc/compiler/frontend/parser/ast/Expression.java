package org.ifjc.compiler.frontend.parser.ast;

/**
 * Closed set of expression shapes. Analysis code matches over the permitted records
 * exhaustively; adding a shape requires touching every matcher.
 */
public sealed interface Expression extends AstNode
        permits IntLiteral, DoubleLiteral, StringLiteral, NullLiteral,
                IdentifierExpression, TypeNameExpression, CallExpression,
                UnaryExpression, BinaryExpression, TernaryExpression {
}
