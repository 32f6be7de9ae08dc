package org.ifjc.compiler.frontend.parser.ast;

/**
 * String literal (already unescaped by the scanner).
 *
 * @param value The literal text.
 */
public record StringLiteral(String value) implements Expression {
}
