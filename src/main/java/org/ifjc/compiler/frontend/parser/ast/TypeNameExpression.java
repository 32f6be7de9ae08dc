package org.ifjc.compiler.frontend.parser.ast;

/**
 * A type name on the right-hand side of {@code is} ({@code Num}, {@code String}, {@code Null}).
 *
 * @param name The type name as written.
 */
public record TypeNameExpression(String name) implements Expression {
}
