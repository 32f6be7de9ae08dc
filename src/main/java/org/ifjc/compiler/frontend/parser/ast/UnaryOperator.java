package org.ifjc.compiler.frontend.parser.ast;

/**
 * Unary operators. Both yield a boolean.
 */
public enum UnaryOperator {
    NOT("!"),
    NOT_NULL("!!");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
