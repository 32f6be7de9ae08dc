package org.ifjc.compiler.frontend.parser.ast;

import java.util.Arrays;
import java.util.Optional;

/**
 * Binary operators grouped by the typing rule that governs them.
 */
public enum BinaryOperator {
    ADD("+", Category.ARITHMETIC),
    SUB("-", Category.ARITHMETIC),
    MUL("*", Category.ARITHMETIC),
    DIV("/", Category.ARITHMETIC),
    CONCAT("++", Category.CONCATENATION),
    LT("<", Category.RELATIONAL),
    LE("<=", Category.RELATIONAL),
    GT(">", Category.RELATIONAL),
    GE(">=", Category.RELATIONAL),
    EQUALS("==", Category.EQUALITY),
    NOT_EQUAL("!=", Category.EQUALITY),
    AND("&&", Category.LOGICAL),
    OR("||", Category.LOGICAL),
    IS("is", Category.TYPE_TEST);

    /**
     * Typing rule family of an operator.
     */
    public enum Category {
        ARITHMETIC,
        CONCATENATION,
        RELATIONAL,
        EQUALITY,
        LOGICAL,
        TYPE_TEST
    }

    private final String symbol;
    private final Category category;

    BinaryOperator(String symbol, Category category) {
        this.symbol = symbol;
        this.category = category;
    }

    public String symbol() {
        return symbol;
    }

    public Category category() {
        return category;
    }

    /**
     * Looks up an operator by its source symbol or its constant name (case-insensitive).
     *
     * @param text The symbol ({@code "+"}) or name ({@code "add"}).
     * @return The operator, or empty if unknown.
     */
    public static Optional<BinaryOperator> fromText(String text) {
        return Arrays.stream(values())
                .filter(op -> op.symbol.equals(text) || op.name().equalsIgnoreCase(text))
                .findFirst();
    }
}
