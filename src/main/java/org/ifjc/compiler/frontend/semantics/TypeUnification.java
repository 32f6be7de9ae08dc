package org.ifjc.compiler.frontend.semantics;

import org.ifjc.compiler.frontend.parser.ast.BinaryOperator;

import java.util.Optional;

/**
 * Pure classification and widening rules over {@link DataType} tags.
 * None of these functions look at the tree; the expression typer feeds them operand tags.
 */
public final class TypeUnification {

    private TypeUnification() {
    }

    /**
     * A tag is known when it is neither {@link DataType#UNKNOWN} nor {@link DataType#VOID}.
     */
    public static boolean isKnown(DataType type) {
        return type != DataType.UNKNOWN && type != DataType.VOID;
    }

    public static boolean isNumeric(DataType type) {
        return type == DataType.INT || type == DataType.DOUBLE;
    }

    /**
     * Widens two numeric tags: {@code DOUBLE} wins over {@code INT}.
     *
     * @return The widened tag, or {@link DataType#UNKNOWN} if either side is not numeric.
     */
    public static DataType widen(DataType left, DataType right) {
        if (!isNumeric(left) || !isNumeric(right)) {
            return DataType.UNKNOWN;
        }
        return left == DataType.DOUBLE || right == DataType.DOUBLE ? DataType.DOUBLE : DataType.INT;
    }

    /**
     * Computes the type a symbol holds after being assigned a value of type {@code assigned}.
     * <ul>
     *   <li>an unknown right-hand side leaves the symbol unchanged</li>
     *   <li>an unset symbol ({@code UNKNOWN}, {@code VOID}, {@code NULL}) adopts the new tag</li>
     *   <li>two numeric tags widen</li>
     *   <li>equal tags stay</li>
     *   <li>anything else degrades to {@code UNKNOWN}</li>
     * </ul>
     */
    public static DataType learn(DataType current, DataType assigned) {
        if (!isKnown(assigned)) {
            return current;
        }
        if (current == DataType.UNKNOWN || current == DataType.VOID || current == DataType.NULL) {
            return assigned;
        }
        if (isNumeric(current) && isNumeric(assigned)) {
            return widen(current, assigned);
        }
        if (current == assigned) {
            return current;
        }
        return DataType.UNKNOWN;
    }

    /**
     * Result type of a binary operation whose operand tags are already inferred.
     * <p>
     * When either side is not known the check is skipped: arithmetic yields {@code UNKNOWN},
     * every comparison, logical operator and type test yields {@code BOOL}.
     * {@link BinaryOperator#IS} is not decided here; its right-hand side is a type name.
     *
     * @return The result tag, or empty if the combination is illegal.
     */
    public static Optional<DataType> combine(BinaryOperator operator, DataType left, DataType right) {
        BinaryOperator.Category category = operator.category();
        if (!isKnown(left) || !isKnown(right)) {
            return Optional.of(category == BinaryOperator.Category.ARITHMETIC
                    || category == BinaryOperator.Category.CONCATENATION
                    ? DataType.UNKNOWN : DataType.BOOL);
        }
        return switch (category) {
            case ARITHMETIC -> arithmetic(operator, left, right);
            case CONCATENATION -> left == DataType.STRING && right == DataType.STRING
                    ? Optional.of(DataType.STRING) : Optional.empty();
            case RELATIONAL -> isNumeric(left) && isNumeric(right) ? Optional.of(DataType.BOOL) : Optional.empty();
            case EQUALITY, TYPE_TEST -> Optional.of(DataType.BOOL);
            case LOGICAL -> left == DataType.BOOL && right == DataType.BOOL ? Optional.of(DataType.BOOL) : Optional.empty();
        };
    }

    private static Optional<DataType> arithmetic(BinaryOperator operator, DataType left, DataType right) {
        if (isNumeric(left) && isNumeric(right)) {
            return Optional.of(widen(left, right));
        }
        if (operator == BinaryOperator.ADD && left == DataType.STRING && right == DataType.STRING) {
            return Optional.of(DataType.STRING);
        }
        if (operator == BinaryOperator.MUL
                && ((left == DataType.STRING && right == DataType.INT)
                || (left == DataType.INT && right == DataType.STRING))) {
            return Optional.of(DataType.STRING);
        }
        return Optional.empty();
    }
}
