package org.ifjc.compiler.frontend.semantics.analysis;

import org.ifjc.compiler.frontend.parser.ast.BinaryExpression;
import org.ifjc.compiler.frontend.parser.ast.BinaryOperator;
import org.ifjc.compiler.frontend.parser.ast.DoubleLiteral;
import org.ifjc.compiler.frontend.parser.ast.Expression;
import org.ifjc.compiler.frontend.parser.ast.IntLiteral;
import org.ifjc.compiler.frontend.parser.ast.NullLiteral;
import org.ifjc.compiler.frontend.parser.ast.StringLiteral;
import org.ifjc.compiler.frontend.parser.ast.UnaryExpression;

import java.util.Optional;

/**
 * Kind of a pure literal expression, i.e. one built from literals and operators only.
 */
public enum LiteralKind {
    NUMERIC,
    STRING,
    BOOL,
    NULL;

    /**
     * Reduces {@code expression} to the kind of value it produces, if it is a pure literal.
     *
     * @param expression The expression to classify.
     * @return The kind, or empty if the expression mentions a name or a call, or mixes kinds
     *         in a way that has no literal result.
     */
    public static Optional<LiteralKind> of(Expression expression) {
        if (expression instanceof IntLiteral || expression instanceof DoubleLiteral) {
            return Optional.of(NUMERIC);
        }
        if (expression instanceof StringLiteral) {
            return Optional.of(STRING);
        }
        if (expression instanceof NullLiteral) {
            return Optional.of(NULL);
        }
        if (expression instanceof UnaryExpression unary) {
            return of(unary.operand()).map(k -> BOOL);
        }
        if (expression instanceof BinaryExpression binary) {
            Optional<LiteralKind> left = of(binary.left());
            Optional<LiteralKind> right = of(binary.right());
            if (left.isEmpty() || right.isEmpty()) {
                return Optional.empty();
            }
            return combine(binary.operator(), left.get(), right.get());
        }
        return Optional.empty();
    }

    private static Optional<LiteralKind> combine(BinaryOperator operator, LiteralKind left, LiteralKind right) {
        return switch (operator.category()) {
            case ARITHMETIC -> {
                if (left == NUMERIC && right == NUMERIC) yield Optional.of(NUMERIC);
                if (left == STRING && (right == STRING || right == NUMERIC)) yield Optional.of(STRING);
                yield Optional.empty();
            }
            case CONCATENATION -> left == STRING && right == STRING ? Optional.of(STRING) : Optional.empty();
            default -> Optional.of(BOOL);
        };
    }
}
