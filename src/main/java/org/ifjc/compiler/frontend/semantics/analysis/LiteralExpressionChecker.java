package org.ifjc.compiler.frontend.semantics.analysis;

import org.ifjc.compiler.diagnostics.SemanticException;
import org.ifjc.compiler.frontend.parser.ast.BinaryExpression;
import org.ifjc.compiler.frontend.parser.ast.CallExpression;
import org.ifjc.compiler.frontend.parser.ast.Expression;
import org.ifjc.compiler.frontend.parser.ast.IntLiteral;
import org.ifjc.compiler.frontend.parser.ast.TernaryExpression;
import org.ifjc.compiler.frontend.parser.ast.UnaryExpression;

import java.util.Optional;

/**
 * Pass-1 expression checks that need no type information: operator legality on pure literal
 * operands, and call arity against the signatures collected so far.
 * <p>
 * Only {@code + - * /} and the relational operators are checked here, and only when both
 * operands are pure literals. String repetition needs the string on the left and an integer
 * literal on the right; the resolution pass accepts either order.
 */
public class LiteralExpressionChecker {

    private final CallValidator calls;

    public LiteralExpressionChecker(CallValidator calls) {
        this.calls = calls;
    }

    /**
     * Walks {@code expression} bottom-up.
     *
     * @param expression The expression to check, may be null.
     * @throws SemanticException of kind EXPRESSION_TYPE or ARGUMENT_COUNT on the first violation.
     */
    public void check(Expression expression) {
        if (expression instanceof UnaryExpression unary) {
            check(unary.operand());
        } else if (expression instanceof BinaryExpression binary) {
            check(binary.left());
            check(binary.right());
            checkLiteralOperands(binary);
        } else if (expression instanceof TernaryExpression ternary) {
            check(ternary.condition());
            check(ternary.thenValue());
            check(ternary.elseValue());
        } else if (expression instanceof CallExpression call) {
            call.arguments().forEach(this::check);
            calls.checkDeclared(call);
        }
    }

    private void checkLiteralOperands(BinaryExpression binary) {
        Optional<LiteralKind> left = LiteralKind.of(binary.left());
        Optional<LiteralKind> right = LiteralKind.of(binary.right());
        if (left.isEmpty() || right.isEmpty()
                || left.get() == LiteralKind.NULL || right.get() == LiteralKind.NULL) {
            return;
        }
        boolean numeric = left.get() == LiteralKind.NUMERIC && right.get() == LiteralKind.NUMERIC;
        boolean legal = switch (binary.operator()) {
            case ADD -> numeric || (left.get() == LiteralKind.STRING && right.get() == LiteralKind.STRING);
            case SUB, DIV, LT, LE, GT, GE -> numeric;
            case MUL -> numeric || (left.get() == LiteralKind.STRING && binary.right() instanceof IntLiteral);
            default -> true;
        };
        if (!legal) {
            throw SemanticException.expressionType("Operator '" + binary.operator().symbol()
                    + "' cannot be applied to " + describe(left.get()) + " and " + describe(right.get()) + ".");
        }
    }

    private static String describe(LiteralKind kind) {
        return kind.name().toLowerCase() + " literal";
    }
}
