package org.ifjc.compiler.frontend.semantics.analysis;

import org.ifjc.compiler.builtins.BuiltinOptions;
import org.ifjc.compiler.builtins.IfjBuiltins;
import org.ifjc.compiler.diagnostics.SemanticErrorKind;
import org.ifjc.compiler.diagnostics.SemanticException;
import org.ifjc.compiler.frontend.parser.ast.Expression;
import org.ifjc.compiler.frontend.semantics.DataType;
import org.ifjc.compiler.frontend.semantics.FunctionRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.ifjc.compiler.frontend.parser.ast.BinaryOperator.ADD;
import static org.ifjc.compiler.frontend.parser.ast.BinaryOperator.CONCAT;
import static org.ifjc.compiler.frontend.parser.ast.BinaryOperator.DIV;
import static org.ifjc.compiler.frontend.parser.ast.BinaryOperator.LT;
import static org.ifjc.compiler.frontend.parser.ast.BinaryOperator.MUL;
import static org.ifjc.compiler.frontend.parser.ast.BinaryOperator.SUB;
import static org.ifjc.compiler.frontend.parser.ast.TestAst.bin;
import static org.ifjc.compiler.frontend.parser.ast.TestAst.call;
import static org.ifjc.compiler.frontend.parser.ast.TestAst.dbl;
import static org.ifjc.compiler.frontend.parser.ast.TestAst.id;
import static org.ifjc.compiler.frontend.parser.ast.TestAst.nil;
import static org.ifjc.compiler.frontend.parser.ast.TestAst.num;
import static org.ifjc.compiler.frontend.parser.ast.TestAst.str;

@Tag("unit")
class LiteralExpressionCheckerTest {

    private FunctionRegistry registry;
    private LiteralExpressionChecker checker;

    @BeforeEach
    void setUp() {
        registry = new FunctionRegistry(1021);
        IfjBuiltins builtins = new IfjBuiltins();
        builtins.install(registry, BuiltinOptions.none());
        checker = new LiteralExpressionChecker(new CallValidator(registry, builtins));
    }

    private void assertRejected(Expression expression, SemanticErrorKind kind) {
        assertThatThrownBy(() -> checker.check(expression))
                .isInstanceOfSatisfying(SemanticException.class, e -> assertThat(e.kind()).isEqualTo(kind));
    }

    @Test
    void numericArithmeticPasses() {
        assertThatCode(() -> checker.check(bin(ADD, num(3), num(4)))).doesNotThrowAnyException();
        assertThatCode(() -> checker.check(bin(DIV, dbl(1.5), num(2)))).doesNotThrowAnyException();
        assertThatCode(() -> checker.check(bin(LT, num(1), dbl(2.0)))).doesNotThrowAnyException();
    }

    @Test
    void stringPlusNumberFails() {
        assertRejected(bin(ADD, str("a"), num(3)), SemanticErrorKind.EXPRESSION_TYPE);
    }

    @Test
    void stringPlusStringPasses() {
        assertThatCode(() -> checker.check(bin(ADD, str("a"), str("b")))).doesNotThrowAnyException();
    }

    @Test
    void repetitionNeedsStringOnTheLeft() {
        assertThatCode(() -> checker.check(bin(MUL, str("ab"), num(3)))).doesNotThrowAnyException();
        assertRejected(bin(MUL, num(3), str("ab")), SemanticErrorKind.EXPRESSION_TYPE);
        assertRejected(bin(MUL, str("ab"), dbl(3.0)), SemanticErrorKind.EXPRESSION_TYPE);
    }

    @Test
    void subtractionAndComparisonNeedNumbers() {
        assertRejected(bin(SUB, str("a"), str("b")), SemanticErrorKind.EXPRESSION_TYPE);
        assertRejected(bin(LT, str("a"), num(1)), SemanticErrorKind.EXPRESSION_TYPE);
    }

    @Test
    void nestedLiteralsAreReduced() {
        assertRejected(bin(ADD, bin(CONCAT, str("a"), str("b")), num(1)), SemanticErrorKind.EXPRESSION_TYPE);
        assertThatCode(() -> checker.check(bin(ADD, bin(MUL, num(2), num(3)), num(1)))).doesNotThrowAnyException();
    }

    @Test
    void nonLiteralOperandsAreDeferred() {
        assertThatCode(() -> checker.check(bin(ADD, id("x"), str("a")))).doesNotThrowAnyException();
        assertThatCode(() -> checker.check(bin(MUL, num(3), id("s")))).doesNotThrowAnyException();
        assertThatCode(() -> checker.check(bin(ADD, nil(), num(1)))).doesNotThrowAnyException();
    }

    @Test
    void callsAreCheckedAgainstKnownSignatures() {
        registry.registerFunction("f", 1, "Program", null);

        assertThatCode(() -> checker.check(call("f", num(1)))).doesNotThrowAnyException();
        assertThatCode(() -> checker.check(call("g", num(1), num(2)))).doesNotThrowAnyException();
        assertRejected(call("f"), SemanticErrorKind.ARGUMENT_COUNT);
    }

    @Test
    void builtinLiteralArgumentsMustHaveTheRightKind() {
        assertRejected(call("Ifj.length", num(5)), SemanticErrorKind.ARGUMENT_COUNT);
        assertRejected(call("Ifj.chr", str("a")), SemanticErrorKind.ARGUMENT_COUNT);
        assertRejected(call("Ifj.write"), SemanticErrorKind.ARGUMENT_COUNT);
        assertThatCode(() -> checker.check(call("Ifj.length", str("abc")))).doesNotThrowAnyException();
        assertThatCode(() -> checker.check(call("Ifj.length", id("s")))).doesNotThrowAnyException();
        assertThatCode(() -> checker.check(call("Ifj.length", nil()))).doesNotThrowAnyException();
    }

    @Test
    void argumentsAreCheckedBeforeTheCall() {
        assertRejected(call("Ifj.write", bin(SUB, str("a"), num(1))), SemanticErrorKind.EXPRESSION_TYPE);
        assertThat(registry.returnType("Ifj.write", 1)).isEqualTo(DataType.VOID);
    }
}
