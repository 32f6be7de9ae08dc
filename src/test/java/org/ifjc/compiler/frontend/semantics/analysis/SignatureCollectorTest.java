package org.ifjc.compiler.frontend.semantics.analysis;

import org.ifjc.compiler.diagnostics.SemanticErrorKind;
import org.ifjc.compiler.diagnostics.SemanticException;
import org.ifjc.compiler.frontend.parser.ast.ProgramNode;
import org.ifjc.compiler.frontend.semantics.FunctionRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.ifjc.compiler.frontend.parser.ast.TestAst.block;
import static org.ifjc.compiler.frontend.parser.ast.TestAst.cls;
import static org.ifjc.compiler.frontend.parser.ast.TestAst.function;
import static org.ifjc.compiler.frontend.parser.ast.TestAst.getter;
import static org.ifjc.compiler.frontend.parser.ast.TestAst.ifThen;
import static org.ifjc.compiler.frontend.parser.ast.TestAst.main;
import static org.ifjc.compiler.frontend.parser.ast.TestAst.num;
import static org.ifjc.compiler.frontend.parser.ast.TestAst.program;
import static org.ifjc.compiler.frontend.parser.ast.TestAst.setter;

@Tag("unit")
class SignatureCollectorTest {

    private FunctionRegistry registry;
    private SignatureCollector collector;

    @BeforeEach
    void setUp() {
        registry = new FunctionRegistry(1021);
        collector = new SignatureCollector(registry);
    }

    private void assertRejected(ProgramNode program, SemanticErrorKind kind) {
        assertThatThrownBy(() -> collector.collect(program))
                .isInstanceOfSatisfying(SemanticException.class, e -> assertThat(e.kind()).isEqualTo(kind));
    }

    @Test
    void missingMainIsDefinitionError() {
        assertRejected(program(function("f", List.of())), SemanticErrorKind.DEFINITION);
    }

    @Test
    void mainWithParametersIsDefinitionError() {
        assertRejected(program(function("main", List.of("p"))), SemanticErrorKind.DEFINITION);
    }

    @Test
    void mainWithoutParametersIsAccepted() {
        assertThatCode(() -> collector.collect(program(main()))).doesNotThrowAnyException();
        assertThat(collector.seenMain()).isTrue();
        assertThat(registry.hasSignature("main", 0)).isTrue();
    }

    @Test
    void mainMayFollowOtherFunctions() {
        collector.collect(program(function("helper", List.of("a")), main()));

        assertThat(registry.hasSignature("helper", 1)).isTrue();
    }

    @Test
    void collectsHeadersInNestedBlocksButNotInBodies() {
        collector.collect(program(
                main(function("inner", List.of())),
                block(function("nested", List.of("x", "y"))),
                ifThen(num(1), block(getter("p"))),
                setter("p", "v")));

        assertThat(registry.hasSignature("nested", 2)).isTrue();
        assertThat(registry.hasGetter("p")).isTrue();
        assertThat(registry.hasSetter("p")).isTrue();
        assertThat(registry.hasOverload("inner")).isFalse();
    }

    @Test
    void duplicateHeaderInOneClassIsRedefinition() {
        assertRejected(program(main(), function("f", List.of("a")), function("f", List.of("b"))),
                SemanticErrorKind.REDEFINITION);
    }

    @Test
    void duplicateHeaderAcrossClassesIsShared() {
        assertThatCode(() -> collector.collect(program(
                cls("A", main(), function("f", List.of("a"))),
                cls("B", function("f", List.of("a"))))))
                .doesNotThrowAnyException();
    }

    @Test
    void duplicateGetterInOneClassIsRedefinition() {
        assertRejected(program(main(), getter("p"), getter("p")), SemanticErrorKind.REDEFINITION);
    }
}
