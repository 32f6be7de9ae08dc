package org.ifjc.compiler.frontend.semantics;

import org.ifjc.compiler.diagnostics.SemanticErrorKind;
import org.ifjc.compiler.diagnostics.SemanticException;
import org.ifjc.compiler.frontend.parser.ast.AstNode;
import org.ifjc.compiler.frontend.parser.ast.BlockNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ScopeStackTest {

    private Map<AstNode, ScopeFrame> scopeMap;
    private ScopeStack scopes;

    @BeforeEach
    void setUp() {
        scopeMap = new IdentityHashMap<>();
        scopes = ScopeStack.forDeclaration(32, 31, scopeMap);
    }

    private static BlockNode block() {
        return new BlockNode(List.of());
    }

    @Test
    void innerDeclarationShadowsOuterUntilPopped() {
        scopes.enter(block());
        scopes.declareLocal("x", true);
        Symbol outer = scopes.lookupInCurrent("x").orElseThrow();

        scopes.enter(block());
        assertThat(scopes.declareLocal("x", true)).isTrue();
        Symbol inner = scopes.lookupInCurrent("x").orElseThrow();
        assertThat(inner).isNotSameAs(outer);
        assertThat(scopes.lookup("x")).containsSame(inner);

        scopes.leave();
        assertThat(scopes.lookup("x")).containsSame(outer);
        scopes.leave();
        assertThat(scopes.lookup("x")).isEmpty();
    }

    @Test
    void redeclaringInSameFrameFails() {
        scopes.enter(block());

        assertThat(scopes.declareLocal("x", true)).isTrue();
        assertThat(scopes.declareLocal("x", true)).isFalse();
    }

    @Test
    void childMayDeclareNameOfParent() {
        scopes.enter(block());
        scopes.declareLocal("x", true);
        scopes.enter(block());

        assertThat(scopes.lookupInCurrent("x")).isEmpty();
        assertThat(scopes.declareLocal("x", true)).isTrue();
    }

    @Test
    void framesCarryTheirPathAndAreRecordedPerOwner() {
        BlockNode root = block();
        BlockNode first = block();
        BlockNode second = block();

        scopes.enter(root);
        scopes.enter(first);
        scopes.declareLocal("a", true);
        assertThat(scopes.lookup("a")).get().extracting(Symbol::scopePath).isEqualTo("1.1");
        scopes.leave();
        scopes.enter(second);
        assertThat(scopes.currentPath()).isEqualTo("1.2");
        scopes.dispose();

        assertThat(scopes.isEmpty()).isTrue();
        assertThat(scopes.currentPath()).isEqualTo(ScopeIdStack.GLOBAL);
        assertThat(scopeMap).hasSize(3);
        assertThat(scopeMap.get(first).path()).isEqualTo("1.1");
        assertThat(scopeMap.get(second).codegenName("a")).isEqualTo("a_12");
    }

    @Test
    void reenterHidesVariablesUntilDefinedAgain() {
        BlockNode owner = block();
        scopes.enter(owner);
        scopes.declareLocal("x", true);
        scopes.declareLocal("p", SymbolKind.PARAMETER, true);
        scopes.dispose();

        ScopeStack resolution = ScopeStack.forResolution(scopeMap);
        ScopeFrame frame = resolution.reenter(owner);

        assertThat(frame).isSameAs(scopeMap.get(owner));
        assertThat(resolution.lookupDefined("x")).isEmpty();
        assertThat(resolution.lookup("x")).isPresent();
        assertThat(resolution.lookupDefined("p")).isPresent();

        resolution.lookupInCurrent("x").orElseThrow().setDefined(true);
        assertThat(resolution.lookupDefined("x")).isPresent();
    }

    @Test
    void resolutionStackCannotOpenFrames() {
        ScopeStack resolution = ScopeStack.forResolution(scopeMap);

        assertThatThrownBy(() -> resolution.enter(block())).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> resolution.reenter(block()))
                .isInstanceOfSatisfying(SemanticException.class,
                        e -> assertThat(e.kind()).isEqualTo(SemanticErrorKind.INTERNAL));
    }

    @Test
    void underflowAndMissingFrameAreInternalErrors() {
        assertThatThrownBy(scopes::leave).isInstanceOf(SemanticException.class);
        assertThatThrownBy(() -> scopes.declareLocal("x", true)).isInstanceOf(SemanticException.class);
        assertThat(scopes.current()).isEmpty();
    }
}
