package org.ifjc.compiler.frontend.semantics;

import org.ifjc.compiler.diagnostics.SemanticErrorKind;
import org.ifjc.compiler.diagnostics.SemanticException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ScopeIdStackTest {

    @Test
    void currentIsGlobalWhenEmpty() {
        ScopeIdStack ids = new ScopeIdStack(8);

        assertThat(ids.current()).isEqualTo(ScopeIdStack.GLOBAL);
        assertThat(ids.depth()).isZero();
    }

    @Test
    void siblingsAreNumberedInDocumentOrder() {
        ScopeIdStack ids = new ScopeIdStack(8);

        assertThat(ids.enterRoot()).isEqualTo("1");
        assertThat(ids.enterChild()).isEqualTo("1.1");
        assertThat(ids.enterChild()).isEqualTo("1.1.1");
        ids.leave();
        assertThat(ids.enterChild()).isEqualTo("1.1.2");
        ids.leave();
        ids.leave();
        assertThat(ids.enterChild()).isEqualTo("1.2");
        assertThat(ids.current()).isEqualTo("1.2");
        assertThat(ids.depth()).isEqualTo(2);
    }

    @Test
    void laterRootsGetTheNextNumber() {
        ScopeIdStack ids = new ScopeIdStack(8);
        ids.enterRoot();
        ids.leave();

        assertThat(ids.enterChild()).isEqualTo("2");
    }

    @Test
    void exceedingMaxDepthIsInternalError() {
        ScopeIdStack ids = new ScopeIdStack(2);
        ids.enterRoot();
        ids.enterChild();

        assertThatThrownBy(ids::enterChild)
                .isInstanceOfSatisfying(SemanticException.class,
                        e -> assertThat(e.kind()).isEqualTo(SemanticErrorKind.INTERNAL));
    }

    @Test
    void underflowIsInternalError() {
        ScopeIdStack ids = new ScopeIdStack(2);

        assertThatThrownBy(ids::leave)
                .isInstanceOfSatisfying(SemanticException.class,
                        e -> assertThat(e.kind()).isEqualTo(SemanticErrorKind.INTERNAL));
    }
}
