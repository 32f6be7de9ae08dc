package org.ifjc.compiler.frontend.semantics;

import org.ifjc.compiler.diagnostics.SemanticErrorKind;
import org.ifjc.compiler.diagnostics.SemanticException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class SymbolTableTest {

    @Test
    void insertIsIdempotent() {
        SymbolTable table = new SymbolTable(17);
        Symbol first = table.insert("x", SymbolKind.VARIABLE, false);
        first.withType(DataType.INT);

        Symbol second = table.insert("x", SymbolKind.PARAMETER, true);

        assertThat(second).isSameAs(first);
        assertThat(table.size()).isEqualTo(1);
        assertThat(table.get("x")).get().extracting(Symbol::kind, Symbol::type, Symbol::defined)
                .containsExactly(SymbolKind.VARIABLE, DataType.INT, false);
    }

    @Test
    void findReturnsStoredKeyAndSymbol() {
        SymbolTable table = new SymbolTable(17);
        Symbol symbol = table.insert("f#2", SymbolKind.FUNCTION, true);

        assertThat(table.find("f#2")).hasValueSatisfying(entry -> {
            assertThat(entry.key()).isEqualTo("f#2");
            assertThat(entry.symbol()).isSameAs(symbol);
        });
        assertThat(table.find("f#3")).isEmpty();
        assertThat(table.get(null)).isEmpty();
    }

    @Test
    void collidingKeysAreProbedLinearlyWithWraparound() {
        // Three keys fill all three slots, so at least one probe wraps around.
        SymbolTable table = new SymbolTable(3);
        table.insert("a", SymbolKind.VARIABLE, true);
        table.insert("b", SymbolKind.VARIABLE, true);
        table.insert("c", SymbolKind.VARIABLE, true);

        assertThat(table.contains("a")).isTrue();
        assertThat(table.contains("b")).isTrue();
        assertThat(table.contains("c")).isTrue();
        assertThat(table.contains("d")).isFalse();
    }

    @Test
    void fullTableIsInternalError() {
        SymbolTable table = new SymbolTable(2);
        table.insert("a", SymbolKind.VARIABLE, true);
        table.insert("b", SymbolKind.VARIABLE, true);

        assertThatThrownBy(() -> table.insert("c", SymbolKind.VARIABLE, true))
                .isInstanceOf(SemanticException.class)
                .extracting(e -> ((SemanticException) e).kind())
                .isEqualTo(SemanticErrorKind.INTERNAL);
        // Re-inserting a present key still works on a full table.
        assertThat(table.insert("a", SymbolKind.VARIABLE, false).defined()).isTrue();
    }

    @Test
    void forEachVisitsEveryEntry() {
        SymbolTable table = new SymbolTable(31);
        table.insert("x", SymbolKind.VARIABLE, true);
        table.insert("y", SymbolKind.VARIABLE, true);
        table.insert("get:p", SymbolKind.GETTER, true);

        List<String> keys = new ArrayList<>();
        table.forEach((key, symbol) -> keys.add(key));

        assertThat(keys).containsExactlyInAnyOrder("x", "y", "get:p");
    }

    @Test
    void hashIsDjb2() {
        assertThat(SymbolTable.hash("")).isEqualTo(5381L);
        assertThat(SymbolTable.hash("a")).isEqualTo(5381L * 33 + 'a');
    }
}
