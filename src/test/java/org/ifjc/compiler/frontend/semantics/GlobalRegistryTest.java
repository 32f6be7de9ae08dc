package org.ifjc.compiler.frontend.semantics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class GlobalRegistryTest {

    @Test
    void recognizesThePrefix() {
        GlobalRegistry globals = new GlobalRegistry("__");

        assertThat(globals.isGlobalName("__count")).isTrue();
        assertThat(globals.isGlobalName("count")).isFalse();
        assertThat(globals.isGlobalName("__")).isFalse();
        assertThat(globals.isGlobalName(null)).isFalse();
    }

    @Test
    void recordsEachNameOnceInFirstSeenOrder() {
        GlobalRegistry globals = new GlobalRegistry("__");
        globals.record("__b");
        globals.record("__a");
        globals.record("__b");

        assertThat(globals.copyIdentifiers()).containsExactly("__b", "__a");
    }

    @Test
    void copiesAreDetachedAndResetClearsEverything() {
        GlobalRegistry globals = new GlobalRegistry("__");
        globals.record("__a");
        globals.learn("__a", DataType.INT);
        List<String> copy = globals.copyIdentifiers();

        globals.reset();

        assertThat(copy).containsExactly("__a");
        assertThat(globals.copyIdentifiers()).isEmpty();
        assertThat(globals.typeOf("__a")).isEqualTo(DataType.UNKNOWN);
    }

    @Test
    void learnsTypesLikeLocals() {
        GlobalRegistry globals = new GlobalRegistry("__");
        globals.learn("__x", DataType.INT);
        globals.learn("__x", DataType.DOUBLE);
        assertThat(globals.typeOf("__x")).isEqualTo(DataType.DOUBLE);

        globals.learn("__x", DataType.STRING);
        assertThat(globals.typeOf("__x")).isEqualTo(DataType.UNKNOWN);
    }
}
