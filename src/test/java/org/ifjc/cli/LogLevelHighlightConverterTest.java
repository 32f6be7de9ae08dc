package org.ifjc.cli;

import ch.qos.logback.classic.Level;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class LogLevelHighlightConverterTest {

    @Test
    void colorsEachLevel() {
        assertThat(LogLevelHighlightConverter.colorOf(Level.ERROR)).isEqualTo("\u001B[1;31m");
        assertThat(LogLevelHighlightConverter.colorOf(Level.WARN)).isEqualTo("\u001B[33m");
        assertThat(LogLevelHighlightConverter.colorOf(Level.INFO)).isEqualTo("\u001B[32m");
        assertThat(LogLevelHighlightConverter.colorOf(Level.DEBUG)).isEqualTo("\u001B[36m");
    }

    @Test
    void leavesTraceUncolored() {
        assertThat(LogLevelHighlightConverter.colorOf(Level.TRACE)).isNull();
    }
}
