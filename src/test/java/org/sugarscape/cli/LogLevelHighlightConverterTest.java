package org.sugarscape.cli;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import ch.qos.logback.classic.Level;

@Tag("unit")
class LogLevelHighlightConverterTest {

    @Test
    void colorsFollowSeverity() {
        assertThat(LogLevelHighlightConverter.colorFor(Level.ERROR)).isEqualTo(LogLevelHighlightConverter.ANSI_RED);
        assertThat(LogLevelHighlightConverter.colorFor(Level.WARN)).isEqualTo(LogLevelHighlightConverter.ANSI_YELLOW);
        assertThat(LogLevelHighlightConverter.colorFor(Level.INFO)).isEqualTo(LogLevelHighlightConverter.ANSI_BLUE);
        assertThat(LogLevelHighlightConverter.colorFor(Level.DEBUG)).isEmpty();
        assertThat(LogLevelHighlightConverter.colorFor(Level.TRACE)).isEmpty();
    }
}
