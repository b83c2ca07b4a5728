package org.hdldoc.parser.diagnostics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link DiagnosticsEngine}.
 */
public class DiagnosticsEngineTest {

    private static final String SOURCE = "module m;\n  parameter A;\nendmodule\n";

    /**
     * Verifies that reported offsets are resolved to lines and columns of the bound source.
     */
    @Test
    @Tag("unit")
    void offsetsAreResolvedAgainstTheSource() {
        // Arrange
        DiagnosticsEngine engine = new DiagnosticsEngine("m.v", SOURCE);

        // Act
        Diagnostic warning = engine.warning("Duplicate parameter 'A'", 22);

        // Assert
        assertThat(warning.severity()).isEqualTo(Diagnostic.Severity.WARNING);
        assertThat(warning.offset()).isEqualTo(22);
        assertThat(warning.position().lineNumber()).isEqualTo(2);
        assertThat(warning.position().columnNumber()).isEqualTo(13);
        assertThat(warning.position().lineContent()).isEqualTo("  parameter A;");
        assertThat(warning).hasToString("m.v:2:13: warning: Duplicate parameter 'A'");
        assertThat(engine.hasWarnings()).isTrue();
        assertThat(engine.hasErrors()).isFalse();
    }

    /**
     * Verifies the summary layout: each diagnostic with its source line and a caret,
     * then the counts.
     */
    @Test
    @Tag("unit")
    void summaryRendersSourceLinesAndCounts() {
        // Arrange
        DiagnosticsEngine engine = new DiagnosticsEngine("m.v", SOURCE);
        engine.warning("first", 0);
        engine.error("second", 10);

        // Act
        String summary = engine.summary();

        // Assert
        assertThat(summary).isEqualTo(String.join("\n",
                "m.v:1:1: warning: first",
                "    module m;",
                "    ^",
                "m.v:2:1: error: second",
                "      parameter A;",
                "    ^",
                "1 error(s), 1 warning(s) in m.v"));
        assertThat(engine.count(Diagnostic.Severity.ERROR)).isEqualTo(1);
        assertThat(engine.getDiagnostics()).extracting(Diagnostic::message).containsExactly("first", "second");
    }

    /**
     * Verifies that offsets past the end of the source are clamped.
     */
    @Test
    @Tag("unit")
    void offsetsBeyondTheSourceAreClamped() {
        DiagnosticsEngine engine = new DiagnosticsEngine("m.v", SOURCE);

        Diagnostic error = engine.error("Module m is never closed", 500);

        assertThat(error.offset()).isEqualTo(SOURCE.length());
        assertThat(error.position().lineNumber()).isEqualTo(4);
        assertThat(engine.sourceName()).isEqualTo("m.v");
    }
}
