package org.hdldoc.parser.diagnostics;

import org.hdldoc.parser.api.SourcePosition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the diagnostics of one parse. The engine is bound to the text being parsed, so
 * reporters only pass character offsets and every diagnostic carries a resolved
 * {@link SourcePosition}.
 */
public class DiagnosticsEngine {

    private final String sourceName;
    private final String text;
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * @param sourceName The name of the parsed source.
     * @param text The parsed text, used to resolve offsets to lines and columns.
     */
    public DiagnosticsEngine(String sourceName, String text) {
        this.sourceName = sourceName;
        this.text = text;
    }

    public String sourceName() {
        return sourceName;
    }

    public Diagnostic error(String message, int offset) {
        return report(Diagnostic.Severity.ERROR, message, offset);
    }

    public Diagnostic warning(String message, int offset) {
        return report(Diagnostic.Severity.WARNING, message, offset);
    }

    private Diagnostic report(Diagnostic.Severity severity, String message, int offset) {
        Diagnostic diagnostic = new Diagnostic(severity, message, SourcePosition.of(text, offset, sourceName));
        diagnostics.add(diagnostic);
        return diagnostic;
    }

    public boolean hasErrors() {
        return count(Diagnostic.Severity.ERROR) > 0;
    }

    public boolean hasWarnings() {
        return count(Diagnostic.Severity.WARNING) > 0;
    }

    public long count(Diagnostic.Severity severity) {
        return diagnostics.stream().filter(d -> d.severity() == severity).count();
    }

    /**
     * @return An unmodifiable view of all diagnostics in reporting order.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * @return Every diagnostic rendered with its source line, followed by a count line.
     */
    public String summary() {
        String body = diagnostics.stream()
                .map(Diagnostic::render)
                .collect(Collectors.joining("\n"));
        return body + "\n" + count(Diagnostic.Severity.ERROR) + " error(s), "
                + count(Diagnostic.Severity.WARNING) + " warning(s) in " + sourceName;
    }
}
