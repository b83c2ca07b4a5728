package org.hdldoc.parser.diagnostics;

import org.hdldoc.parser.api.SourcePosition;

/**
 * A problem found in a source text, resolved to its line and column.
 *
 * @param severity Whether the problem stopped the parse.
 * @param message The message.
 * @param position Where the problem was found.
 */
public record Diagnostic(Severity severity, String message, SourcePosition position) {

    public enum Severity {
        /** The parse failed. */
        ERROR,
        /** The input was tolerated, but something in it was ignored. */
        WARNING
    }

    public int offset() {
        return position.offset();
    }

    /**
     * Formats the diagnostic like a compiler message, {@code file:line:column: severity: message},
     * followed by the source line and a caret under the column.
     */
    public String render() {
        return position + ": " + severity.name().toLowerCase() + ": " + message + "\n"
                + "    " + position.lineContent() + "\n"
                + "    " + " ".repeat(Math.max(0, position.columnNumber() - 1)) + "^";
    }

    @Override
    public String toString() {
        return position + ": " + severity.name().toLowerCase() + ": " + message;
    }
}
