package org.hdldoc.parser.api;

/**
 * A position in a source text. Lines and columns are 1-based.
 *
 * @param sourceName The name of the source, a file path or a logical name.
 * @param offset The 0-based character offset.
 * @param lineNumber The line number.
 * @param columnNumber The column number.
 * @param lineContent The content of the line, without its line terminator.
 */
public record SourcePosition(String sourceName, int offset, int lineNumber, int columnNumber, String lineContent) {

    /**
     * Computes the line and column of an offset.
     * @param text The full source text.
     * @param offset The offset, clamped to the bounds of the text.
     * @param sourceName The name of the source.
     * @return The position.
     */
    public static SourcePosition of(String text, int offset, String sourceName) {
        int clamped = Math.max(0, Math.min(offset, text.length()));
        int line = 1;
        int lineStart = 0;
        for (int i = 0; i < clamped; i++) {
            if (text.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        int lineEnd = text.indexOf('\n', lineStart);
        if (lineEnd < 0) {
            lineEnd = text.length();
        }
        String content = text.substring(lineStart, lineEnd);
        if (content.endsWith("\r")) {
            content = content.substring(0, content.length() - 1);
        }
        return new SourcePosition(sourceName, clamped, line, clamped - lineStart + 1, content);
    }

    @Override
    public String toString() {
        return String.format("%s:%d:%d", sourceName, lineNumber, columnNumber);
    }
}
