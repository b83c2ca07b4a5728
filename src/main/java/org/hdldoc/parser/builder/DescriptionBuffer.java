package org.hdldoc.parser.builder;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects comment lines for a single description.
 */
final class DescriptionBuffer implements Describable {

    private final List<String> lines = new ArrayList<>();

    @Override
    public void appendDescription(String text) {
        if (text != null) {
            lines.add(text.strip());
        }
    }

    boolean isEmpty() {
        return lines.isEmpty();
    }

    void clear() {
        lines.clear();
    }

    /**
     * @return The lines joined with newlines, without leading or trailing blank lines,
     *         or {@code null} if nothing but blank lines was collected.
     */
    String text() {
        String joined = String.join("\n", lines).strip();
        return joined.isEmpty() ? null : joined;
    }
}
