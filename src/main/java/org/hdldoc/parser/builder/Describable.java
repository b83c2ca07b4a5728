package org.hdldoc.parser.builder;

/**
 * An entity under construction that can receive description lines from comments.
 */
interface Describable {

    /**
     * Adds a line to the description. Lines are joined with newlines.
     * @param text The comment text.
     */
    void appendDescription(String text);
}
