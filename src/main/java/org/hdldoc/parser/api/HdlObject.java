package org.hdldoc.parser.api;

/**
 * A top-level documentation object extracted from a hardware description source file.
 */
public interface HdlObject {

    /**
     * @return The declared name of the object.
     */
    String name();

    /**
     * @return The kind of the object, e.g. {@code "module"}.
     */
    String kind();

    /**
     * @return The description collected from metacomments, or {@code null} if there is none.
     */
    String description();
}
