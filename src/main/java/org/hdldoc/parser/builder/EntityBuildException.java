package org.hdldoc.parser.builder;

/**
 * Thrown when the {@link EntityBuilder} receives an action it cannot apply in its current
 * state, e.g. a submodule close without an open submodule.
 */
public class EntityBuildException extends RuntimeException {

    private final int offset;

    /**
     * @param message The detail message.
     * @param offset The source offset of the offending action.
     */
    public EntityBuildException(String message, int offset) {
        super(message);
        this.offset = offset;
    }

    public int getOffset() {
        return offset;
    }
}
