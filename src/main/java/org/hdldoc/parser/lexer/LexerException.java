package org.hdldoc.parser.lexer;

/**
 * Thrown by a {@link TokenStream} when no rule of the active state matches at the
 * cursor, or when a rule tries to pop the root state.
 */
public class LexerException extends RuntimeException {

    private final int offset;
    private final String state;

    /**
     * @param message The detail message.
     * @param offset The input offset at which scanning failed.
     * @param state The name of the lexical state that was active.
     */
    public LexerException(String message, int offset, String state) {
        super(message);
        this.offset = offset;
        this.state = state;
    }

    public int getOffset() {
        return offset;
    }

    public String getState() {
        return state;
    }
}
