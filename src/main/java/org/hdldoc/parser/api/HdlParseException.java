package org.hdldoc.parser.api;

/**
 * Thrown when a source text cannot be parsed. There are no partial results: a text that
 * fails to parse yields no modules at all.
 * <p>
 * It is part of the public API and hides the internal exception types of the parser.
 */
public class HdlParseException extends Exception {

    private final ParseErrorCode errorCode;
    private final SourcePosition position;

    /**
     * @param errorCode The failure category.
     * @param message The detail message.
     * @param position Where the failure was detected, or {@code null} if not applicable.
     * @param cause The cause, may be {@code null}.
     */
    public HdlParseException(ParseErrorCode errorCode, String message, SourcePosition position, Throwable cause) {
        super(position == null ? message : String.format("%s at %s", message, position), cause);
        this.errorCode = errorCode;
        this.position = position;
    }

    /**
     * @param errorCode The failure category.
     * @param message The detail message.
     * @param cause The cause, may be {@code null}.
     */
    public HdlParseException(ParseErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, null, cause);
    }

    public ParseErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * @return The failure position, or {@code null} for failures that have none (I/O errors).
     */
    public SourcePosition getPosition() {
        return position;
    }
}
