package org.hdldoc.parser.api;

/**
 * Identifies why a source text could not be parsed.
 */
public enum ParseErrorCode {
    /** No tokenizer rule matches at some position of the text. */
    LEXICAL_FAILURE,
    /** The text ended inside a nested construct, e.g. an unterminated comment or module. */
    STRUCTURAL_FAILURE,
    /** The token stream contained an action the entity builder could not apply. */
    BUILDER_INCONSISTENCY,
    /** The source file could not be read. */
    IO_ERROR_READING_FILE
}
