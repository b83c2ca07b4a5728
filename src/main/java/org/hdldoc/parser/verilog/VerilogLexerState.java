package org.hdldoc.parser.verilog;

/**
 * The lexical states of the Verilog rule table.
 */
public enum VerilogLexerState {
    /** Outside of any module. */
    ROOT,
    /** Inside a module body, between the module header keyword and {@code endmodule}. */
    MODULE,
    /** A parameter declaration list, in the header or in the body. */
    PARAMETERS,
    /** A port declaration list, in the header or in the body. */
    PORTS,
    /** A submodule instantiation with a {@code #( ... )} parameter override list. */
    SUBMODULE_PARAMS,
    /** A submodule instantiation without parameter overrides. */
    SUBMODULE,
    /** The expression of a named connection {@code .name( ... )}. */
    CONNECTION,
    /** A parenthesized group inside a connection expression. */
    CONNECTION_NESTED,
    /** A function or task body, which is skipped. */
    SKIP_BLOCK,
    /** A block comment. */
    BLOCK_COMMENT
}
