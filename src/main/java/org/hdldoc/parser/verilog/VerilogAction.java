package org.hdldoc.parser.verilog;

/**
 * The actions emitted by the Verilog rule table, together with the groups each one captures.
 */
public enum VerilogAction {
    /** {@code module name}. Groups: module name. */
    MODULE_OPEN,
    /** {@code endmodule}. No groups. */
    MODULE_CLOSE,
    /** {@code parameter [type] [signedness] [range]}. Groups: type keyword, signedness, bit range. */
    PARAMETER_GROUP_OPEN,
    /** {@code NAME = value}. Groups: name, default value text. */
    PARAMETER_ITEM_WITH_DEFAULT,
    /** A parameter name without a default. Groups: name. */
    PARAMETER_ITEM_BARE,
    /** {@code input|output|inout [net type] [signedness] [range]}. Groups: direction, net type, signedness, bit range. */
    PORT_GROUP_OPEN,
    /** A port name. Groups: name. */
    PORT_ITEM,
    /** {@code //# {{label}}}. Groups: section label. */
    SECTION_MARKER,
    /** {@code type #(}. Groups: module type. */
    SUBMODULE_WITH_PARAMS_OPEN,
    /** {@code type instance (}. Groups: module type, instance name. */
    SUBMODULE_PLAIN_OPEN,
    /** {@code ) instance (} after a parameter override list. Groups: instance name. */
    SUBMODULE_PARAMS_CLOSE_PORTS_OPEN,
    /** {@code ), instance (} starting another instance of the same module type. Groups: instance name. */
    SUBMODULE_NEXT_INSTANCE,
    /** {@code );} closing an instantiation. No groups. */
    SUBMODULE_CLOSE,
    /** {@code //# text}. Groups: comment text. */
    METACOMMENT,
    /** A plain line comment on the same line after a port or parameter item or its closing {@code ;}. Groups: comment text. */
    TRAILING_COMMENT,
    /** {@code .name(} inside an instantiation. Groups: formal name. */
    CONNECTION_OPEN,
    /** A fragment of a connection expression. Groups: text. */
    CONNECTION_TEXT,
    /** The {@code )} closing a named connection. No groups. */
    CONNECTION_CLOSE
}
