package org.hdldoc.parser.verilog;

import org.hdldoc.parser.lexer.MiniLexer;
import org.hdldoc.parser.lexer.RuleTable;
import org.hdldoc.parser.lexer.Transition;

import java.util.List;

import static org.hdldoc.parser.verilog.VerilogAction.*;
import static org.hdldoc.parser.verilog.VerilogLexerState.*;

/**
 * The rule table for Verilog (IEEE 1364 with the common SystemVerilog net types).
 * <p>
 * Only the constructs needed for documentation are recognized: module headers, parameter
 * and port declarations, submodule instantiations with their named connections, and
 * metacomments. Everything else inside a module body (expressions, always and generate
 * blocks, declarations) is skipped word by word. Outside of modules only comments,
 * compiler directives and attributes are accepted.
 * <p>
 * Comment conventions:
 * <ul>
 *   <li>{@code //# text} is a metacomment that documents the module or the preceding item,</li>
 *   <li>{@code //# {{label}}} starts a port section,</li>
 *   <li>a plain {@code //} comment on the same line after a port or parameter item, or after the
 *   {@code ;} ending its declaration, documents that item,</li>
 *   <li>all other comments are ignored.</li>
 * </ul>
 */
public final class VerilogTokenRules {

    private static final String IDENT = "[A-Za-z_][A-Za-z0-9_$]*";
    private static final String RANGE = "\\[[^\\]]*\\]";
    private static final String STRING = "\"(?:[^\"\\\\\\n]|\\\\.)*\"";
    private static final String SLASH = "/(?![/*])";
    private static final String PAREN_GROUP = "\\((?:[^()]|\\([^()]*\\))*\\)";
    private static final String BRACE_GROUP = "\\{(?:[^{}]|\\{[^{}]*\\})*\\}";

    /** Words that can never be the module type or instance name of an instantiation. */
    static final List<String> KEYWORDS = List.of(
            "always", "always_comb", "always_ff", "always_latch", "and", "assert", "assign", "assume",
            "begin", "buf", "bufif0", "bufif1", "case", "casex", "casez", "cmos", "cover", "deassign",
            "default", "defparam", "disable", "do", "else", "end", "endcase", "endfunction", "endgenerate",
            "endmodule", "endtask", "event", "for", "force", "foreach", "forever", "fork", "function",
            "generate", "genvar", "if", "initial", "inout", "input", "integer", "join", "localparam",
            "logic", "nand", "negedge", "nmos", "nor", "not", "notif0", "notif1", "or", "output",
            "parameter", "pmos", "posedge", "priority", "property", "pulldown", "pullup", "real",
            "realtime", "reg", "release", "repeat", "return", "rnmos", "rpmos", "rtran", "signed",
            "specify", "supply0", "supply1", "task", "time", "tran", "tri", "unique", "unsigned",
            "wait", "while", "wire", "xnor", "xor");

    private static final String NOT_KEYWORD = "(?!(?:" + String.join("|", KEYWORDS) + ")\\b)";

    private static final String BLOCK_COMMENT_OPEN = "/\\*";
    private static final String SECTION = "//#[ \\t]*\\{\\{(.*?)\\}\\}[^\\n]*";
    private static final String META = "//#+[ \\t]*([^\\r\\n]*)";
    private static final String LINE_COMMENT = "//[^\\n]*";
    private static final String OWN_LINE_COMMENT = "\\s*\\n\\s*//(?!#)[^\\n]*";
    private static final String TRAILING = "[ \\t]*//(?!#)[ \\t]*([^\\r\\n]*)";
    private static final String WHITESPACE = "\\s+";
    private static final String WORD = "\\w+";
    private static final String PUNCTUATION = "[^\\w\\s]";
    private static final String ATTRIBUTE = "\\(\\*(?!\\))[\\s\\S]*?\\*\\)";
    private static final String DIRECTIVE = "`(?:[^\\\\\\n]|\\\\[\\s\\S])*";

    private static final String MODULE_HEADER = "\\b(?:module|macromodule)\\s+(" + IDENT + ")";
    private static final String MODULE_END = "\\bendmodule\\b(?:\\s*:\\s*" + IDENT + ")?";
    private static final String PARAMETER_GROUP = "\\bparameter\\b"
            + "(?:\\s+(signed|unsigned|integer|realtime|real|time|logic|int|bit|longint|shortint|byte|string)\\b)?"
            + "(?:\\s+(signed|unsigned)\\b)?"
            + "(?:\\s*(" + RANGE + "))?";
    private static final String PORT_GROUP = "\\b(input|output|inout)\\b"
            + "(?:\\s+(wire|reg|logic|tri|triand|trior|tri0|tri1|trireg|wand|wor|uwire|supply0|supply1|var"
            + "|integer|time|real|bit|byte|int|shortint|longint|string)\\b)?"
            + "(?:\\s+(signed|unsigned)\\b)?"
            + "(?:\\s*(" + RANGE + "))?";
    private static final String VALUE_ATOM = "(?:" + STRING + "|" + PAREN_GROUP + "|" + BRACE_GROUP + "|" + SLASH
            + "|[^,;(){}/\"\\s])";
    // never ends in whitespace
    private static final String VALUE = VALUE_ATOM + "(?:\\s*" + VALUE_ATOM + ")*";
    private static final String PARAMETER_WITH_DEFAULT = "(" + IDENT + ")\\s*=\\s*(" + VALUE + ")";
    private static final String INSTANCE_WITH_PARAMS = "\\b" + NOT_KEYWORD + "(" + IDENT + ")\\s*#\\s*\\(";
    private static final String INSTANCE_PLAIN = "\\b" + NOT_KEYWORD + "(" + IDENT + ")\\s+"
            + NOT_KEYWORD + "(" + IDENT + ")\\s*(?:" + RANGE + "\\s*)?\\(";
    private static final String PARAMS_CLOSE_PORTS_OPEN = "\\)\\s*(" + IDENT + ")\\s*(?:" + RANGE + "\\s*)?\\(";
    private static final String INSTANCE_END = "\\)\\s*;";
    private static final String NEXT_INSTANCE = "\\)\\s*,\\s*" + NOT_KEYWORD + "(" + IDENT + ")\\s*(?:" + RANGE + "\\s*)?\\(";
    private static final String DECLARATION_END_TRAILING = ";[ \\t]*//(?!#)[ \\t]*([^\\r\\n]*)";
    private static final String CONNECTION_START = "\\.\\s*(" + IDENT + ")\\s*\\(";
    private static final String POSITIONAL = "(?:" + STRING + "|" + PAREN_GROUP + "|" + BRACE_GROUP + "|" + SLASH
            + "|\\.(?!\\s*" + IDENT + "\\s*\\()|[^,()/;.\"])+";
    private static final String CONNECTION_FRAGMENT = "((?:" + SLASH + "|[^()/])+)";

    private static final MiniLexer<VerilogLexerState, VerilogAction> LEXER = new MiniLexer<>(create());

    private VerilogTokenRules() {
    }

    /**
     * @return A shared lexer configured with {@link #create()}.
     */
    public static MiniLexer<VerilogLexerState, VerilogAction> lexer() {
        return LEXER;
    }

    /**
     * Builds the Verilog rule table.
     * @return A new immutable rule table.
     */
    public static RuleTable<VerilogLexerState, VerilogAction> create() {
        RuleTable.Builder<VerilogLexerState, VerilogAction> b = RuleTable.builder(VerilogLexerState.class, ROOT);

        b.skip(ROOT, WHITESPACE)
                .skip(ROOT, BLOCK_COMMENT_OPEN, Transition.push(BLOCK_COMMENT))
                .emit(ROOT, META, METACOMMENT)
                .skip(ROOT, LINE_COMMENT)
                .skip(ROOT, DIRECTIVE)
                .skip(ROOT, ATTRIBUTE)
                .emit(ROOT, MODULE_HEADER, MODULE_OPEN, Transition.push(MODULE));

        // endmodule must be tried before the instantiation patterns
        b.skip(MODULE, WHITESPACE)
                .skip(MODULE, BLOCK_COMMENT_OPEN, Transition.push(BLOCK_COMMENT))
                .emit(MODULE, SECTION, SECTION_MARKER)
                .emit(MODULE, META, METACOMMENT)
                .skip(MODULE, LINE_COMMENT)
                .emit(MODULE, MODULE_END, MODULE_CLOSE, Transition.pop())
                .skip(MODULE, STRING)
                .skip(MODULE, ATTRIBUTE)
                .skip(MODULE, "\\b(?:function|task)\\b", Transition.push(SKIP_BLOCK))
                .skip(MODULE, "\\blocalparam\\b[^;]*;")
                .emit(MODULE, PARAMETER_GROUP, PARAMETER_GROUP_OPEN, Transition.push(PARAMETERS))
                .emit(MODULE, PORT_GROUP, PORT_GROUP_OPEN, Transition.push(PORTS))
                .emit(MODULE, INSTANCE_WITH_PARAMS, SUBMODULE_WITH_PARAMS_OPEN, Transition.push(SUBMODULE_PARAMS))
                .emit(MODULE, INSTANCE_PLAIN, SUBMODULE_PLAIN_OPEN, Transition.push(SUBMODULE))
                .skip(MODULE, WORD)
                .skip(MODULE, PUNCTUATION);

        b.skip(PARAMETERS, BLOCK_COMMENT_OPEN, Transition.push(BLOCK_COMMENT))
                .emit(PARAMETERS, SECTION, SECTION_MARKER)
                .emit(PARAMETERS, META, METACOMMENT)
                .skip(PARAMETERS, OWN_LINE_COMMENT)
                .emit(PARAMETERS, TRAILING, TRAILING_COMMENT)
                .skip(PARAMETERS, WHITESPACE)
                .skip(PARAMETERS, ",")
                .emit(PARAMETERS, PARAMETER_GROUP, PARAMETER_GROUP_OPEN)
                .emit(PARAMETERS, PARAMETER_WITH_DEFAULT, PARAMETER_ITEM_WITH_DEFAULT)
                .emit(PARAMETERS, "(" + IDENT + ")", PARAMETER_ITEM_BARE)
                .skip(PARAMETERS, RANGE)
                .emit(PARAMETERS, DECLARATION_END_TRAILING, TRAILING_COMMENT, Transition.pop())
                .skip(PARAMETERS, "[);]", Transition.pop());

        b.skip(PORTS, BLOCK_COMMENT_OPEN, Transition.push(BLOCK_COMMENT))
                .emit(PORTS, SECTION, SECTION_MARKER)
                .emit(PORTS, META, METACOMMENT)
                .skip(PORTS, OWN_LINE_COMMENT)
                .emit(PORTS, TRAILING, TRAILING_COMMENT)
                .skip(PORTS, WHITESPACE)
                .skip(PORTS, ",")
                .skip(PORTS, ATTRIBUTE)
                .emit(PORTS, PORT_GROUP, PORT_GROUP_OPEN)
                .skip(PORTS, RANGE)
                .skip(PORTS, "=\\s*" + VALUE)
                .emit(PORTS, "(" + IDENT + ")", PORT_ITEM)
                .emit(PORTS, DECLARATION_END_TRAILING, TRAILING_COMMENT, Transition.pop())
                .skip(PORTS, "[);]", Transition.pop());

        b.skip(SUBMODULE_PARAMS, BLOCK_COMMENT_OPEN, Transition.push(BLOCK_COMMENT))
                .emit(SUBMODULE_PARAMS, META, METACOMMENT)
                .skip(SUBMODULE_PARAMS, LINE_COMMENT)
                .skip(SUBMODULE_PARAMS, WHITESPACE)
                .emit(SUBMODULE_PARAMS, PARAMS_CLOSE_PORTS_OPEN, SUBMODULE_PARAMS_CLOSE_PORTS_OPEN)
                .emit(SUBMODULE_PARAMS, INSTANCE_END, SUBMODULE_CLOSE, Transition.pop())
                .emit(SUBMODULE_PARAMS, NEXT_INSTANCE, SUBMODULE_NEXT_INSTANCE)
                .emit(SUBMODULE_PARAMS, CONNECTION_START, CONNECTION_OPEN, Transition.push(CONNECTION))
                .skip(SUBMODULE_PARAMS, ",")
                .skip(SUBMODULE_PARAMS, POSITIONAL);

        b.skip(SUBMODULE, BLOCK_COMMENT_OPEN, Transition.push(BLOCK_COMMENT))
                .emit(SUBMODULE, META, METACOMMENT)
                .skip(SUBMODULE, LINE_COMMENT)
                .skip(SUBMODULE, WHITESPACE)
                .emit(SUBMODULE, INSTANCE_END, SUBMODULE_CLOSE, Transition.pop())
                .emit(SUBMODULE, NEXT_INSTANCE, SUBMODULE_NEXT_INSTANCE)
                .emit(SUBMODULE, CONNECTION_START, CONNECTION_OPEN, Transition.push(CONNECTION))
                .skip(SUBMODULE, ",")
                .skip(SUBMODULE, POSITIONAL);

        b.skip(CONNECTION, BLOCK_COMMENT_OPEN, Transition.push(BLOCK_COMMENT))
                .skip(CONNECTION, LINE_COMMENT)
                .emit(CONNECTION, "\\)", VerilogAction.CONNECTION_CLOSE, Transition.pop())
                .emit(CONNECTION, "(\\()", CONNECTION_TEXT, Transition.push(CONNECTION_NESTED))
                .emit(CONNECTION, CONNECTION_FRAGMENT, CONNECTION_TEXT);

        b.skip(CONNECTION_NESTED, BLOCK_COMMENT_OPEN, Transition.push(BLOCK_COMMENT))
                .skip(CONNECTION_NESTED, LINE_COMMENT)
                .emit(CONNECTION_NESTED, "(\\))", CONNECTION_TEXT, Transition.pop())
                .emit(CONNECTION_NESTED, "(\\()", CONNECTION_TEXT, Transition.push(CONNECTION_NESTED))
                .emit(CONNECTION_NESTED, CONNECTION_FRAGMENT, CONNECTION_TEXT);

        b.skip(SKIP_BLOCK, BLOCK_COMMENT_OPEN, Transition.push(BLOCK_COMMENT))
                .skip(SKIP_BLOCK, LINE_COMMENT)
                .skip(SKIP_BLOCK, STRING)
                .skip(SKIP_BLOCK, "\\bend(?:function|task)\\b", Transition.pop())
                .skip(SKIP_BLOCK, WHITESPACE)
                .skip(SKIP_BLOCK, WORD)
                .skip(SKIP_BLOCK, PUNCTUATION);

        // the second rule swallows an unterminated comment so the stream ends inside BLOCK_COMMENT
        b.skip(BLOCK_COMMENT, "[\\s\\S]*?\\*/", Transition.pop())
                .skip(BLOCK_COMMENT, "[\\s\\S]+");

        return b.build();
    }
}
