package org.hdldoc.parser.verilog;

import org.hdldoc.parser.lexer.LexerException;
import org.hdldoc.parser.lexer.LexerMatch;
import org.hdldoc.parser.lexer.TokenStream;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hdldoc.parser.verilog.VerilogAction.*;

/**
 * Contains unit tests for the Verilog rule table in {@link VerilogTokenRules}.
 * These tests look at the raw action stream, independent of the entity builder.
 */
public class VerilogTokenRulesTest {

    private static List<LexerMatch<VerilogAction>> scan(String source) {
        return VerilogTokenRules.lexer().run(source).toList();
    }

    private static List<VerilogAction> actions(String source) {
        return scan(source).stream().map(LexerMatch::action).toList();
    }

    /**
     * Verifies the action sequence of an ANSI-style header with a parameter list and
     * grouped port declarations.
     */
    @Test
    @Tag("unit")
    void ansiHeaderProducesParameterAndPortActions() {
        // Arrange
        String source = String.join("\n",
                "module counter #(parameter WIDTH = 8) (",
                "    input clk, rst,",
                "    output reg [WIDTH-1:0] count",
                ");",
                "endmodule");

        // Act
        List<LexerMatch<VerilogAction>> matches = scan(source);

        // Assert
        assertThat(matches).extracting(LexerMatch::action).containsExactly(
                MODULE_OPEN, PARAMETER_GROUP_OPEN, PARAMETER_ITEM_WITH_DEFAULT,
                PORT_GROUP_OPEN, PORT_ITEM, PORT_ITEM, PORT_GROUP_OPEN, PORT_ITEM,
                MODULE_CLOSE);
        assertThat(matches.get(0).groups()).containsExactly("counter");
        assertThat(matches.get(2).groups()).containsExactly("WIDTH", "8");
        assertThat(matches.get(6).groups()).containsExactly("output", "reg", null, "[WIDTH-1:0]");
        assertThat(matches.get(7).group(0)).isEqualTo("count");
    }

    /**
     * Verifies that behavioral code in a module body produces no actions, in particular
     * that keywords followed by an identifier and a parenthesis are not taken for instantiations.
     */
    @Test
    @Tag("unit")
    void bodyStatementsAreSkipped() {
        // Arrange
        String source = String.join("\n",
                "module m;",
                "  wire [3:0] bus;",
                "  always @(posedge clk or negedge rst_n) begin",
                "    if (!rst_n) q <= 1'b0; else q <= d;",
                "  end",
                "  assign y = a ? b : (c & d);",
                "  generate for (i = 0; i < 4; i = i + 1) begin : g end endgenerate",
                "  initial $display(\"module x(\");",
                "endmodule");

        // Act & Assert
        assertThat(actions(source)).containsExactly(MODULE_OPEN, MODULE_CLOSE);
    }

    /**
     * Verifies that same-line comments after an item are trailing comments, comments on their
     * own line are ignored, and {@code //#} comments are always metacomments.
     */
    @Test
    @Tag("unit")
    void commentsInPortListAreClassified() {
        // Arrange
        String source = String.join("\n",
                "module m(",
                "    input a, // about a",
                "    // not about anything",
                "    input b //# meta for b",
                ");",
                "endmodule");

        // Act
        List<LexerMatch<VerilogAction>> matches = scan(source);

        // Assert
        assertThat(matches).extracting(LexerMatch::action).containsExactly(
                MODULE_OPEN, PORT_GROUP_OPEN, PORT_ITEM, TRAILING_COMMENT,
                PORT_GROUP_OPEN, PORT_ITEM, METACOMMENT, MODULE_CLOSE);
        assertThat(matches.get(3).group(0)).isEqualTo("about a");
        assertThat(matches.get(6).group(0)).isEqualTo("meta for b");
    }

    /**
     * Verifies that section markers are recognized with their label.
     */
    @Test
    @Tag("unit")
    void sectionMarkerCarriesLabel() {
        // Arrange
        String source = "module m(\n  //# {{Clock and reset}}\n  input clk\n);\nendmodule";

        // Act
        List<LexerMatch<VerilogAction>> matches = scan(source);

        // Assert
        assertThat(matches).extracting(LexerMatch::action)
                .containsExactly(MODULE_OPEN, SECTION_MARKER, PORT_GROUP_OPEN, PORT_ITEM, MODULE_CLOSE);
        assertThat(matches.get(1).group(0)).isEqualTo("Clock and reset");
    }

    /**
     * Verifies that named connections are delivered as balanced text fragments, including
     * nested parentheses, and that positional connections produce no actions.
     */
    @Test
    @Tag("unit")
    void connectionsAreBalanced() {
        // Arrange
        String source = "module m; sub u (.a(f(x, (y))), .b(c)); other v (p, q); endmodule";

        // Act
        TokenStream<VerilogLexerState, VerilogAction> stream = VerilogTokenRules.lexer().run(source);
        List<LexerMatch<VerilogAction>> matches = stream.toList();

        // Assert
        assertThat(stream.depth()).isEqualTo(1);
        assertThat(matches).extracting(LexerMatch::action).startsWith(MODULE_OPEN, SUBMODULE_PLAIN_OPEN, CONNECTION_OPEN);
        assertThat(matches).filteredOn(m -> m.action() == CONNECTION_CLOSE).hasSize(2);
        assertThat(matches).filteredOn(m -> m.action() == SUBMODULE_CLOSE).hasSize(2);
        String text = matches.stream()
                .filter(m -> m.action() == CONNECTION_TEXT)
                .map(m -> m.group(0))
                .reduce("", String::concat);
        assertThat(text).isEqualTo("f(x, (y))c");
    }

    /**
     * Verifies the actions of a parameterized instantiation.
     */
    @Test
    @Tag("unit")
    void parameterizedInstantiation() {
        // Arrange
        String source = "module m; fifo #(.DEPTH(4)) u_fifo (.clk(clk)); endmodule";

        // Act
        List<LexerMatch<VerilogAction>> matches = scan(source);

        // Assert
        assertThat(matches).extracting(LexerMatch::action).containsExactly(
                MODULE_OPEN, SUBMODULE_WITH_PARAMS_OPEN,
                CONNECTION_OPEN, CONNECTION_TEXT, CONNECTION_CLOSE,
                SUBMODULE_PARAMS_CLOSE_PORTS_OPEN,
                CONNECTION_OPEN, CONNECTION_TEXT, CONNECTION_CLOSE,
                SUBMODULE_CLOSE, MODULE_CLOSE);
        assertThat(matches.get(1).group(0)).isEqualTo("fifo");
        assertThat(matches.get(5).group(0)).isEqualTo("u_fifo");
    }

    /**
     * Verifies that a comma after an instance's port list starts another instance.
     */
    @Test
    @Tag("unit")
    void multiInstanceStatement() {
        // Arrange
        String source = "module m; sub u1 (.x(a)), u2 (.x(b)); endmodule";

        // Act
        List<LexerMatch<VerilogAction>> matches = scan(source);

        // Assert
        assertThat(matches).extracting(LexerMatch::action).containsExactly(
                MODULE_OPEN, SUBMODULE_PLAIN_OPEN,
                CONNECTION_OPEN, CONNECTION_TEXT, CONNECTION_CLOSE,
                SUBMODULE_NEXT_INSTANCE,
                CONNECTION_OPEN, CONNECTION_TEXT, CONNECTION_CLOSE,
                SUBMODULE_CLOSE, MODULE_CLOSE);
        assertThat(matches.get(5).group(0)).isEqualTo("u2");
    }

    /**
     * Verifies that the semicolon ending a body declaration carries a same-line comment,
     * and that a comment on the next line does not.
     */
    @Test
    @Tag("unit")
    void declarationSemicolonCarriesTrailingComment() {
        // Arrange
        String source = "module m;\n input a; // about a\n input b;\n // not about b\nendmodule";

        // Act
        List<LexerMatch<VerilogAction>> matches = scan(source);

        // Assert
        assertThat(matches).extracting(LexerMatch::action).containsExactly(
                MODULE_OPEN, PORT_GROUP_OPEN, PORT_ITEM, TRAILING_COMMENT,
                PORT_GROUP_OPEN, PORT_ITEM, MODULE_CLOSE);
        assertThat(matches.get(3).group(0)).isEqualTo("about a");
    }

    /**
     * Verifies that function bodies, including their port-like declarations, are skipped.
     */
    @Test
    @Tag("unit")
    void functionBodiesAreSkipped() {
        // Arrange
        String source = "module m(input a);\n function f;\n input x;\n f = x;\n endfunction\nendmodule";

        // Act & Assert
        assertThat(actions(source)).containsExactly(MODULE_OPEN, PORT_GROUP_OPEN, PORT_ITEM, MODULE_CLOSE);
    }

    /**
     * Verifies that block comments hide everything they contain and that an unterminated one
     * leaves the stream inside the comment state.
     */
    @Test
    @Tag("unit")
    void blockComments() {
        // Arrange
        TokenStream<VerilogLexerState, VerilogAction> closed =
                VerilogTokenRules.lexer().run("/* module x; endmodule */ module y; endmodule");
        TokenStream<VerilogLexerState, VerilogAction> open =
                VerilogTokenRules.lexer().run("module y;\n /* endmodule");

        // Act
        List<LexerMatch<VerilogAction>> closedMatches = closed.toList();
        List<LexerMatch<VerilogAction>> openMatches = open.toList();

        // Assert
        assertThat(closedMatches).extracting(m -> m.action() + "" + m.groups())
                .containsExactly("MODULE_OPEN[y]", "MODULE_CLOSE[]");
        assertThat(openMatches).extracting(LexerMatch::action).containsExactly(MODULE_OPEN);
        assertThat(open.currentState()).isEqualTo(VerilogLexerState.BLOCK_COMMENT);
        assertThat(open.currentStateOpenedAt()).isEqualTo(11);
    }

    /**
     * Verifies that text outside of a module that is neither a comment nor a directive
     * is a lexical failure.
     */
    @Test
    @Tag("unit")
    void garbageAtTopLevelFails() {
        assertThatThrownBy(() -> scan("`include \"defs.vh\"\nwire stray;"))
                .isInstanceOf(LexerException.class)
                .hasMessageContaining("state ROOT");
    }

    /**
     * Verifies that the shared lexer produces independent streams and that the keyword
     * list has no duplicates.
     */
    @Test
    @Tag("unit")
    void sharedLexerProducesIndependentStreams() {
        // Arrange
        TokenStream<VerilogLexerState, VerilogAction> first = VerilogTokenRules.lexer().run("module a; endmodule");
        TokenStream<VerilogLexerState, VerilogAction> second = VerilogTokenRules.lexer().run("module b; endmodule");

        // Act
        LexerMatch<VerilogAction> fromFirst = first.next();
        LexerMatch<VerilogAction> fromSecond = second.next();

        // Assert
        assertThat(fromFirst.group(0)).isEqualTo("a");
        assertThat(fromSecond.group(0)).isEqualTo("b");
        assertThat(VerilogTokenRules.KEYWORDS).doesNotHaveDuplicates();
    }
}
