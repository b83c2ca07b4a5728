package org.hdldoc.parser;

import org.hdldoc.parser.api.HdlParseException;
import org.hdldoc.parser.api.IHdlParser;
import org.hdldoc.parser.api.ParseErrorCode;
import org.hdldoc.parser.api.SourcePosition;
import org.hdldoc.parser.api.VerilogModule;
import org.hdldoc.parser.builder.EntityBuildException;
import org.hdldoc.parser.builder.EntityBuilder;
import org.hdldoc.parser.diagnostics.Diagnostic;
import org.hdldoc.parser.diagnostics.DiagnosticsEngine;
import org.hdldoc.parser.lexer.LexerException;
import org.hdldoc.parser.lexer.LexerMatch;
import org.hdldoc.parser.lexer.MiniLexer;
import org.hdldoc.parser.lexer.TokenStream;
import org.hdldoc.parser.verilog.VerilogAction;
import org.hdldoc.parser.verilog.VerilogLexerState;
import org.hdldoc.parser.verilog.VerilogTokenRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The main implementation of the {@link IHdlParser} interface for Verilog.
 * This class runs the Verilog lexer over a source text and feeds its actions to an
 * {@link EntityBuilder}.
 * <p>
 * A parse either returns every module of the text or fails with an
 * {@link HdlParseException}; there are no partial results. The parser holds no state
 * between calls except the diagnostics of the most recent parse.
 */
public class VerilogParser implements IHdlParser {

    private static final Logger LOG = LoggerFactory.getLogger(VerilogParser.class);

    private final MiniLexer<VerilogLexerState, VerilogAction> lexer;
    private volatile List<Diagnostic> lastDiagnostics = List.of();

    /**
     * Creates a parser that uses the shared Verilog lexer.
     */
    public VerilogParser() {
        this(VerilogTokenRules.lexer());
    }

    /**
     * Creates a parser with a specific lexer.
     * @param lexer The lexer to use.
     */
    public VerilogParser(MiniLexer<VerilogLexerState, VerilogAction> lexer) {
        this.lexer = lexer;
    }

    @Override
    public List<VerilogModule> parse(String text, String sourceName) throws HdlParseException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine(sourceName, text);
        try {
            return parse(text, sourceName, diagnostics);
        } finally {
            lastDiagnostics = List.copyOf(diagnostics.getDiagnostics());
            if (diagnostics.hasWarnings()) {
                LOG.debug("Diagnostics for {}:\n{}", sourceName, diagnostics.summary());
            }
        }
    }

    private List<VerilogModule> parse(String text, String sourceName, DiagnosticsEngine diagnostics)
            throws HdlParseException {
        LOG.debug("Parsing {} ({} characters)", sourceName, text.length());
        TokenStream<VerilogLexerState, VerilogAction> stream = lexer.run(text);
        EntityBuilder builder = new EntityBuilder(diagnostics);
        List<VerilogModule> modules;
        try {
            modules = builder.build(stream);
        } catch (LexerException e) {
            Diagnostic error = diagnostics.error(e.getMessage(), e.getOffset());
            throw new HdlParseException(ParseErrorCode.LEXICAL_FAILURE, e.getMessage(), error.position(), e);
        } catch (EntityBuildException e) {
            throw new HdlParseException(ParseErrorCode.BUILDER_INCONSISTENCY, e.getMessage(),
                    SourcePosition.of(text, e.getOffset(), sourceName), e);
        }

        if (stream.depth() > 1) {
            int openedAt = stream.currentStateOpenedAt();
            String message = "Unterminated " + describe(stream.currentState(), builder) + " at end of input";
            Diagnostic error = diagnostics.error(message, openedAt);
            throw new HdlParseException(ParseErrorCode.STRUCTURAL_FAILURE, message, error.position(), null);
        }
        if (builder.isModuleOpen()) {
            String message = "Module " + builder.openModuleName() + " is never closed";
            Diagnostic error = diagnostics.error(message, text.length());
            throw new HdlParseException(ParseErrorCode.STRUCTURAL_FAILURE, message, error.position(), null);
        }

        LOG.debug("Parsed {} module(s) from {}", modules.size(), sourceName);
        return modules;
    }

    /**
     * Scans a text without building modules.
     * @param text The source text.
     * @return All actions of the text in order.
     * @throws HdlParseException if the text cannot be scanned.
     */
    public List<LexerMatch<VerilogAction>> tokenize(String text) throws HdlParseException {
        try {
            return lexer.run(text).toList();
        } catch (LexerException e) {
            throw new HdlParseException(ParseErrorCode.LEXICAL_FAILURE, e.getMessage(),
                    SourcePosition.of(text, e.getOffset(), "<memory>"), e);
        }
    }

    /**
     * @return The warnings and errors reported by the most recent parse.
     */
    public List<Diagnostic> getDiagnostics() {
        return lastDiagnostics;
    }

    private static String describe(VerilogLexerState state, EntityBuilder builder) {
        return switch (state) {
            case MODULE -> "module " + builder.openModuleName();
            case BLOCK_COMMENT -> "block comment";
            case SKIP_BLOCK -> "function or task";
            case PARAMETERS -> "parameter list";
            case PORTS -> "port list";
            case SUBMODULE, SUBMODULE_PARAMS -> "submodule instantiation";
            case CONNECTION, CONNECTION_NESTED -> "connection";
            case ROOT -> "root";
        };
    }
}
