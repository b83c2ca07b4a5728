package org.hdldoc.cli.commands;

import org.hdldoc.cli.CommandLineInterface;
import org.hdldoc.parser.lexer.LexerException;
import org.hdldoc.parser.lexer.LexerMatch;
import org.hdldoc.parser.lexer.TokenStream;
import org.hdldoc.parser.verilog.VerilogAction;
import org.hdldoc.parser.verilog.VerilogLexerState;
import org.hdldoc.parser.verilog.VerilogTokenRules;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

@Command(name = "tokens", mixinStandardHelpOptions = true, description = "Prints the lexer actions of a Verilog file, for debugging.")
public class TokensCommand implements Callable<Integer> {

    static final int CONTEXT_LENGTH = 50;

    @Parameters(index = "0", paramLabel = "FILE", description = "The Verilog file to scan.")
    private File file;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        parent.getConfig();
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        String text;
        try {
            text = Files.readString(file.toPath(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Could not read " + file + ": " + e.getMessage());
            return 1;
        }

        TokenStream<VerilogLexerState, VerilogAction> stream = VerilogTokenRules.lexer().run(text);
        int count = 0;
        try {
            for (LexerMatch<VerilogAction> match : stream) {
                out.println("Position: " + match.position() + ", Action: " + match.action());
                if (!match.groups().isEmpty()) {
                    out.println("  Groups: " + match.groups());
                }
                count++;
            }
        } catch (LexerException e) {
            out.flush();
            err.println("Lexer error at offset " + e.getOffset() + " in state " + e.getState() + ": " + e.getMessage());
            err.println("Context: " + context(text, e.getOffset()));
            return 1;
        }
        out.println(count + " action(s), final state stack " + stream.stateStack());
        out.flush();
        return 0;
    }

    static String context(String text, int offset) {
        int start = Math.max(0, offset - CONTEXT_LENGTH);
        int end = Math.min(text.length(), offset + CONTEXT_LENGTH);
        return text.substring(start, offset) + ">>>>" + text.substring(offset, end);
    }
}
