package org.hdldoc.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.typesafe.config.Config;
import org.hdldoc.cli.CommandLineInterface;
import org.hdldoc.cli.rendering.ModuleTextRenderer;
import org.hdldoc.extractor.HdlFileTypes;
import org.hdldoc.extractor.VerilogExtractor;
import org.hdldoc.parser.api.HdlParseException;
import org.hdldoc.parser.api.SourcePosition;
import org.hdldoc.parser.api.VerilogModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "parse", mixinStandardHelpOptions = true, description = "Parses Verilog files and prints their modules.")
public class ParseCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(ParseCommand.class);

    enum OutputFormat { TEXT, JSON }

    @Parameters(arity = "1..*", paramLabel = "FILE", description = "The Verilog files to parse.")
    private List<File> files;

    @Option(
        names = {"-f", "--format"},
        description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})"
    )
    private OutputFormat format = OutputFormat.TEXT;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        Config config = parent.getConfig();
        HdlFileTypes fileTypes = HdlFileTypes.fromConfig(config);
        VerilogExtractor extractor = VerilogExtractor.fromConfig(config);
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Map<String, List<VerilogModule>> results = new LinkedHashMap<>();
        int exitCode = 0;
        for (File file : files) {
            if (!fileTypes.isVerilog(file.toPath())) {
                LOG.warn("Skipping {}: not a Verilog file", file);
                err.println("Skipping " + file + ": not a Verilog file " + fileTypes.extensions());
                continue;
            }
            try {
                results.put(file.getPath(), extractor.extractObjects(file.toPath(), VerilogModule.class));
            } catch (HdlParseException e) {
                exitCode = 1;
                reportFailure(file, e, err);
            }
        }

        if (format == OutputFormat.JSON) {
            GsonBuilder builder = new GsonBuilder().serializeNulls();
            if (config.getBoolean("hdldoc.output.pretty-print")) {
                builder.setPrettyPrinting();
            }
            Gson gson = builder.create();
            out.println(gson.toJson(results));
        } else {
            results.forEach((path, modules) -> {
                out.println("File: " + path + " (" + modules.size() + " module(s))");
                modules.forEach(module -> ModuleTextRenderer.render(module, out));
                out.println();
            });
        }
        out.flush();
        err.flush();
        return exitCode;
    }

    private static void reportFailure(File file, HdlParseException e, PrintWriter err) {
        LOG.debug("Parsing {} failed", file, e);
        err.println("Error parsing " + file + " [" + e.getErrorCode() + "]: " + e.getMessage());
        SourcePosition position = e.getPosition();
        if (position != null) {
            err.println("  " + position.lineContent());
            err.println("  " + " ".repeat(Math.max(0, position.columnNumber() - 1)) + "^");
        }
    }
}
