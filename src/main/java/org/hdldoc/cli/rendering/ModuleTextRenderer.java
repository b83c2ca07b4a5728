package org.hdldoc.cli.rendering;

import org.hdldoc.parser.api.VerilogModule;
import org.hdldoc.parser.api.VerilogParameter;
import org.hdldoc.parser.api.VerilogPort;
import org.hdldoc.parser.api.VerilogSubModule;

import java.io.PrintWriter;
import java.util.List;
import java.util.Map;

/**
 * Prints a module in a human-readable block layout.
 */
public final class ModuleTextRenderer {

    private static final String NONE = "  None";

    private ModuleTextRenderer() {
    }

    /**
     * Writes the name, description, parameters, ports, submodules and sections of a module.
     * @param module The module to print.
     * @param out The target writer.
     */
    public static void render(VerilogModule module, PrintWriter out) {
        out.println();
        out.println("=== Module: " + module.name() + " ===");

        if (module.description() != null) {
            out.println();
            out.println("Description:");
            out.println(indent(module.description(), "  "));
        }

        out.println();
        out.println("Parameters:");
        if (module.parameters().isEmpty()) {
            out.println(NONE);
        }
        for (VerilogParameter parameter : module.parameters()) {
            out.println("  Name: " + parameter.name());
            out.println("    Type: " + parameter.dataType());
            out.println("    Mode: " + parameter.mode());
            out.println("    Default: " + (parameter.defaultValue() == null ? "-" : parameter.defaultValue()));
            printDescription(parameter.description(), out);
        }

        out.println();
        out.println("Ports:");
        if (module.ports().isEmpty()) {
            out.println(NONE);
        }
        for (VerilogPort port : module.ports()) {
            out.println("  Name: " + port.name());
            out.println("    Mode: " + port.direction().keyword());
            out.println("    Type: " + port.dataType());
            printDescription(port.description(), out);
        }

        out.println();
        out.println("Submodules:");
        if (module.submodules().isEmpty()) {
            out.println(NONE);
        }
        for (VerilogSubModule submodule : module.submodules()) {
            out.println("  Instance: " + submodule.instanceName());
            out.println("    Type: " + submodule.moduleType());
            if (!submodule.connections().isEmpty()) {
                out.println("    Connections:");
                submodule.connections().forEach((formal, actual) ->
                        out.println("      " + formal + " => " + actual));
            }
            printDescription(submodule.description(), out);
        }

        if (!module.sections().isEmpty()) {
            out.println();
            out.println("Sections:");
            for (Map.Entry<String, List<String>> section : module.sections().entrySet()) {
                out.println("  " + section.getKey() + ":");
                section.getValue().forEach(name -> out.println("    " + name));
            }
        }
        out.flush();
    }

    private static void printDescription(String description, PrintWriter out) {
        if (description != null) {
            out.println("    Description: " + description.replace("\n", "\n                 "));
        }
    }

    private static String indent(String text, String prefix) {
        return prefix + text.replace("\n", "\n" + prefix);
    }
}
