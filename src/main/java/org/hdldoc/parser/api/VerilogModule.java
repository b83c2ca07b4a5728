package org.hdldoc.parser.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A Verilog module with its interface and its instantiation topology.
 * <p>
 * Instances are immutable: all collections are unmodifiable copies.
 *
 * @param name The module name.
 * @param ports The ports in declaration order, which is also their connection order.
 * @param parameters The parameters in declaration order.
 * @param sections The port sections, label to the port names of the section, in source order.
 * @param submodules The submodule instances in instantiation order.
 * @param description The module description collected from metacomments, or {@code null}.
 */
public record VerilogModule(String name, List<VerilogPort> ports, List<VerilogParameter> parameters,
                            Map<String, List<String>> sections, List<VerilogSubModule> submodules,
                            String description) implements HdlObject {

    /** The {@link #kind()} of every module. */
    public static final String KIND = "module";

    public VerilogModule {
        Objects.requireNonNull(name, "name");
        ports = ports == null ? List.of() : List.copyOf(ports);
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        submodules = submodules == null ? List.of() : List.copyOf(submodules);
        Map<String, List<String>> sectionCopy = new LinkedHashMap<>();
        if (sections != null) {
            sections.forEach((label, names) -> sectionCopy.put(label, List.copyOf(names)));
        }
        sections = Collections.unmodifiableMap(sectionCopy);
    }

    @Override
    public String kind() {
        return KIND;
    }

    /**
     * Looks up a port by name.
     * @param portName The port name.
     * @return The port, if declared.
     */
    public Optional<VerilogPort> port(String portName) {
        return ports.stream().filter(p -> p.name().equals(portName)).findFirst();
    }

    /**
     * Looks up a parameter by name.
     * @param parameterName The parameter name.
     * @return The parameter, if declared.
     */
    public Optional<VerilogParameter> parameter(String parameterName) {
        return parameters.stream().filter(p -> p.name().equals(parameterName)).findFirst();
    }

    @Override
    public String toString() {
        return "VerilogModule('" + name + "') " + ports;
    }
}
