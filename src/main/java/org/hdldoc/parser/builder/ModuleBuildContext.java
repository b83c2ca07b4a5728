package org.hdldoc.parser.builder;

import org.hdldoc.parser.api.PortDirection;
import org.hdldoc.parser.api.VerilogModule;
import org.hdldoc.parser.api.VerilogParameter;
import org.hdldoc.parser.api.VerilogPort;
import org.hdldoc.parser.api.VerilogSubModule;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Owns everything that belongs to the module under construction: its ports (unique by
 * name, in declaration order), parameters, section markers, closed submodules and the
 * one submodule that may be in progress.
 * <p>
 * {@link #finish} turns the context into an immutable {@link VerilogModule}; the context
 * is discarded afterwards.
 */
final class ModuleBuildContext {

    private final String name;
    private final Map<String, PortDraft> ports = new LinkedHashMap<>();
    private final List<ParameterDraft> parameters = new ArrayList<>();
    private final List<SectionBreak> sectionBreaks = new ArrayList<>();
    private final List<VerilogSubModule> submodules = new ArrayList<>();
    private SubModuleDraft currentSubModule;

    ModuleBuildContext(String name) {
        this.name = name;
    }

    String name() {
        return name;
    }

    /**
     * Declares a port, or redeclares it if the name is already known. A redeclared port
     * keeps its original position.
     * @return The port draft.
     */
    PortDraft declarePort(String portName, PortDirection direction, String dataType) {
        PortDraft port = ports.get(portName);
        if (port == null) {
            port = new PortDraft(portName, direction, dataType);
            ports.put(portName, port);
        } else {
            port.redeclare(direction, dataType);
        }
        return port;
    }

    int portCount() {
        return ports.size();
    }

    boolean hasParameter(String parameterName) {
        return parameters.stream().anyMatch(p -> p.name().equals(parameterName));
    }

    ParameterDraft addParameter(String parameterName, String dataType, String defaultValue) {
        ParameterDraft parameter = new ParameterDraft(parameterName, dataType, defaultValue);
        parameters.add(parameter);
        return parameter;
    }

    void markSection(String label, int offset) {
        sectionBreaks.add(new SectionBreak(ports.size(), label, offset));
    }

    SubModuleDraft currentSubModule() {
        return currentSubModule;
    }

    SubModuleDraft beginSubModule(String moduleType, String instanceName) {
        currentSubModule = new SubModuleDraft(moduleType, instanceName);
        return currentSubModule;
    }

    VerilogSubModule continueSubModule(String nextInstanceName) {
        SubModuleDraft next = currentSubModule.nextInstance(nextInstanceName);
        VerilogSubModule closed = closeSubModule();
        currentSubModule = next;
        return closed;
    }

    VerilogSubModule closeSubModule() {
        VerilogSubModule submodule = currentSubModule.toSubModule();
        submodules.add(submodule);
        currentSubModule = null;
        return submodule;
    }

    /**
     * Builds the finalized module.
     * @param description The module description, or {@code null}.
     * @param droppedSections Receives section markers that label no port.
     * @return The immutable module.
     */
    VerilogModule finish(String description, Consumer<SectionBreak> droppedSections) {
        List<VerilogPort> finalPorts = ports.values().stream().map(PortDraft::toPort).toList();
        List<String> portNames = new ArrayList<>(ports.keySet());
        List<VerilogParameter> finalParameters = parameters.stream().map(ParameterDraft::toParameter).toList();
        Map<String, List<String>> sections = SectionResolver.resolve(portNames, sectionBreaks, droppedSections);
        return new VerilogModule(name, finalPorts, finalParameters, sections, submodules, description);
    }
}
