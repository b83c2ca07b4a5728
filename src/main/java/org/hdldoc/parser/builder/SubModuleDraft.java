package org.hdldoc.parser.builder;

import org.hdldoc.parser.api.VerilogSubModule;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A submodule instantiation between its opening and its closing {@code );}.
 * <p>
 * The instance name is known from the start for plain instantiations and only after the
 * parameter override list for parameterized ones.
 */
final class SubModuleDraft implements Describable {

    private final String moduleType;
    private String instanceName;
    private final Map<String, String> connections = new LinkedHashMap<>();
    private Map<String, String> parameterOverrides = Map.of();
    private final DescriptionBuffer description = new DescriptionBuffer();
    private String openConnection;
    private final StringBuilder connectionText = new StringBuilder();

    SubModuleDraft(String moduleType, String instanceName) {
        this.moduleType = moduleType;
        this.instanceName = instanceName;
    }

    String moduleType() {
        return moduleType;
    }

    String instanceName() {
        return instanceName;
    }

    /**
     * Names a parameterized instance. Everything connected so far belongs to the
     * parameter override list.
     */
    void setInstanceName(String instanceName) {
        this.instanceName = instanceName;
        this.parameterOverrides = new LinkedHashMap<>(connections);
    }

    /**
     * Starts the next instance of a multi-instance statement such as
     * {@code sub #(.W(4)) u1 (...), u2 (...);}. The parameter overrides apply to every instance.
     */
    SubModuleDraft nextInstance(String nextInstanceName) {
        SubModuleDraft next = new SubModuleDraft(moduleType, nextInstanceName);
        next.connections.putAll(parameterOverrides);
        next.parameterOverrides = parameterOverrides;
        return next;
    }

    boolean hasOpenConnection() {
        return openConnection != null;
    }

    String openConnection() {
        return openConnection;
    }

    void openConnection(String formalName) {
        openConnection = formalName;
        connectionText.setLength(0);
    }

    void appendConnectionText(String text) {
        connectionText.append(text);
    }

    void closeConnection() {
        connections.put(openConnection, connectionText.toString().strip());
        openConnection = null;
        connectionText.setLength(0);
    }

    @Override
    public void appendDescription(String text) {
        description.appendDescription(text);
    }

    VerilogSubModule toSubModule() {
        return new VerilogSubModule(moduleType, instanceName, connections, description.text());
    }
}
