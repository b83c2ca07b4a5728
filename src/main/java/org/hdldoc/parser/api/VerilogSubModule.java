package org.hdldoc.parser.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An instantiation of a module inside another module.
 *
 * @param moduleType The name of the instantiated module.
 * @param instanceName The instance name.
 * @param connections The named connections, formal port or parameter name to the actual
 *                    expression as written in the source, in source order.
 * @param description The attached comment text, or {@code null}.
 */
public record VerilogSubModule(String moduleType, String instanceName, Map<String, String> connections,
                               String description) {

    public VerilogSubModule {
        Objects.requireNonNull(moduleType, "moduleType");
        Objects.requireNonNull(instanceName, "instanceName");
        connections = connections == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(connections));
    }

    @Override
    public String toString() {
        return instanceName + " (" + moduleType + ")";
    }
}
