package org.hdldoc.parser.api;

import java.util.Objects;

/**
 * A port of a Verilog module.
 *
 * @param name The port name, unique within its module.
 * @param direction The port direction.
 * @param dataType The composite type, e.g. {@code "wire"} or {@code "reg [7:0]"}.
 * @param description The attached comment text, or {@code null}.
 */
public record VerilogPort(String name, PortDirection direction, String dataType, String description) {

    public VerilogPort {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(dataType, "dataType");
    }

    @Override
    public String toString() {
        return String.format("%s : %s %s", name, direction.keyword(), dataType);
    }
}
