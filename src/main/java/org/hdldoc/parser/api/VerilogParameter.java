package org.hdldoc.parser.api;

import java.util.Objects;

/**
 * A parameter (generic) of a Verilog module.
 *
 * @param name The parameter name.
 * @param dataType The composite type, e.g. {@code "wire"} or {@code "wire [7:0]"}.
 * @param defaultValue The default value expression as written in the source, or {@code null}.
 * @param description The attached comment text, or {@code null}.
 */
public record VerilogParameter(String name, String dataType, String defaultValue, String description) {

    /** The mode of every parameter. */
    public static final String MODE = "in";

    public VerilogParameter {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(dataType, "dataType");
    }

    /**
     * Parameters are always inputs to the module.
     * @return {@value #MODE}
     */
    public String mode() {
        return MODE;
    }

    @Override
    public String toString() {
        String text = name + " : " + dataType;
        return defaultValue == null ? text : text + " := " + defaultValue;
    }
}
