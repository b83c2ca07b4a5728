package org.hdldoc.parser.builder;

import org.hdldoc.parser.api.VerilogParameter;

/**
 * A parameter whose module is still open.
 */
final class ParameterDraft implements Describable {

    private final String name;
    private final String dataType;
    private final String defaultValue;
    private final DescriptionBuffer description = new DescriptionBuffer();

    ParameterDraft(String name, String dataType, String defaultValue) {
        this.name = name;
        this.dataType = dataType;
        this.defaultValue = defaultValue;
    }

    String name() {
        return name;
    }

    @Override
    public void appendDescription(String text) {
        description.appendDescription(text);
    }

    VerilogParameter toParameter() {
        return new VerilogParameter(name, dataType, defaultValue, description.text());
    }
}
