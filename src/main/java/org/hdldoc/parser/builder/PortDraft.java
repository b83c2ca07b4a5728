package org.hdldoc.parser.builder;

import org.hdldoc.parser.api.PortDirection;
import org.hdldoc.parser.api.VerilogPort;

/**
 * A port whose module is still open.
 */
final class PortDraft implements Describable {

    private final String name;
    private PortDirection direction;
    private String dataType;
    private final DescriptionBuffer description = new DescriptionBuffer();

    PortDraft(String name, PortDirection direction, String dataType) {
        this.name = name;
        this.direction = direction;
        this.dataType = dataType;
    }

    /**
     * Applies a later declaration of the same port, as in a non-ANSI header followed by
     * a body declaration.
     */
    void redeclare(PortDirection newDirection, String newDataType) {
        this.direction = newDirection;
        this.dataType = newDataType;
    }

    @Override
    public void appendDescription(String text) {
        description.appendDescription(text);
    }

    VerilogPort toPort() {
        return new VerilogPort(name, direction, dataType, description.text());
    }
}
