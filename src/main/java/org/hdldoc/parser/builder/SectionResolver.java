package org.hdldoc.parser.builder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Turns the section markers of a module into named slices of its final port list.
 * <p>
 * A marker recorded at port index {@code i} labels the ports from {@code i} up to the
 * index of the next marker, or up to the end of the list for the last marker. Slices
 * never overlap. Ports declared before the first marker belong to no section.
 */
final class SectionResolver {

    private SectionResolver() {
    }

    /**
     * @param portNames The port names in declaration order.
     * @param breaks The markers in source order.
     * @param dropped Receives markers that label no port: markers at or beyond the end of
     *                the port list, and markers directly followed by another marker.
     * @return The sections in marker order. A label used by several markers collects all of their ports.
     */
    static Map<String, List<String>> resolve(List<String> portNames, List<SectionBreak> breaks,
                                             Consumer<SectionBreak> dropped) {
        Map<String, List<String>> sections = new LinkedHashMap<>();
        int portCount = portNames.size();
        for (int i = 0; i < breaks.size(); i++) {
            SectionBreak current = breaks.get(i);
            int start = current.portIndex();
            int end = i + 1 < breaks.size() ? Math.min(breaks.get(i + 1).portIndex(), portCount) : portCount;
            if (start >= portCount || end <= start) {
                dropped.accept(current);
                continue;
            }
            sections.computeIfAbsent(current.label(), label -> new ArrayList<>())
                    .addAll(portNames.subList(start, end));
        }
        return sections;
    }
}
