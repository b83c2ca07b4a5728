package org.hdldoc.parser.builder;

/**
 * A section marker, recorded when it is seen.
 *
 * @param portIndex The number of ports declared before the marker.
 * @param label The section label.
 * @param offset The source offset of the marker.
 */
record SectionBreak(int portIndex, String label, int offset) {
}
