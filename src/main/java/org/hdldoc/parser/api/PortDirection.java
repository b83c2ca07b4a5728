package org.hdldoc.parser.api;

import com.google.gson.annotations.SerializedName;

/**
 * The direction of a module port.
 */
public enum PortDirection {
    @SerializedName("input")
    INPUT("input"),
    @SerializedName("output")
    OUTPUT("output"),
    @SerializedName("inout")
    INOUT("inout");

    private final String keyword;

    PortDirection(String keyword) {
        this.keyword = keyword;
    }

    /**
     * @return The Verilog keyword that declares this direction.
     */
    public String keyword() {
        return keyword;
    }

    /**
     * Resolves a direction keyword.
     * @param keyword One of {@code input}, {@code output} or {@code inout}.
     * @return The matching direction.
     * @throws IllegalArgumentException if the keyword is not a direction.
     */
    public static PortDirection fromKeyword(String keyword) {
        for (PortDirection direction : values()) {
            if (direction.keyword.equals(keyword)) {
                return direction;
            }
        }
        throw new IllegalArgumentException("Unknown port direction: " + keyword);
    }

    @Override
    public String toString() {
        return keyword;
    }
}
