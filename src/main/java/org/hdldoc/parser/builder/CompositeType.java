package org.hdldoc.parser.builder;

/**
 * Assembles the composite type strings of ports and parameters from the fragments of a
 * declaration: {@code [base type] [signedness] [bit range]}.
 */
public final class CompositeType {

    /** The type of a port or parameter declared without a net type or data type. */
    public static final String DEFAULT_TYPE = "wire";

    private CompositeType() {
    }

    /**
     * Joins the fragments of a declaration into a type string.
     * <p>
     * {@code assemble(null, null, null)} is {@value #DEFAULT_TYPE};
     * {@code assemble("reg", null, "[7:0]")} is {@code "reg [7:0]"};
     * {@code assemble(null, "signed", "[3:0]")} is {@code "wire signed [3:0]"}.
     *
     * @param baseType The net or data type keyword, or {@code null} for the default type.
     * @param signedness {@code signed}, {@code unsigned} or {@code null}.
     * @param range The bit range including its brackets, or {@code null}.
     * @return The composite type.
     */
    public static String assemble(String baseType, String signedness, String range) {
        StringBuilder type = new StringBuilder(isBlank(baseType) ? DEFAULT_TYPE : baseType.trim());
        if (!isBlank(signedness)) {
            type.append(' ').append(signedness.trim());
        }
        if (!isBlank(range)) {
            type.append(' ').append(range.trim());
        }
        return type.toString();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
