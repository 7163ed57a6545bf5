package com.reportkit.core.model;

/**
 * Arithmetic operation used to derive a calculated column from other columns.
 */
public enum ColumnCalcType {
    /** Sum of two or more columns. */
    SUM(2, Integer.MAX_VALUE),

    /** Difference of exactly two columns: first - second. */
    DIFF(2, 2),

    /** Product of two or more columns. */
    MULTIPLY(2, Integer.MAX_VALUE),

    /** Quotient of exactly two columns: first / second. */
    DIVIDE(2, 2);

    private final int minSources;
    private final int maxSources;

    ColumnCalcType(int minSources, int maxSources) {
        this.minSources = minSources;
        this.maxSources = maxSources;
    }

    public int getMinSources() {
        return minSources;
    }

    public int getMaxSources() {
        return maxSources;
    }

    /**
     * Check whether the given number of source columns is allowed for this operation.
     */
    public boolean acceptsSourceCount(int count) {
        return count >= minSources && count <= maxSources;
    }

    /**
     * Parse an operation name, case-insensitive. Accepts a few common aliases.
     *
     * @throws IllegalArgumentException if the name is not recognized
     */
    public static ColumnCalcType fromString(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Column operation must not be empty");
        }
        String upper = name.trim().toUpperCase();
        return switch (upper) {
            case "SUM", "ADD", "PLUS" -> SUM;
            case "DIFF", "SUB", "SUBTRACT", "MINUS" -> DIFF;
            case "MULTIPLY", "MUL", "PRODUCT", "TIMES" -> MULTIPLY;
            case "DIVIDE", "DIV" -> DIVIDE;
            default -> throw new IllegalArgumentException("Unknown column operation: " + name);
        };
    }
}
