package com.reportkit.core.model;

/**
 * Kind of value shown for a summary item beneath a section's table.
 */
public enum SummaryCalcType {
    SUM,
    AVG,
    MIN,
    MAX,
    COUNT,
    COUNT_IF,
    /** Caller supplied text, no calculation. */
    MANUAL;

    /**
     * True for every type that aggregates a column.
     */
    public boolean requiresColumn() {
        return this != MANUAL;
    }

    /**
     * Parse a summary type from string, case-insensitive.
     *
     * @throws IllegalArgumentException if the name is not recognized
     */
    public static SummaryCalcType fromString(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Summary type must not be empty");
        }
        String upper = name.trim().toUpperCase().replace('-', '_');
        return switch (upper) {
            case "AVERAGE", "MEAN" -> AVG;
            case "COUNTIF" -> COUNT_IF;
            default -> SummaryCalcType.valueOf(upper);
        };
    }
}
