package com.reportkit.core.calc;

import java.util.List;

/**
 * Aggregate functions over the cells of one column.
 * <p>
 * Implementations never fail on bad input: values that are not numbers
 * degrade to the documented defaults.
 */
public interface CalculationProvider {

    /**
     * Sum of the numeric cells, 0.0 if there are none.
     */
    double sum(List<String> columnValues);

    /**
     * Arithmetic mean of the numeric cells, 0.0 if there are none.
     */
    double average(List<String> columnValues);

    /**
     * Smallest numeric cell, 0.0 if there are none.
     */
    double min(List<String> columnValues);

    /**
     * Largest numeric cell, 0.0 if there are none.
     */
    double max(List<String> columnValues);

    /**
     * Number of cells, numeric or not.
     */
    int count(List<String> columnValues);

    /**
     * Number of cells exactly equal to {@code conditionValue}.
     */
    int countIf(List<String> columnValues, String conditionValue);
}
