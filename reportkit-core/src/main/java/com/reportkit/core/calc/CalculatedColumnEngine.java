package com.reportkit.core.calc;

import com.reportkit.core.model.CalculatedColumn;
import com.reportkit.core.model.TabularData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Derives calculated columns from existing ones.
 * <p>
 * Columns are computed in the order given against a working copy of the
 * table, so a calculated column may use the result of an earlier one. Cells
 * that are not numbers never fail the computation: SUM and DIFF read them as
 * 0, MULTIPLY leaves them out of the product and DIVIDE yields 0 when the
 * divisor is 0 or missing. DIFF and DIVIDE with fewer than two sources, and
 * any column without sources, are skipped.
 */
public class CalculatedColumnEngine {

    private static final Logger logger = LoggerFactory.getLogger(CalculatedColumnEngine.class);

    /**
     * Apply calculated columns to a table.
     *
     * @return a new table with the original columns followed by the calculated
     *         ones, or {@code data} itself when there is nothing to compute
     */
    public TabularData apply(TabularData data, List<CalculatedColumn> calculatedColumns) {
        if (calculatedColumns == null || calculatedColumns.isEmpty() || data.isEmpty()) {
            return data;
        }

        // Working copy, preserves column order
        Map<String, List<String>> working = new LinkedHashMap<>(data.asMap());
        int rowCount = data.getRowCount();

        for (CalculatedColumn calc : calculatedColumns) {
            List<String> sources = calc.getSourceColumns();
            if (sources.isEmpty()) {
                logger.debug("Skipping calculated column '{}': no source columns", calc.getName());
                continue;
            }

            List<String> values = switch (calc.getOperation()) {
                case SUM -> sum(working, sources, rowCount);
                case MULTIPLY -> multiply(working, sources, rowCount);
                case DIFF -> sources.size() < 2 ? null : diff(working, sources.get(0), sources.get(1), rowCount);
                case DIVIDE -> sources.size() < 2 ? null : divide(working, sources.get(0), sources.get(1), rowCount);
            };

            if (values == null) {
                logger.debug("Skipping calculated column '{}': {} needs two source columns",
                        calc.getName(), calc.getOperation());
                continue;
            }
            working.put(calc.getName(), values);
        }

        TabularData.Builder result = TabularData.builder();
        working.forEach(result::column);
        return result.build();
    }

    private List<String> sum(Map<String, List<String>> working, List<String> sources, int rowCount) {
        List<String> values = new ArrayList<>(rowCount);
        for (int row = 0; row < rowCount; row++) {
            double sum = 0.0;
            for (String source : sources) {
                sum += cell(working, source, row).orElse(0.0);
            }
            values.add(NumberFormats.canonical(sum));
        }
        return values;
    }

    private List<String> multiply(Map<String, List<String>> working, List<String> sources, int rowCount) {
        List<String> values = new ArrayList<>(rowCount);
        for (int row = 0; row < rowCount; row++) {
            Double product = null;
            for (String source : sources) {
                OptionalDouble factor = cell(working, source, row);
                if (factor.isEmpty()) {
                    continue;
                }
                product = product == null ? factor.getAsDouble() : product * factor.getAsDouble();
            }
            values.add(NumberFormats.canonical(product != null ? product : 0.0));
        }
        return values;
    }

    private List<String> diff(Map<String, List<String>> working, String minuend, String subtrahend, int rowCount) {
        List<String> values = new ArrayList<>(rowCount);
        for (int row = 0; row < rowCount; row++) {
            double a = cell(working, minuend, row).orElse(0.0);
            double b = cell(working, subtrahend, row).orElse(0.0);
            values.add(NumberFormats.canonical(a - b));
        }
        return values;
    }

    private List<String> divide(Map<String, List<String>> working, String dividend, String divisor, int rowCount) {
        List<String> values = new ArrayList<>(rowCount);
        for (int row = 0; row < rowCount; row++) {
            double a = cell(working, dividend, row).orElse(0.0);
            OptionalDouble b = cell(working, divisor, row);
            double result = b.isEmpty() || b.getAsDouble() == 0.0 ? 0.0 : a / b.getAsDouble();
            values.add(NumberFormats.canonical(result));
        }
        return values;
    }

    private OptionalDouble cell(Map<String, List<String>> working, String column, int row) {
        List<String> values = working.get(column);
        if (values == null || row >= values.size()) {
            return OptionalDouble.empty();
        }
        return NumberFormats.parseLenient(values.get(row));
    }
}
