package com.reportkit.core.validation;

import com.reportkit.core.model.CalculatedColumn;
import com.reportkit.core.model.ColumnCalcType;
import com.reportkit.core.model.SummaryCalcType;
import com.reportkit.core.model.SummaryItem;
import com.reportkit.core.model.TabularData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Checks that a section's data, summary items and calculated columns fit
 * together before anything is rendered.
 * <p>
 * Checks run in a fixed order and stop at the first failure, which is logged
 * and returned. The data passed in is expected to already contain the
 * calculated columns.
 */
public class SectionValidator {

    private static final Logger logger = LoggerFactory.getLogger(SectionValidator.class);

    public boolean isValid(TabularData data, List<SummaryItem> summaryItems,
                           List<CalculatedColumn> calculatedColumns) {
        return validate(data, summaryItems, calculatedColumns).isValid();
    }

    public ValidationResult validate(TabularData data, List<SummaryItem> summaryItems,
                                     List<CalculatedColumn> calculatedColumns) {
        ValidationResult result = check(data,
                summaryItems != null ? summaryItems : List.of(),
                calculatedColumns != null ? calculatedColumns : List.of());
        if (!result.isValid()) {
            logger.warn("Validation failed: {}", result.getMessage().orElse(""));
        }
        return result;
    }

    private ValidationResult check(TabularData data, List<SummaryItem> summaryItems,
                                   List<CalculatedColumn> calculatedColumns) {
        if (data == null || data.isEmpty()) {
            return ValidationResult.invalid("data has no columns");
        }

        // Uniform row count
        int expectedRows = data.getRowCount();
        for (Map.Entry<String, List<String>> column : data.asMap().entrySet()) {
            if (column.getValue().size() != expectedRows) {
                return ValidationResult.invalid(String.format(
                        "column '%s' has %d rows, expected %d",
                        column.getKey(), column.getValue().size(), expectedRows));
            }
        }

        for (SummaryItem item : summaryItems) {
            ValidationResult itemResult = checkSummaryItem(item, data);
            if (!itemResult.isValid()) {
                return itemResult;
            }
        }

        for (CalculatedColumn calc : calculatedColumns) {
            ValidationResult calcResult = checkCalculatedColumn(calc, data);
            if (!calcResult.isValid()) {
                return calcResult;
            }
        }

        return ValidationResult.valid();
    }

    private ValidationResult checkSummaryItem(SummaryItem item, TabularData data) {
        String label = item.getLabel();
        SummaryCalcType type = item.getCalcType();

        if (type == SummaryCalcType.MANUAL) {
            if (item.getManualValue() == null) {
                return ValidationResult.invalid("summary item '" + label + "' is MANUAL but has no value");
            }
            return ValidationResult.valid();
        }

        if (item.getColumnName() == null) {
            return ValidationResult.invalid("summary item '" + label + "' (" + type + ") has no column");
        }
        if (type == SummaryCalcType.COUNT_IF && item.getConditionValue() == null) {
            return ValidationResult.invalid("summary item '" + label + "' is COUNT_IF but has no condition value");
        }
        if (!data.hasColumn(item.getColumnName())) {
            return ValidationResult.invalid("summary item '" + label + "' refers to unknown column '"
                    + item.getColumnName() + "'");
        }
        return ValidationResult.valid();
    }

    private ValidationResult checkCalculatedColumn(CalculatedColumn calc, TabularData data) {
        String name = calc.getName();
        List<String> sources = calc.getSourceColumns();
        ColumnCalcType operation = calc.getOperation();

        if (sources.isEmpty()) {
            return ValidationResult.invalid("calculated column '" + name + "' has no source columns");
        }
        if (!operation.acceptsSourceCount(sources.size())) {
            String expected = operation.getMinSources() == operation.getMaxSources()
                    ? "exactly " + operation.getMinSources()
                    : "at least " + operation.getMinSources();
            return ValidationResult.invalid(String.format(
                    "calculated column '%s' (%s) needs %s source columns, got %d",
                    name, operation, expected, sources.size()));
        }
        for (String source : sources) {
            if (!data.hasColumn(source)) {
                return ValidationResult.invalid("calculated column '" + name
                        + "' refers to unknown column '" + source + "'");
            }
        }
        return ValidationResult.valid();
    }
}
