package com.reportkit.core.calc;

import com.reportkit.core.model.SummaryCalcType;
import com.reportkit.core.model.SummaryItem;
import com.reportkit.core.model.TabularData;

import java.util.List;
import java.util.Objects;

/**
 * Turns a {@link SummaryItem} into the text shown after its label.
 */
public class SummaryEvaluator {

    private final CalculationProvider calculationProvider;

    public SummaryEvaluator(CalculationProvider calculationProvider) {
        this.calculationProvider = Objects.requireNonNull(calculationProvider, "calculationProvider");
    }

    public CalculationProvider getCalculationProvider() {
        return calculationProvider;
    }

    /**
     * Evaluate an item against a table. Items that miss the column (or the
     * condition for COUNT_IF) evaluate to an empty string; a column that does
     * not exist is aggregated as an empty column.
     */
    public String evaluate(SummaryItem item, TabularData data) {
        if (item.getCalcType() == SummaryCalcType.MANUAL) {
            return item.getManualValue() != null ? item.getManualValue() : "";
        }

        String column = item.getColumnName();
        if (column == null) {
            return "";
        }
        List<String> values = data.getColumn(column);

        return switch (item.getCalcType()) {
            case SUM -> NumberFormats.canonical(calculationProvider.sum(values));
            case AVG -> NumberFormats.canonical(calculationProvider.average(values));
            case MIN -> NumberFormats.canonical(calculationProvider.min(values));
            case MAX -> NumberFormats.canonical(calculationProvider.max(values));
            case COUNT -> String.valueOf(calculationProvider.count(values));
            case COUNT_IF -> item.getConditionValue() == null
                    ? ""
                    : String.valueOf(calculationProvider.countIf(values, item.getConditionValue()));
            case MANUAL -> "";
        };
    }
}
