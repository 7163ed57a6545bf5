package com.reportkit.core.calc;

import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.stream.DoubleStream;

/**
 * Stateless {@link CalculationProvider}. Cells are trimmed and parsed as
 * decimal numbers, cells that do not parse are skipped by the numeric
 * aggregates. {@link #count(List)} counts every cell.
 */
public class DefaultCalculationProvider implements CalculationProvider {

    @Override
    public double sum(List<String> columnValues) {
        return numbers(columnValues).sum();
    }

    @Override
    public double average(List<String> columnValues) {
        return numbers(columnValues).average().orElse(0.0);
    }

    @Override
    public double min(List<String> columnValues) {
        return numbers(columnValues).min().orElse(0.0);
    }

    @Override
    public double max(List<String> columnValues) {
        return numbers(columnValues).max().orElse(0.0);
    }

    @Override
    public int count(List<String> columnValues) {
        return columnValues != null ? columnValues.size() : 0;
    }

    @Override
    public int countIf(List<String> columnValues, String conditionValue) {
        if (columnValues == null || conditionValue == null) {
            return 0;
        }
        return (int) columnValues.stream()
                .filter(value -> Objects.equals(value, conditionValue))
                .count();
    }

    private DoubleStream numbers(List<String> columnValues) {
        if (columnValues == null) {
            return DoubleStream.empty();
        }
        return columnValues.stream()
                .map(NumberFormats::parse)
                .filter(OptionalDouble::isPresent)
                .mapToDouble(OptionalDouble::getAsDouble);
    }
}
