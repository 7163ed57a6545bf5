package com.reportkit.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Describes one column derived arithmetically from other columns.
 * The order of {@link #getSourceColumns()} matters for DIFF and DIVIDE.
 */
public class CalculatedColumn {

    private final String name;
    private final ColumnCalcType operation;
    private final List<String> sourceColumns;

    public CalculatedColumn(String name, ColumnCalcType operation, List<String> sourceColumns) {
        this.name = Objects.requireNonNull(name, "name");
        this.operation = Objects.requireNonNull(operation, "operation");
        this.sourceColumns = sourceColumns != null ? List.copyOf(sourceColumns) : List.of();
    }

    public static CalculatedColumn of(String name, ColumnCalcType operation, String... sourceColumns) {
        return new CalculatedColumn(name, operation, Arrays.asList(sourceColumns));
    }

    public String getName() {
        return name;
    }

    public ColumnCalcType getOperation() {
        return operation;
    }

    public List<String> getSourceColumns() {
        return sourceColumns;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CalculatedColumn that = (CalculatedColumn) o;
        return name.equals(that.name) &&
               operation == that.operation &&
               sourceColumns.equals(that.sourceColumns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, operation, sourceColumns);
    }

    @Override
    public String toString() {
        return name + " = " + operation + sourceColumns;
    }
}
