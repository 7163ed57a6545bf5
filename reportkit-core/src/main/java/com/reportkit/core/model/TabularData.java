package com.reportkit.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Column-oriented table of string cells: an ordered mapping from unique column
 * name to the cells of that column, top to bottom.
 * <p>
 * Instances are immutable. Columns keep insertion order and every derivation
 * returns a new instance. Columns of unequal length are representable so that
 * they can be reported by the validator; {@link #getRowCount()} follows the
 * first column.
 */
public final class TabularData {

    private static final TabularData EMPTY = new TabularData(new LinkedHashMap<>());

    private final Map<String, List<String>> columns;

    private TabularData(LinkedHashMap<String, List<String>> columns) {
        this.columns = Collections.unmodifiableMap(columns);
    }

    public static TabularData empty() {
        return EMPTY;
    }

    /**
     * Copy a column map. Iteration order of the given map becomes column order,
     * null cells become empty strings.
     */
    public static TabularData of(Map<String, ? extends List<String>> columns) {
        Builder builder = builder();
        if (columns != null) {
            columns.forEach(builder::column);
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> getColumnNames() {
        return List.copyOf(columns.keySet());
    }

    /**
     * Cells of a column, or an empty list if there is no such column.
     */
    public List<String> getColumn(String name) {
        List<String> values = columns.get(name);
        return values != null ? values : List.of();
    }

    public boolean hasColumn(String name) {
        return name != null && columns.containsKey(name);
    }

    /**
     * Cell at the given position, or null when the column or row does not exist.
     */
    public String getCell(String column, int row) {
        List<String> values = columns.get(column);
        if (values == null || row < 0 || row >= values.size()) {
            return null;
        }
        return values.get(row);
    }

    public int getColumnCount() {
        return columns.size();
    }

    public int getRowCount() {
        if (columns.isEmpty()) {
            return 0;
        }
        return columns.values().iterator().next().size();
    }

    public boolean isEmpty() {
        return columns.isEmpty();
    }

    /**
     * Derive a table with the given column added after the existing ones.
     * A column with the same name is replaced where it stands.
     */
    public TabularData withColumn(String name, List<String> values) {
        LinkedHashMap<String, List<String>> copy = new LinkedHashMap<>(columns);
        copy.put(Objects.requireNonNull(name, "name"), immutableCells(values));
        return new TabularData(copy);
    }

    /**
     * Unmodifiable view of the column mapping.
     */
    public Map<String, List<String>> asMap() {
        return columns;
    }

    private static List<String> immutableCells(List<String> values) {
        if (values == null) {
            return List.of();
        }
        List<String> cells = new ArrayList<>(values.size());
        for (String value : values) {
            cells.add(value != null ? value : "");
        }
        return Collections.unmodifiableList(cells);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TabularData that = (TabularData) o;
        // LinkedHashMap equality ignores order, column order is part of our identity
        return getColumnNames().equals(that.getColumnNames()) && columns.equals(that.columns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getColumnNames(), columns);
    }

    @Override
    public String toString() {
        return "TabularData" + columns;
    }

    public static class Builder {
        private final LinkedHashMap<String, List<String>> columns = new LinkedHashMap<>();

        /**
         * Add a column. Adding a name twice replaces the earlier cells in place.
         */
        public Builder column(String name, List<String> values) {
            columns.put(Objects.requireNonNull(name, "name"), immutableCells(values));
            return this;
        }

        public Builder column(String name, String... values) {
            return column(name, List.of(values));
        }

        public TabularData build() {
            return new TabularData(new LinkedHashMap<>(columns));
        }
    }
}
