package com.reportkit.report.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One section of a JSON report. Row cells keep column order and the row
 * number, when enabled, is kept apart from the cells. Summary entries keep
 * the order and multiplicity of the section's summary items.
 */
@JsonPropertyOrder({"title", "columns", "rows", "summary"})
public class JsonSection {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String title;
    private List<String> columns = new ArrayList<>();
    private List<Row> rows = new ArrayList<>();
    private List<SummaryEntry> summary = new ArrayList<>();

    public static Builder builder() {
        return new Builder();
    }

    public String getTitle() {
        return title;
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<Row> getRows() {
        return rows;
    }

    public List<SummaryEntry> getSummary() {
        return summary;
    }

    @JsonPropertyOrder({"rowNumber", "cells"})
    public static class Row {

        @JsonInclude(JsonInclude.Include.NON_NULL)
        private final Integer rowNumber;
        private final Map<String, String> cells;

        public Row(Integer rowNumber, Map<String, String> cells) {
            this.rowNumber = rowNumber;
            this.cells = new LinkedHashMap<>(cells);
        }

        /** 1-based, or null when row numbers are off. */
        public Integer getRowNumber() {
            return rowNumber;
        }

        public Map<String, String> getCells() {
            return cells;
        }

        public String get(String column) {
            return cells.get(column);
        }
    }

    @JsonPropertyOrder({"label", "value"})
    public static class SummaryEntry {

        private final String label;
        private final String value;

        public SummaryEntry(String label, String value) {
            this.label = label;
            this.value = value;
        }

        public String getLabel() {
            return label;
        }

        public String getValue() {
            return value;
        }
    }

    public static class Builder {
        private final JsonSection section = new JsonSection();

        public Builder title(String title) {
            section.title = title;
            return this;
        }

        public Builder columns(List<String> columns) {
            section.columns = new ArrayList<>(columns);
            return this;
        }

        public Builder row(Integer rowNumber, Map<String, String> cells) {
            section.rows.add(new Row(rowNumber, cells));
            return this;
        }

        public Builder summary(String label, String value) {
            section.summary.add(new SummaryEntry(label, value));
            return this;
        }

        public JsonSection build() {
            return section;
        }
    }
}
