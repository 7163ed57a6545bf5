package com.reportkit.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One self-contained block of a report: title, table, summary and display options.
 * A report is an ordered list of sections.
 */
public class Section {

    private final String title;
    private final TabularData data;
    private final List<SummaryItem> summaryItems;
    private final boolean showRowNumbers;
    private final SectionStyle style;
    private final boolean showHeader;
    private final List<CalculatedColumn> calculatedColumns;

    private Section(Builder builder) {
        this.title = builder.title;
        this.data = builder.data != null ? builder.data : TabularData.empty();
        this.summaryItems = List.copyOf(builder.summaryItems);
        this.showRowNumbers = builder.showRowNumbers;
        this.style = builder.style != null ? builder.style : SectionStyle.defaults();
        this.showHeader = builder.showHeader;
        this.calculatedColumns = List.copyOf(builder.calculatedColumns);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Section with default options around the given data.
     */
    public static Section of(String title, TabularData data) {
        return builder().title(title).data(data).build();
    }

    public String getTitle() {
        return title;
    }

    public boolean hasTitle() {
        return title != null && !title.isBlank();
    }

    /**
     * Title for diagnostics, never null.
     */
    public String getDisplayTitle() {
        return hasTitle() ? title : "untitled";
    }

    public TabularData getData() {
        return data;
    }

    public List<SummaryItem> getSummaryItems() {
        return summaryItems;
    }

    public boolean isShowRowNumbers() {
        return showRowNumbers;
    }

    public SectionStyle getStyle() {
        return style;
    }

    public boolean isShowHeader() {
        return showHeader;
    }

    public List<CalculatedColumn> getCalculatedColumns() {
        return calculatedColumns;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Section section = (Section) o;
        return showRowNumbers == section.showRowNumbers &&
               showHeader == section.showHeader &&
               Objects.equals(title, section.title) &&
               data.equals(section.data) &&
               summaryItems.equals(section.summaryItems) &&
               style.equals(section.style) &&
               calculatedColumns.equals(section.calculatedColumns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, data, summaryItems, showRowNumbers, style, showHeader, calculatedColumns);
    }

    @Override
    public String toString() {
        return "Section{title='" + title + '\'' +
                ", columns=" + data.getColumnNames() +
                ", rows=" + data.getRowCount() +
                ", summaryItems=" + summaryItems.size() +
                ", calculatedColumns=" + calculatedColumns.size() + '}';
    }

    public static class Builder {
        private String title;
        private TabularData data;
        private final List<SummaryItem> summaryItems = new ArrayList<>();
        private boolean showRowNumbers = false;
        private SectionStyle style;
        private boolean showHeader = true;
        private final List<CalculatedColumn> calculatedColumns = new ArrayList<>();

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder data(TabularData data) {
            this.data = data;
            return this;
        }

        public Builder summaryItem(SummaryItem item) {
            this.summaryItems.add(Objects.requireNonNull(item, "item"));
            return this;
        }

        public Builder summaryItems(List<SummaryItem> items) {
            this.summaryItems.clear();
            if (items != null) {
                items.forEach(this::summaryItem);
            }
            return this;
        }

        public Builder showRowNumbers(boolean showRowNumbers) {
            this.showRowNumbers = showRowNumbers;
            return this;
        }

        public Builder style(SectionStyle style) {
            this.style = style;
            return this;
        }

        public Builder showHeader(boolean showHeader) {
            this.showHeader = showHeader;
            return this;
        }

        public Builder calculatedColumn(CalculatedColumn column) {
            this.calculatedColumns.add(Objects.requireNonNull(column, "column"));
            return this;
        }

        public Builder calculatedColumns(List<CalculatedColumn> columns) {
            this.calculatedColumns.clear();
            if (columns != null) {
                columns.forEach(this::calculatedColumn);
            }
            return this;
        }

        public Section build() {
            return new Section(this);
        }
    }
}
