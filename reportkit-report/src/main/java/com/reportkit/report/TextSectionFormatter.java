package com.reportkit.report;

import com.reportkit.core.calc.SummaryEvaluator;
import com.reportkit.core.model.SectionStyle;
import com.reportkit.core.model.SummaryItem;
import com.reportkit.core.model.TabularData;

import java.util.ArrayList;
import java.util.List;

/**
 * Plain text layout. Columns are padded to the widest of header and values
 * and separated by two spaces; a dash rule as long as each header text sits
 * under the header. Styles have no effect.
 */
public class TextSectionFormatter implements SectionFormatter {

    static final String NO_DATA = "[No data]";

    private static final String ROW_NUMBER_HEADER = "#";
    private static final String COLUMN_SEPARATOR = "  ";

    private final SummaryEvaluator summaryEvaluator;

    public TextSectionFormatter(SummaryEvaluator summaryEvaluator) {
        this.summaryEvaluator = summaryEvaluator;
    }

    @Override
    public void renderSeparator(StringBuilder sb) {
        sb.append("\n\n");
    }

    @Override
    public void renderTitle(StringBuilder sb, String title, SectionStyle style) {
        if (title == null || title.isBlank()) {
            return;
        }
        sb.append(title).append('\n');
    }

    @Override
    public void renderTable(StringBuilder sb, TabularData data, boolean showRowNumbers,
                            SectionStyle style, boolean showHeader) {
        // No columns, or columns without rows
        if (data.isEmpty() || data.getRowCount() == 0) {
            sb.append(NO_DATA).append('\n');
            return;
        }

        List<String> columnNames = data.getColumnNames();
        int rowCount = data.getRowCount();

        List<String> headers = new ArrayList<>();
        List<Integer> widths = new ArrayList<>();
        if (showRowNumbers) {
            headers.add(ROW_NUMBER_HEADER);
            widths.add(Math.max(ROW_NUMBER_HEADER.length(), String.valueOf(rowCount).length()));
        }
        for (String column : columnNames) {
            int width = column.length();
            for (String value : data.getColumn(column)) {
                width = Math.max(width, value.length());
            }
            headers.add(column);
            widths.add(width);
        }

        if (showHeader) {
            appendRow(sb, headers, widths);

            List<String> rules = new ArrayList<>(headers.size());
            for (String header : headers) {
                rules.add("-".repeat(header.length()));
            }
            appendRow(sb, rules, widths);
        }

        for (int row = 0; row < rowCount; row++) {
            List<String> cells = new ArrayList<>(headers.size());
            if (showRowNumbers) {
                cells.add(String.valueOf(row + 1));
            }
            for (String column : columnNames) {
                String value = data.getCell(column, row);
                cells.add(value != null ? value : "");
            }
            appendRow(sb, cells, widths);
        }
    }

    @Override
    public void renderSummary(StringBuilder sb, List<SummaryItem> summaryItems, TabularData data) {
        if (summaryItems.isEmpty()) {
            return;
        }
        sb.append('\n');
        for (SummaryItem item : summaryItems) {
            sb.append(item.getLabel())
              .append(": ")
              .append(summaryEvaluator.evaluate(item, data))
              .append('\n');
        }
    }

    private void appendRow(StringBuilder sb, List<String> cells, List<Integer> widths) {
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) {
                sb.append(COLUMN_SEPARATOR);
            }
            sb.append(padRight(cells.get(i), widths.get(i)));
        }
        sb.append('\n');
    }

    private String padRight(String text, int width) {
        if (text.length() >= width) {
            return text;
        }
        return text + " ".repeat(width - text.length());
    }
}
