package com.reportkit.report;

import com.reportkit.core.calc.SummaryEvaluator;
import com.reportkit.core.model.SectionStyle;
import com.reportkit.core.model.SummaryItem;
import com.reportkit.core.model.TabularData;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Markdown layout: a level two heading, a pipe table and a bullet list summary.
 */
public class MarkdownSectionFormatter implements SectionFormatter {

    static final String NO_DATA = "_No data_";

    private final SummaryEvaluator summaryEvaluator;

    public MarkdownSectionFormatter(SummaryEvaluator summaryEvaluator) {
        this.summaryEvaluator = summaryEvaluator;
    }

    @Override
    public void renderSeparator(StringBuilder sb) {
        sb.append("\n---\n\n");
    }

    @Override
    public void renderTitle(StringBuilder sb, String title, SectionStyle style) {
        if (title == null || title.isBlank()) {
            return;
        }

        String text = escapeInline(title);
        if (style.isTitleBold() && style.isTitleItalic()) {
            text = "***" + text + "***";
        } else if (style.isTitleBold()) {
            text = "**" + text + "**";
        } else if (style.isTitleItalic()) {
            text = "_" + text + "_";
        }
        // Markdown has no underline, inline HTML does
        if (style.isUnderline()) {
            text = "<u>" + text + "</u>";
        }

        sb.append("## ").append(text).append("\n\n");
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
        if (showRowNumbers) {
            headers.add("#");
        }
        headers.addAll(columnNames);

        // A pipe table always needs a header row, leave it blank when hidden
        List<String> headerCells = new ArrayList<>(headers.size());
        for (String header : headers) {
            if (!showHeader) {
                headerCells.add("");
            } else {
                String cell = escapeCell(header);
                headerCells.add(style.isHeaderBold() ? "**" + cell + "**" : cell);
            }
        }
        appendRow(sb, headerCells);
        appendRow(sb, Collections.nCopies(headers.size(), "---"));

        for (int row = 0; row < rowCount; row++) {
            List<String> cells = new ArrayList<>(headers.size());
            if (showRowNumbers) {
                cells.add(String.valueOf(row + 1));
            }
            for (String column : columnNames) {
                String value = data.getCell(column, row);
                cells.add(escapeCell(value != null ? value : ""));
            }
            appendRow(sb, cells);
        }
    }

    @Override
    public void renderSummary(StringBuilder sb, List<SummaryItem> summaryItems, TabularData data) {
        if (summaryItems.isEmpty()) {
            return;
        }
        sb.append('\n');
        for (SummaryItem item : summaryItems) {
            sb.append("- **")
              .append(escapeInline(item.getLabel()))
              .append(":** ")
              .append(escapeInline(summaryEvaluator.evaluate(item, data)))
              .append('\n');
        }
    }

    /**
     * Escape a table cell: pipes are backslash escaped, line breaks become a space.
     */
    static String escapeCell(String text) {
        return escapeInline(text).replace("|", "\\|");
    }

    private static String escapeInline(String text) {
        return text.replace("\r\n", " ").replace('\n', ' ').replace('\r', ' ');
    }

    private void appendRow(StringBuilder sb, List<String> cells) {
        sb.append("| ").append(String.join(" | ", cells)).append(" |\n");
    }
}
