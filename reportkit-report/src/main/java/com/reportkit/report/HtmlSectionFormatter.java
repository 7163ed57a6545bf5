package com.reportkit.report;

import com.reportkit.core.calc.SummaryEvaluator;
import com.reportkit.core.model.SectionStyle;
import com.reportkit.core.model.SummaryItem;
import com.reportkit.core.model.TabularData;

import java.util.List;

/**
 * HTML layout shared by the HTML and PDF renderers. Output is well-formed
 * XHTML so that it can be handed to an XML based PDF engine unchanged.
 */
public class HtmlSectionFormatter implements SectionFormatter {

    static final String NO_DATA = "<p><em>No data</em></p>";

    private static final String BORDER_COLOR = "#333";

    private final SummaryEvaluator summaryEvaluator;
    private final String documentTitle;

    public HtmlSectionFormatter(SummaryEvaluator summaryEvaluator) {
        this(summaryEvaluator, "Report");
    }

    public HtmlSectionFormatter(SummaryEvaluator summaryEvaluator, String documentTitle) {
        this.summaryEvaluator = summaryEvaluator;
        this.documentTitle = documentTitle;
    }

    @Override
    public void beginDocument(StringBuilder sb) {
        sb.append("""
            <!DOCTYPE html>
            <html lang="en">
            <head>
              <meta charset="UTF-8"/>
            """);
        sb.append("  <title>").append(escapeHtml(documentTitle)).append("</title>\n");
        sb.append("""
              <style>
                body { font-family: sans-serif; font-size: 14px; }
                h1, h2 { margin: 0 0 0.5em 0; }
                table { border-collapse: collapse; margin-bottom: 1.5em; }
                th, td { padding: 4px 8px; text-align: left; }
                ul.summary { list-style-type: disc; margin: 0 0 1.5em 1.5em; padding: 0; }
              </style>
            </head>
            <body>
            """);
    }

    @Override
    public void endDocument(StringBuilder sb) {
        sb.append("</body>\n");
        sb.append("</html>\n");
    }

    @Override
    public void renderSeparator(StringBuilder sb) {
        sb.append("<hr/>\n");
    }

    @Override
    public void renderTitle(StringBuilder sb, String title, SectionStyle style) {
        if (title == null || title.isBlank()) {
            return;
        }

        StringBuilder open = new StringBuilder();
        StringBuilder close = new StringBuilder();
        if (style.isTitleBold()) {
            open.append("<b>");
            close.insert(0, "</b>");
        }
        if (style.isTitleItalic()) {
            open.append("<i>");
            close.insert(0, "</i>");
        }
        if (style.isUnderline()) {
            open.append("<u>");
            close.insert(0, "</u>");
        }

        sb.append("<h2>")
          .append(open)
          .append(escapeHtml(title))
          .append(close)
          .append("</h2>\n");
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
        int borderWidth = style.getEffectiveBorderWidth();

        String cellBorder = borderWidth > 0
                ? "border:" + borderWidth + "px solid " + BORDER_COLOR + ";"
                : "";

        sb.append("<table style=\"border-collapse:collapse;").append(cellBorder).append("\">\n");

        if (showHeader) {
            String headerStyle = cellBorder
                    + (style.isHeaderBold() ? "font-weight:bold;" : "font-weight:normal;")
                    + (style.isUnderline() ? "text-decoration:underline;" : "");
            sb.append("  <tr>");
            if (showRowNumbers) {
                sb.append("<th style=\"").append(headerStyle).append("\">#</th>");
            }
            for (String column : columnNames) {
                sb.append("<th style=\"").append(headerStyle).append("\">")
                  .append(escapeHtml(column))
                  .append("</th>");
            }
            sb.append("</tr>\n");
        }

        for (int row = 0; row < rowCount; row++) {
            sb.append("  <tr>");
            if (showRowNumbers) {
                sb.append("<td style=\"").append(cellBorder).append("\">")
                  .append(row + 1)
                  .append("</td>");
            }
            for (String column : columnNames) {
                String value = data.getCell(column, row);
                sb.append("<td style=\"").append(cellBorder).append("\">")
                  .append(escapeHtml(value != null ? value : ""))
                  .append("</td>");
            }
            sb.append("</tr>\n");
        }

        sb.append("</table>\n");
    }

    @Override
    public void renderSummary(StringBuilder sb, List<SummaryItem> summaryItems, TabularData data) {
        if (summaryItems.isEmpty()) {
            return;
        }
        sb.append("<ul class=\"summary\">\n");
        for (SummaryItem item : summaryItems) {
            sb.append("  <li><b>")
              .append(escapeHtml(item.getLabel()))
              .append(":</b> ")
              .append(escapeHtml(summaryEvaluator.evaluate(item, data)))
              .append("</li>\n");
        }
        sb.append("</ul>\n");
    }

    static String escapeHtml(String text) {
        if (text == null) return "";
        return text.replace("&", "&amp;")
                   .replace("<", "&lt;")
                   .replace(">", "&gt;")
                   .replace("\"", "&quot;")
                   .replace("'", "&#39;");
    }
}
