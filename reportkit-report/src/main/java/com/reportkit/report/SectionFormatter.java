package com.reportkit.report;

import com.reportkit.core.model.SectionStyle;
import com.reportkit.core.model.SummaryItem;
import com.reportkit.core.model.TabularData;

import java.util.List;

/**
 * Format specific emission of the parts of a report. {@link ReportAssembler}
 * decides what is emitted and in which order, implementations decide how.
 */
public interface SectionFormatter {

    /**
     * Written once before the first section.
     */
    default void beginDocument(StringBuilder sb) {
    }

    /**
     * Written once after the last section.
     */
    default void endDocument(StringBuilder sb) {
    }

    /**
     * Written between two consecutive sections.
     */
    void renderSeparator(StringBuilder sb);

    /**
     * Write the section title. Blank or null titles produce no output.
     */
    void renderTitle(StringBuilder sb, String title, SectionStyle style);

    /**
     * Write the table. Columns in data order, rows in input order, an optional
     * leading "#" column numbered from 1. Data without columns produces a
     * "no data" placeholder.
     */
    void renderTable(StringBuilder sb, TabularData data, boolean showRowNumbers,
                     SectionStyle style, boolean showHeader);

    /**
     * Write one "label: value" entry per summary item.
     */
    void renderSummary(StringBuilder sb, List<SummaryItem> summaryItems, TabularData data);
}
