package com.reportkit.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    @Test
    @DisplayName("Section defaults")
    void sectionDefaults() {
        Section section = Section.builder()
                .data(TabularData.builder().column("A", "1").build())
                .build();

        assertNull(section.getTitle());
        assertEquals("untitled", section.getDisplayTitle());
        assertFalse(section.isShowRowNumbers());
        assertTrue(section.isShowHeader());
        assertTrue(section.getSummaryItems().isEmpty());
        assertTrue(section.getCalculatedColumns().isEmpty());
        assertEquals(SectionStyle.defaults(), section.getStyle());
    }

    @Test
    @DisplayName("Style defaults and border clamping")
    void styleDefaults() {
        SectionStyle style = SectionStyle.defaults();

        assertFalse(style.isTitleBold());
        assertFalse(style.isTitleItalic());
        assertFalse(style.isUnderline());
        assertFalse(style.isHeaderBold());
        assertEquals(1, style.getBorderWidth());

        SectionStyle negative = style.toBuilder().borderWidth(-4).build();
        assertEquals(-4, negative.getBorderWidth());
        assertEquals(0, negative.getEffectiveBorderWidth());
    }

    @Test
    @DisplayName("Summary item factories set type and column")
    void summaryFactories() {
        SummaryItem countIf = SummaryItem.countIf("Hundreds", "Price", "100");

        assertEquals(SummaryCalcType.COUNT_IF, countIf.getCalcType());
        assertEquals("Price", countIf.getColumnName());
        assertEquals("100", countIf.getConditionValue());

        SummaryItem manual = SummaryItem.manual("Note", "text");
        assertEquals(SummaryCalcType.MANUAL, manual.getCalcType());
        assertNull(manual.getColumnName());
        assertEquals("text", manual.getManualValue());
    }

    @Test
    @DisplayName("Calculated column keeps its sources in order")
    void calculatedColumn() {
        CalculatedColumn column = CalculatedColumn.of("Total", ColumnCalcType.MULTIPLY, "Price", "Qty");

        assertEquals(List.of("Price", "Qty"), column.getSourceColumns());
        assertEquals(column, CalculatedColumn.of("Total", ColumnCalcType.MULTIPLY, "Price", "Qty"));
    }

    @Test
    @DisplayName("Operation names parse leniently")
    void parseEnums() {
        assertEquals(ColumnCalcType.MULTIPLY, ColumnCalcType.fromString("mul"));
        assertEquals(ColumnCalcType.DIFF, ColumnCalcType.fromString(" diff "));
        assertThrows(IllegalArgumentException.class, () -> ColumnCalcType.fromString("pow"));

        assertEquals(SummaryCalcType.AVG, SummaryCalcType.fromString("average"));
        assertEquals(SummaryCalcType.COUNT_IF, SummaryCalcType.fromString("count-if"));
        assertThrows(IllegalArgumentException.class, () -> SummaryCalcType.fromString("median"));
    }

    @Test
    @DisplayName("Source count rules per operation")
    void sourceCounts() {
        assertTrue(ColumnCalcType.SUM.acceptsSourceCount(5));
        assertFalse(ColumnCalcType.DIFF.acceptsSourceCount(3));
        assertTrue(ColumnCalcType.DIVIDE.acceptsSourceCount(2));
        assertFalse(ColumnCalcType.MULTIPLY.acceptsSourceCount(1));
    }
}
