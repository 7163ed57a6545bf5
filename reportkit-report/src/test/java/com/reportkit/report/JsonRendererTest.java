package com.reportkit.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reportkit.core.calc.DefaultCalculationProvider;
import com.reportkit.core.model.Section;
import com.reportkit.core.model.SummaryItem;
import com.reportkit.core.model.TabularData;
import com.reportkit.report.model.JsonReport;
import com.reportkit.report.model.JsonSection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonRendererTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");

    private final JsonRenderer renderer = new JsonRenderer(
            new DefaultCalculationProvider(),
            new ReportAssembler(),
            Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    @DisplayName("Serializes sections with rows and summary")
    void serializes() throws Exception {
        JsonNode root = new ObjectMapper().readTree(renderer.render(List.of(TestData.scoresSection())));

        assertEquals("2024-05-01T10:15:30Z", root.get("generatedAt").asText());
        JsonNode section = root.get("sections").get(0);
        assertEquals("Scores", section.get("title").asText());
        assertEquals("Name", section.get("columns").get(0).asText());
        assertEquals(1, section.get("rows").get(0).get("rowNumber").asInt());
        assertEquals("Bob", section.get("rows").get(1).get("cells").get("Name").asText());
        assertEquals("Total", section.get("summary").get(0).get("label").asText());
        assertEquals("17", section.get("summary").get(0).get("value").asText());
    }

    @Test
    @DisplayName("Calculated columns appear in the document")
    void calculatedColumns() {
        JsonReport report = renderer.toDocument(List.of(TestData.pricesSection()));

        assertEquals(List.of("Item", "Price", "Qty", "Total"), report.getSections().get(0).getColumns());
        JsonSection section = report.getSections().get(0);
        assertEquals("200", section.getRows().get(0).get("Total"));
        assertNull(section.getRows().get(0).getRowNumber());
        assertEquals("Grand total", section.getSummary().get(0).getLabel());
        assertEquals("450", section.getSummary().get(0).getValue());
    }

    @Test
    @DisplayName("Untitled sections omit the title")
    void untitled() throws Exception {
        Section section = Section.of(null, TestData.scores());

        JsonNode root = new ObjectMapper().readTree(renderer.render(List.of(section)));

        assertFalse(root.get("sections").get(0).has("title"));
    }

    @Test
    @DisplayName("Summary items sharing a label keep one entry each")
    void duplicateSummaryLabels() {
        Section section = Section.builder()
                .title("Totals")
                .data(TabularData.builder()
                        .column("A", "1", "2")
                        .column("B", "10", "20")
                        .build())
                .summaryItem(SummaryItem.sum("Total", "A"))
                .summaryItem(SummaryItem.sum("Total", "B"))
                .build();

        List<JsonSection.SummaryEntry> summary = renderer.toDocument(List.of(section)).getSections().get(0).getSummary();

        assertEquals(2, summary.size());
        assertEquals("Total", summary.get(0).getLabel());
        assertEquals("3", summary.get(0).getValue());
        assertEquals("Total", summary.get(1).getLabel());
        assertEquals("30", summary.get(1).getValue());
    }

    @Test
    @DisplayName("A data column named # does not hide row numbers")
    void hashColumnWithRowNumbers() throws Exception {
        Section section = Section.builder()
                .data(TabularData.builder()
                        .column("#", "x", "y")
                        .column("B", "10", "20")
                        .build())
                .showRowNumbers(true)
                .build();

        JsonNode rows = new ObjectMapper().readTree(renderer.render(List.of(section)))
                .get("sections").get(0).get("rows");

        assertEquals(1, rows.get(0).get("rowNumber").asInt());
        assertEquals("x", rows.get(0).get("cells").get("#").asText());
        assertEquals(2, rows.get(1).get("rowNumber").asInt());
        assertEquals("y", rows.get(1).get("cells").get("#").asText());
    }
}
