package com.reportkit.report;

import com.reportkit.core.calc.DefaultCalculationProvider;
import com.reportkit.core.calc.SummaryEvaluator;
import com.reportkit.core.model.Section;
import com.reportkit.core.model.SectionStyle;
import com.reportkit.core.model.TabularData;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HtmlRendererTest {

    private final HtmlRenderer renderer = new HtmlRenderer();

    @Test
    @DisplayName("Complete document with table and summary")
    void document() {
        String html = renderer.render(List.of(TestData.scoresSection()));

        assertTrue(html.startsWith("<!DOCTYPE html>"));
        assertTrue(html.contains("<h2>Scores</h2>"));
        assertTrue(html.contains(">Name</th>"));
        assertTrue(html.contains(">Ann</td>"));
        assertTrue(html.contains("<ul class=\"summary\">"));
        assertTrue(html.contains("<li><b>Total:</b> 17</li>"));
        assertTrue(html.trim().endsWith("</html>"));
    }

    @Test
    @DisplayName("Title wrapped in bold, italic and underline")
    void titleStyle() {
        Section section = Section.builder()
                .title("T")
                .data(TestData.scores())
                .style(SectionStyle.builder().titleBold(true).titleItalic(true).underline(true).build())
                .build();

        assertTrue(renderer.render(List.of(section)).contains("<h2><b><i><u>T</u></i></b></h2>"));
    }

    @Test
    @DisplayName("Border width is applied to table and cells")
    void border() {
        String html = renderer.render(List.of(TestData.pricesSection()));

        assertTrue(html.contains("<table style=\"border-collapse:collapse;border:2px solid #333;\">"));
        assertTrue(html.contains("<td style=\"border:2px solid #333;\">Apple</td>"));
        assertTrue(html.contains("font-weight:bold;"));
    }

    @Test
    @DisplayName("Row number header uses the same style as the other headers")
    void rowNumberHeaderStyle() {
        Section section = Section.builder()
                .data(TestData.scores())
                .showRowNumbers(true)
                .style(SectionStyle.builder().headerBold(false).borderWidth(1).build())
                .build();

        String html = renderer.render(List.of(section));

        assertTrue(html.contains("<th style=\"border:1px solid #333;font-weight:normal;\">#</th>"));
        assertTrue(html.contains("<th style=\"border:1px solid #333;font-weight:normal;\">Name</th>"));
    }

    @Test
    @DisplayName("Zero border leaves cells unbordered")
    void noBorder() {
        Section section = Section.builder()
                .data(TestData.scores())
                .style(SectionStyle.builder().borderWidth(0).build())
                .build();

        assertFalse(renderer.render(List.of(section)).contains("solid #333"));
    }

    @Test
    @DisplayName("Special characters are escaped")
    void escaping() {
        Section section = Section.of("A & B", TabularData.builder()
                .column("<col>", "\"quoted\" 'single'")
                .build());

        String html = renderer.render(List.of(section));

        assertTrue(html.contains("<h2>A &amp; B</h2>"));
        assertTrue(html.contains("&lt;col&gt;"));
        assertTrue(html.contains("&quot;quoted&quot; &#39;single&#39;"));
    }

    @Test
    @DisplayName("Sections are separated by a rule")
    void separator() {
        String html = renderer.render(List.of(TestData.scoresSection(), TestData.pricesSection()));

        assertEquals(1, html.split("<hr/>", -1).length - 1);
    }

    @Test
    @DisplayName("Empty table renders a placeholder")
    void emptyPlaceholder() {
        HtmlSectionFormatter formatter = new HtmlSectionFormatter(new SummaryEvaluator(new DefaultCalculationProvider()));
        StringBuilder sb = new StringBuilder();

        formatter.renderTable(sb, TabularData.empty(), false, SectionStyle.defaults(), true);

        assertEquals("<p><em>No data</em></p>\n", sb.toString());
    }
}
