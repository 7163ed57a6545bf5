package com.reportkit.report;

import com.reportkit.core.calc.DefaultCalculationProvider;
import com.reportkit.core.calc.SummaryEvaluator;
import com.reportkit.core.exception.ReportValidationException;
import com.reportkit.core.model.Section;
import com.reportkit.core.model.SectionStyle;
import com.reportkit.core.model.TabularData;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TextRendererTest {

    private final TextRenderer renderer = new TextRenderer();

    @Test
    @DisplayName("Renderer metadata")
    void metadata() {
        assertEquals("txt", renderer.getName());
        assertEquals(".txt", renderer.getDefaultFileExtension());
        assertEquals("text/plain", renderer.getContentType());
        assertFalse(renderer.supportsFormatting());
    }

    @Test
    @DisplayName("Title, padded table with row numbers and summary")
    void fullSection() {
        String expected = """
                Scores
                #  Name  Score
                -  ----  -----
                1  Ann   10   \n\
                2  Bob   7    \n\

                Total: 17
                """;

        assertEquals(expected, renderer.render(List.of(TestData.scoresSection())));
    }

    @Test
    @DisplayName("Hidden header leaves only data rows")
    void noHeader() {
        Section section = Section.builder()
                .data(TestData.scores())
                .showHeader(false)
                .build();

        String text = renderer.render(List.of(section));

        assertEquals("Ann   10   \nBob   7    \n", text);
    }

    @Test
    @DisplayName("Values wider than the header widen the column")
    void wideValues() {
        Section section = Section.of(null, TabularData.builder()
                .column("N", "longer", "x")
                .build());

        String text = renderer.render(List.of(section));

        assertEquals("N     \n-     \nlonger\nx     \n", text);
    }

    @Test
    @DisplayName("Sections are separated by two blank lines")
    void twoSections() {
        Section first = Section.of("One", TabularData.builder().column("A", "1").build());
        Section second = Section.of("Two", TabularData.builder().column("B", "2").build());

        String text = renderer.render(List.of(first, second));

        assertEquals("One\nA\n-\n1\n\n\nTwo\nB\n-\n2\n", text);
    }

    @Test
    @DisplayName("Styles do not change plain text output")
    void stylesIgnored() {
        Section plain = TestData.scoresSection();
        Section styled = Section.builder()
                .title("Scores")
                .data(TestData.scores())
                .showRowNumbers(true)
                .summaryItems(plain.getSummaryItems())
                .style(SectionStyle.builder().titleBold(true).underline(true).headerBold(true).borderWidth(5).build())
                .build();

        assertEquals(renderer.render(List.of(plain)), renderer.render(List.of(styled)));
    }

    @Test
    @DisplayName("Calculated columns are rendered and summarized")
    void calculatedColumns() {
        String text = new String(renderer.generateReport(TestData.pricesSection()), StandardCharsets.UTF_8);

        assertTrue(text.contains("Total"));
        assertTrue(text.contains("Apple  100    2    200"));
        assertTrue(text.contains("Grand total: 450"));
        assertTrue(text.contains("Priced 100: 1"));
    }

    @Test
    @DisplayName("Invalid section fails the whole report")
    void invalidSection() {
        ReportValidationException e = assertThrows(ReportValidationException.class,
                () -> renderer.render(List.of(TestData.scoresSection(), TestData.invalidSection())));

        assertEquals("Broken", e.getSectionTitle());
        assertTrue(e.getMessage().contains("Weight"));
    }

    @Test
    @DisplayName("Empty table renders a placeholder")
    void emptyPlaceholder() {
        TextSectionFormatter formatter = new TextSectionFormatter(new SummaryEvaluator(new DefaultCalculationProvider()));
        StringBuilder sb = new StringBuilder();

        formatter.renderTable(sb, TabularData.empty(), true, SectionStyle.defaults(), true);

        assertEquals("[No data]\n", sb.toString());
    }
}
