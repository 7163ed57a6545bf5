package com.reportkit.report;

import com.reportkit.core.exception.ReportValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PdfRendererTest {

    private final PdfRenderer renderer = new PdfRenderer();

    @Test
    @DisplayName("Generates a PDF document")
    void generatesPdf() {
        byte[] pdf = renderer.generateReport(List.of(TestData.scoresSection(), TestData.pricesSection()));

        assertTrue(pdf.length > 100);
        assertEquals("%PDF-", new String(pdf, 0, 5, StandardCharsets.US_ASCII));
    }

    @Test
    @DisplayName("Renderer metadata")
    void metadata() {
        assertEquals("pdf", renderer.getName());
        assertEquals(".pdf", renderer.getDefaultFileExtension());
        assertEquals("application/pdf", renderer.getContentType());
        assertTrue(renderer.supportsFormatting());
    }

    @Test
    @DisplayName("Validation errors are raised before layout")
    void invalidSection() {
        assertThrows(ReportValidationException.class,
                () -> renderer.generateReport(TestData.invalidSection()));
    }
}
