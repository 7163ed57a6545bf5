package com.reportkit.report;

import com.openhtmltopdf.pdfboxout.PdfRendererBuilder;
import com.reportkit.core.calc.CalculationProvider;
import com.reportkit.core.calc.DefaultCalculationProvider;
import com.reportkit.core.exception.ReportRenderingException;
import com.reportkit.core.model.Section;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.util.List;

/**
 * Generates PDF reports by laying out the HTML rendition with openhtmltopdf.
 */
public class PdfRenderer implements Renderer {

    public static final String NAME = "pdf";

    private static final Logger logger = LoggerFactory.getLogger(PdfRenderer.class);

    private final HtmlRenderer htmlRenderer;

    public PdfRenderer() {
        this(new DefaultCalculationProvider());
    }

    public PdfRenderer(CalculationProvider calculationProvider) {
        this(new HtmlRenderer(calculationProvider));
    }

    public PdfRenderer(HtmlRenderer htmlRenderer) {
        this.htmlRenderer = htmlRenderer;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDefaultFileExtension() {
        return ".pdf";
    }

    @Override
    public String getContentType() {
        return "application/pdf";
    }

    @Override
    public boolean supportsFormatting() {
        return true;
    }

    @Override
    public byte[] generateReport(List<Section> sections) {
        // Validation errors surface here, before the PDF engine is involved
        String html = htmlRenderer.render(sections);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            PdfRendererBuilder builder = new PdfRendererBuilder();
            builder.useFastMode();
            builder.withHtmlContent(html, null);
            builder.toStream(out);
            builder.run();
        } catch (Exception e) {
            throw new ReportRenderingException("Failed to generate PDF report", e);
        }

        logger.debug("Generated PDF report of {} bytes", out.size());
        return out.toByteArray();
    }
}
