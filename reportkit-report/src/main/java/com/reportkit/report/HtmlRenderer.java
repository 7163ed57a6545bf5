package com.reportkit.report;

import com.reportkit.core.calc.CalculationProvider;
import com.reportkit.core.calc.DefaultCalculationProvider;
import com.reportkit.core.calc.SummaryEvaluator;
import com.reportkit.core.model.Section;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Generates self-contained HTML reports with inline styling.
 */
public class HtmlRenderer implements Renderer {

    public static final String NAME = "html";

    private final ReportAssembler assembler;
    private final HtmlSectionFormatter formatter;

    public HtmlRenderer() {
        this(new DefaultCalculationProvider());
    }

    public HtmlRenderer(CalculationProvider calculationProvider) {
        this(calculationProvider, new ReportAssembler());
    }

    public HtmlRenderer(CalculationProvider calculationProvider, ReportAssembler assembler) {
        this.assembler = assembler;
        this.formatter = new HtmlSectionFormatter(new SummaryEvaluator(calculationProvider));
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDefaultFileExtension() {
        return ".html";
    }

    @Override
    public String getContentType() {
        return "text/html";
    }

    @Override
    public boolean supportsFormatting() {
        return true;
    }

    /** Generate the HTML document as a string. */
    public String render(List<Section> sections) {
        return assembler.assemble(sections, formatter);
    }

    @Override
    public byte[] generateReport(List<Section> sections) {
        return render(sections).getBytes(StandardCharsets.UTF_8);
    }
}
