package com.reportkit.report;

import com.reportkit.core.calc.CalculationProvider;
import com.reportkit.core.calc.DefaultCalculationProvider;
import com.reportkit.core.calc.SummaryEvaluator;
import com.reportkit.core.model.Section;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Generates Markdown format reports.
 */
public class MarkdownRenderer implements Renderer {

    public static final String NAME = "markdown";

    private final ReportAssembler assembler;
    private final MarkdownSectionFormatter formatter;

    public MarkdownRenderer() {
        this(new DefaultCalculationProvider());
    }

    public MarkdownRenderer(CalculationProvider calculationProvider) {
        this(calculationProvider, new ReportAssembler());
    }

    public MarkdownRenderer(CalculationProvider calculationProvider, ReportAssembler assembler) {
        this.assembler = assembler;
        this.formatter = new MarkdownSectionFormatter(new SummaryEvaluator(calculationProvider));
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDefaultFileExtension() {
        return ".md";
    }

    @Override
    public String getContentType() {
        return "text/markdown";
    }

    @Override
    public boolean supportsFormatting() {
        return true;
    }

    public String render(List<Section> sections) {
        return assembler.assemble(sections, formatter);
    }

    @Override
    public byte[] generateReport(List<Section> sections) {
        return render(sections).getBytes(StandardCharsets.UTF_8);
    }
}
