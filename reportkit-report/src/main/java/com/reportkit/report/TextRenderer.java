package com.reportkit.report;

import com.reportkit.core.calc.CalculationProvider;
import com.reportkit.core.calc.DefaultCalculationProvider;
import com.reportkit.core.calc.SummaryEvaluator;
import com.reportkit.core.model.Section;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Generates plain text reports with fixed-width tables.
 */
public class TextRenderer implements Renderer {

    public static final String NAME = "txt";

    private final ReportAssembler assembler;
    private final TextSectionFormatter formatter;

    public TextRenderer() {
        this(new DefaultCalculationProvider());
    }

    public TextRenderer(CalculationProvider calculationProvider) {
        this(calculationProvider, new ReportAssembler());
    }

    public TextRenderer(CalculationProvider calculationProvider, ReportAssembler assembler) {
        this.assembler = assembler;
        this.formatter = new TextSectionFormatter(new SummaryEvaluator(calculationProvider));
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDefaultFileExtension() {
        return ".txt";
    }

    @Override
    public String getContentType() {
        return "text/plain";
    }

    @Override
    public boolean supportsFormatting() {
        return false;
    }

    /** Render sections as a string. */
    public String render(List<Section> sections) {
        return assembler.assemble(sections, formatter);
    }

    @Override
    public byte[] generateReport(List<Section> sections) {
        return render(sections).getBytes(StandardCharsets.UTF_8);
    }
}
