package com.reportkit.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.reportkit.core.calc.CalculationProvider;
import com.reportkit.core.calc.DefaultCalculationProvider;
import com.reportkit.core.calc.SummaryEvaluator;
import com.reportkit.core.exception.ReportRenderingException;
import com.reportkit.core.model.Section;
import com.reportkit.core.model.SummaryItem;
import com.reportkit.core.model.TabularData;
import com.reportkit.report.model.JsonReport;
import com.reportkit.report.model.JsonSection;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Generates JSON format reports for programmatic consumption.
 * Styles are ignored; cells are serialized as strings.
 */
public class JsonRenderer implements Renderer {

    public static final String NAME = "json";

    private final ObjectMapper objectMapper;
    private final ReportAssembler assembler;
    private final SummaryEvaluator summaryEvaluator;
    private final Clock clock;

    public JsonRenderer() {
        this(new DefaultCalculationProvider());
    }

    public JsonRenderer(CalculationProvider calculationProvider) {
        this(calculationProvider, new ReportAssembler(), Clock.systemUTC());
    }

    public JsonRenderer(CalculationProvider calculationProvider, ReportAssembler assembler, Clock clock) {
        this.assembler = assembler;
        this.summaryEvaluator = new SummaryEvaluator(calculationProvider);
        this.clock = clock;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDefaultFileExtension() {
        return ".json";
    }

    @Override
    public String getContentType() {
        return "application/json";
    }

    @Override
    public boolean supportsFormatting() {
        return false;
    }

    /**
     * Build the report document without serializing it.
     */
    public JsonReport toDocument(List<Section> sections) {
        List<PreparedSection> prepared = assembler.prepareAll(sections);

        List<JsonSection> jsonSections = new ArrayList<>(prepared.size());
        for (PreparedSection p : prepared) {
            jsonSections.add(toJsonSection(p.getSection(), p.getData()));
        }
        return new JsonReport(clock.instant(), jsonSections);
    }

    public String render(List<Section> sections) {
        JsonReport document = toDocument(sections);
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new ReportRenderingException("Failed to serialize report to JSON", e);
        }
    }

    @Override
    public byte[] generateReport(List<Section> sections) {
        return render(sections).getBytes(StandardCharsets.UTF_8);
    }

    private JsonSection toJsonSection(Section section, TabularData data) {
        JsonSection.Builder builder = JsonSection.builder()
                .title(section.getTitle())
                .columns(data.getColumnNames());

        for (int row = 0; row < data.getRowCount(); row++) {
            Map<String, String> cells = new LinkedHashMap<>();
            for (String column : data.getColumnNames()) {
                String cell = data.getCell(column, row);
                cells.put(column, cell != null ? cell : "");
            }
            builder.row(section.isShowRowNumbers() ? row + 1 : null, cells);
        }

        for (SummaryItem item : section.getSummaryItems()) {
            builder.summary(item.getLabel(), summaryEvaluator.evaluate(item, data));
        }
        return builder.build();
    }
}
