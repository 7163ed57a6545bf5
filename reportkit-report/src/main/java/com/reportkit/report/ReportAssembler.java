package com.reportkit.report;

import com.reportkit.core.calc.CalculatedColumnEngine;
import com.reportkit.core.exception.ReportValidationException;
import com.reportkit.core.model.Section;
import com.reportkit.core.model.TabularData;
import com.reportkit.core.validation.SectionValidator;
import com.reportkit.core.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared report orchestration for every format: applies calculated columns,
 * validates, then emits title, table and summary of each section through a
 * {@link SectionFormatter}, with a separator between sections.
 * <p>
 * All sections are prepared before any output is produced, so an invalid
 * section fails the whole report.
 */
public class ReportAssembler {

    private static final Logger logger = LoggerFactory.getLogger(ReportAssembler.class);

    private final CalculatedColumnEngine engine;
    private final SectionValidator validator;

    public ReportAssembler() {
        this(new CalculatedColumnEngine(), new SectionValidator());
    }

    public ReportAssembler(CalculatedColumnEngine engine, SectionValidator validator) {
        this.engine = engine;
        this.validator = validator;
    }

    /**
     * Apply calculated columns to a section and validate the result.
     *
     * @throws ReportValidationException if the section is invalid
     */
    public PreparedSection prepare(Section section) {
        TabularData expanded = engine.apply(section.getData(), section.getCalculatedColumns());

        ValidationResult result = validator.validate(
                expanded,
                section.getSummaryItems(),
                section.getCalculatedColumns()
        );
        if (!result.isValid()) {
            throw new ReportValidationException(section.getDisplayTitle(), result.getMessage().orElse("invalid"));
        }
        return new PreparedSection(section, expanded);
    }

    public List<PreparedSection> prepareAll(List<Section> sections) {
        List<PreparedSection> prepared = new ArrayList<>(sections.size());
        for (Section section : sections) {
            prepared.add(prepare(section));
        }
        return prepared;
    }

    /**
     * Render sections into a single document.
     */
    public String assemble(List<Section> sections, SectionFormatter formatter) {
        List<PreparedSection> prepared = prepareAll(sections);

        StringBuilder sb = new StringBuilder();
        formatter.beginDocument(sb);

        for (int i = 0; i < prepared.size(); i++) {
            if (i > 0) {
                formatter.renderSeparator(sb);
            }
            Section section = prepared.get(i).getSection();
            TabularData data = prepared.get(i).getData();

            formatter.renderTitle(sb, section.getTitle(), section.getStyle());
            formatter.renderTable(sb, data, section.isShowRowNumbers(), section.getStyle(), section.isShowHeader());
            if (!section.getSummaryItems().isEmpty()) {
                formatter.renderSummary(sb, section.getSummaryItems(), data);
            }
        }

        formatter.endDocument(sb);
        logger.debug("Assembled {} section(s) into {} characters", prepared.size(), sb.length());
        return sb.toString();
    }
}
