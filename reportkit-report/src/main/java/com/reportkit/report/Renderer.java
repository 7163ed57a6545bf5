package com.reportkit.report;

import com.reportkit.core.model.Section;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Interface for report renderers. One implementation per output format.
 */
public interface Renderer {

    /**
     * Format key used to select this renderer, e.g. "txt" or "html".
     */
    String getName();

    /**
     * File extension including the dot, e.g. ".md".
     */
    String getDefaultFileExtension();

    /**
     * MIME type of the generated bytes.
     */
    String getContentType();

    /**
     * Whether bold, italic, underline and borders have a visible effect.
     */
    boolean supportsFormatting();

    /**
     * Render all sections in order into the format's final encoding.
     *
     * @throws com.reportkit.core.exception.ReportValidationException if any section is invalid;
     *         nothing is rendered in that case
     */
    byte[] generateReport(List<Section> sections);

    /**
     * Render a single section.
     */
    default byte[] generateReport(Section section) {
        return generateReport(List.of(section));
    }

    /**
     * Render sections and write them to a file.
     */
    default void write(List<Section> sections, Path outputPath) throws IOException {
        byte[] content = generateReport(sections);
        Files.write(outputPath, content);
    }
}
