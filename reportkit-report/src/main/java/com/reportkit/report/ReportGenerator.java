package com.reportkit.report;

import com.reportkit.core.calc.DefaultCalculationProvider;
import com.reportkit.core.model.Section;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Generates reports by format name and writes them to disk.
 */
public class ReportGenerator {

    private static final Logger logger = LoggerFactory.getLogger(ReportGenerator.class);

    public static final String DEFAULT_BASE_NAME = "report";

    private final RendererRegistry registry;

    public ReportGenerator() {
        this(RendererRegistry.withBuiltIns(new DefaultCalculationProvider()));
    }

    public ReportGenerator(RendererRegistry registry) {
        this.registry = registry;
    }

    public RendererRegistry getRegistry() {
        return registry;
    }

    /**
     * Generate a report in the specified format.
     */
    public byte[] generate(String format, List<Section> sections) {
        return registry.require(format).generateReport(sections);
    }

    /**
     * Write a report to {@code report<ext>} in the output directory.
     */
    public Path write(String format, List<Section> sections, Path outputDir) throws IOException {
        return write(format, sections, outputDir, DEFAULT_BASE_NAME);
    }

    /**
     * Write a report to {@code baseName<ext>} in the output directory, creating
     * the directory if needed.
     */
    public Path write(String format, List<Section> sections, Path outputDir, String baseName) throws IOException {
        Renderer renderer = registry.require(format);
        byte[] content = renderer.generateReport(sections);

        Files.createDirectories(outputDir);
        Path outputPath = outputDir.resolve(baseName + renderer.getDefaultFileExtension());
        Files.write(outputPath, content);

        logger.info("Report written to {}", outputPath.toAbsolutePath());
        return outputPath;
    }
}
