package com.reportkit.cli.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration management for the ReportKit CLI.
 * <p>
 * Values come from {@code ~/.reportkit/config.yaml} and are overridden by
 * the {@code REPORTKIT_FORMAT}, {@code REPORTKIT_OUTPUT_DIR} and
 * {@code REPORTKIT_CSV_DELIMITER} environment variables.
 */
public class ReportKitConfig {

    private static final Logger logger = LoggerFactory.getLogger(ReportKitConfig.class);

    private static final String CONFIG_DIR = ".reportkit";
    private static final String CONFIG_FILE = "config.yaml";
    private static final Path DEFAULT_CONFIG_PATH = Paths.get(
            System.getProperty("user.home"), CONFIG_DIR, CONFIG_FILE
    );

    public static final String ENV_FORMAT = "REPORTKIT_FORMAT";
    public static final String ENV_OUTPUT_DIR = "REPORTKIT_OUTPUT_DIR";
    public static final String ENV_CSV_DELIMITER = "REPORTKIT_CSV_DELIMITER";

    private String format = "txt";
    private String title = "Report";
    private char csvDelimiter = ';';
    private boolean csvHasHeader = true;
    private String outputDirectory = ".";
    private int borderWidth = 0;

    /**
     * Load configuration from the default location.
     */
    public static ReportKitConfig load() {
        return load(DEFAULT_CONFIG_PATH);
    }

    /**
     * Load configuration from a specific path.
     */
    public static ReportKitConfig load(Path configPath) {
        return load(configPath, System.getenv());
    }

    static ReportKitConfig load(Path configPath, Map<String, String> environment) {
        ReportKitConfig config = new ReportKitConfig();

        if (Files.exists(configPath)) {
            try (InputStream input = Files.newInputStream(configPath)) {
                Yaml yaml = new Yaml();
                Map<String, Object> data = yaml.load(input);

                if (data != null) {
                    config.parseYaml(data);
                }
            } catch (IOException e) {
                logger.warn("Could not load config file {}: {}", configPath, e.getMessage());
            }
        }

        // Override with environment variables
        config.loadFromEnvironment(environment);

        return config;
    }

    /**
     * Save configuration to the default location.
     */
    public void save() throws IOException {
        save(DEFAULT_CONFIG_PATH);
    }

    /**
     * Save configuration to a specific path.
     */
    public void save(Path configPath) throws IOException {
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        Map<String, Object> data = new LinkedHashMap<>();

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("format", format);
        report.put("title", title);
        data.put("report", report);

        Map<String, Object> csv = new LinkedHashMap<>();
        csv.put("delimiter", String.valueOf(csvDelimiter));
        csv.put("has_header", csvHasHeader);
        data.put("csv", csv);

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("directory", outputDirectory);
        data.put("output", output);

        Map<String, Object> style = new LinkedHashMap<>();
        style.put("border_width", borderWidth);
        data.put("style", style);

        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        Yaml yaml = new Yaml(options);
        Files.writeString(configPath, yaml.dump(data));
        logger.debug("Configuration saved to {}", configPath);
    }

    /**
     * Set a value by its dotted key.
     *
     * @throws IllegalArgumentException for an unknown key or a malformed value
     */
    public void set(String key, String value) {
        switch (key.toLowerCase()) {
            case "report.format", "format" -> format = value;
            case "report.title", "title" -> title = value;
            case "csv.delimiter", "delimiter" -> csvDelimiter = toDelimiter(value);
            case "csv.has_header", "has_header" -> csvHasHeader = Boolean.parseBoolean(value);
            case "output.directory", "output_dir" -> outputDirectory = value;
            case "style.border_width", "border_width" -> {
                try {
                    borderWidth = Integer.parseInt(value.trim());
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Not a number: " + value, e);
                }
            }
            default -> throw new IllegalArgumentException("Unknown configuration key: " + key);
        }
    }

    /**
     * Read a value by its dotted key, or null for an unknown key.
     */
    public String get(String key) {
        return switch (key.toLowerCase()) {
            case "report.format", "format" -> format;
            case "report.title", "title" -> title;
            case "csv.delimiter", "delimiter" -> String.valueOf(csvDelimiter);
            case "csv.has_header", "has_header" -> String.valueOf(csvHasHeader);
            case "output.directory", "output_dir" -> outputDirectory;
            case "style.border_width", "border_width" -> String.valueOf(borderWidth);
            default -> null;
        };
    }

    @SuppressWarnings("unchecked")
    private void parseYaml(Map<String, Object> data) {
        Map<String, Object> report = (Map<String, Object>) data.get("report");
        if (report != null) {
            if (report.containsKey("format")) {
                format = String.valueOf(report.get("format"));
            }
            if (report.containsKey("title")) {
                title = String.valueOf(report.get("title"));
            }
        }

        Map<String, Object> csv = (Map<String, Object>) data.get("csv");
        if (csv != null) {
            if (csv.containsKey("delimiter")) {
                csvDelimiter = toDelimiter(String.valueOf(csv.get("delimiter")));
            }
            if (csv.containsKey("has_header")) {
                csvHasHeader = Boolean.parseBoolean(String.valueOf(csv.get("has_header")));
            }
        }

        Map<String, Object> output = (Map<String, Object>) data.get("output");
        if (output != null && output.containsKey("directory")) {
            outputDirectory = String.valueOf(output.get("directory"));
        }

        Map<String, Object> style = (Map<String, Object>) data.get("style");
        if (style != null && style.get("border_width") instanceof Number) {
            borderWidth = ((Number) style.get("border_width")).intValue();
        }
    }

    private void loadFromEnvironment(Map<String, String> environment) {
        String envFormat = environment.get(ENV_FORMAT);
        if (envFormat != null && !envFormat.isEmpty()) {
            format = envFormat;
        }

        String envOutputDir = environment.get(ENV_OUTPUT_DIR);
        if (envOutputDir != null && !envOutputDir.isEmpty()) {
            outputDirectory = envOutputDir;
        }

        String envDelimiter = environment.get(ENV_CSV_DELIMITER);
        if (envDelimiter != null && !envDelimiter.isEmpty()) {
            csvDelimiter = toDelimiter(envDelimiter);
        }
    }

    /**
     * First character of the value; "\t" and "tab" mean a tab.
     */
    public static char toDelimiter(String value) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("Delimiter must not be empty");
        }
        if (value.equals("\\t") || value.equalsIgnoreCase("tab")) {
            return '\t';
        }
        return value.charAt(0);
    }

    // Getters and setters

    public String getFormat() {
        return format;
    }

    public void setFormat(String format) {
        this.format = format;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public char getCsvDelimiter() {
        return csvDelimiter;
    }

    public void setCsvDelimiter(char csvDelimiter) {
        this.csvDelimiter = csvDelimiter;
    }

    public boolean isCsvHasHeader() {
        return csvHasHeader;
    }

    public void setCsvHasHeader(boolean csvHasHeader) {
        this.csvHasHeader = csvHasHeader;
    }

    public String getOutputDirectory() {
        return outputDirectory;
    }

    public void setOutputDirectory(String outputDirectory) {
        this.outputDirectory = outputDirectory;
    }

    public int getBorderWidth() {
        return borderWidth;
    }

    public void setBorderWidth(int borderWidth) {
        this.borderWidth = borderWidth;
    }

    public static Path getDefaultConfigPath() {
        return DEFAULT_CONFIG_PATH;
    }
}
