package com.reportkit.cli.command;

import com.reportkit.cli.config.ReportKitConfig;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Manage ReportKit configuration.
 */
@Command(
        name = "config",
        description = "Manage ReportKit configuration"
)
public class ConfigCommand implements Callable<Integer> {

    private static final String VALID_KEYS =
            "report.format, report.title, csv.delimiter, csv.has_header, output.directory, style.border_width";

    @Parameters(index = "0", description = "Key to get (e.g., report.format)", arity = "0..1")
    private String key;

    @Option(names = {"--set", "-s"},
            description = "Set a configuration value (e.g., --set report.format=html)")
    private String setValue;

    @Option(names = {"--list", "-l"},
            description = "List all configuration values")
    private boolean list;

    @Option(names = {"--init"},
            description = "Initialize configuration with defaults")
    private boolean init;

    @Option(names = {"--config-file"}, hidden = true, description = "Configuration file to use")
    private Path configFile;

    @Override
    public Integer call() {
        Path path = configFile != null ? configFile : ReportKitConfig.getDefaultConfigPath();
        ReportKitConfig config = ReportKitConfig.load(path);

        if (init) {
            return initConfig(path);
        }

        if (list) {
            return listConfig(config, path);
        }

        if (setValue != null) {
            return setConfigValue(config, path, setValue);
        }

        if (key != null) {
            return getConfigValue(config, key);
        }

        // Default: show current config
        return listConfig(config, path);
    }

    private Integer initConfig(Path path) {
        ReportKitConfig config = new ReportKitConfig();

        try {
            config.save(path);
            System.out.println("✅ Configuration initialized at: " + path);
            return 0;
        } catch (IOException e) {
            System.err.println("❌ Failed to initialize config: " + e.getMessage());
            return 1;
        }
    }

    private Integer listConfig(ReportKitConfig config, Path path) {
        System.out.println();
        System.out.println("📁 Config File: " + path);
        System.out.println();

        System.out.println("Report:");
        System.out.printf("  format:     %s%n", config.getFormat());
        System.out.printf("  title:      %s%n", config.getTitle());
        System.out.println();

        System.out.println("CSV:");
        System.out.printf("  delimiter:  %s%n", config.getCsvDelimiter() == '\t' ? "\\t" : String.valueOf(config.getCsvDelimiter()));
        System.out.printf("  has_header: %s%n", config.isCsvHasHeader());
        System.out.println();

        System.out.println("Output:");
        System.out.printf("  directory:  %s%n", config.getOutputDirectory());
        System.out.println();

        System.out.println("Style:");
        System.out.printf("  border:     %d px%n", config.getBorderWidth());
        System.out.println();

        System.out.println("Environment Variables:");
        printEnv(ReportKitConfig.ENV_FORMAT);
        printEnv(ReportKitConfig.ENV_OUTPUT_DIR);
        printEnv(ReportKitConfig.ENV_CSV_DELIMITER);
        System.out.println();

        return 0;
    }

    private void printEnv(String name) {
        String value = System.getenv(name);
        System.out.printf("  %-24s %s%n", name + ":", value != null ? value : "(not set)");
    }

    private Integer setConfigValue(ReportKitConfig config, Path path, String keyValue) {
        String[] parts = keyValue.split("=", 2);
        if (parts.length != 2) {
            System.err.println("❌ Invalid format. Use: --set key=value");
            return 1;
        }

        String k = parts[0].trim();
        String v = parts[1].trim();

        try {
            config.set(k, v);
        } catch (IllegalArgumentException e) {
            System.err.println("❌ " + e.getMessage());
            System.err.println("   Valid keys: " + VALID_KEYS);
            return 1;
        }

        try {
            config.save(path);
            System.out.println("✅ Configuration updated: " + k + " = " + v);
            return 0;
        } catch (IOException e) {
            System.err.println("❌ Failed to save config: " + e.getMessage());
            return 1;
        }
    }

    private Integer getConfigValue(ReportKitConfig config, String key) {
        String value = config.get(key);

        if (value == null) {
            System.err.println("❌ Unknown configuration key: " + key);
            return 1;
        }

        System.out.println(value);
        return 0;
    }
}
