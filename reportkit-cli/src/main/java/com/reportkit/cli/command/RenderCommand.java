package com.reportkit.cli.command;

import com.reportkit.cli.config.ReportKitConfig;
import com.reportkit.core.calc.DefaultCalculationProvider;
import com.reportkit.core.exception.DataSourceException;
import com.reportkit.core.exception.ReportKitException;
import com.reportkit.core.exception.ReportValidationException;
import com.reportkit.core.model.CalculatedColumn;
import com.reportkit.core.model.ColumnCalcType;
import com.reportkit.core.model.Section;
import com.reportkit.core.model.SectionStyle;
import com.reportkit.core.model.SummaryItem;
import com.reportkit.core.model.TabularData;
import com.reportkit.core.parser.CsvDataParser;
import com.reportkit.report.Renderer;
import com.reportkit.report.RendererRegistry;
import com.reportkit.report.ReportGenerator;
import com.reportkit.sql.SqlDataSource;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Unmatched;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Render a CSV file or a query result into a report file.
 * <p>
 * Paired switches such as {@code --with-header}/{@code --no-header} may be
 * repeated; the last one given wins.
 */
@Command(
        name = "render",
        description = "Render tabular data into a report (txt, markdown, html, pdf, json)",
        footer = "%nSummary lines and calculated columns are only added when requested with "
                + "--sum/--avg/--min/--max/--count/--countif/--manual and --calc-column."
)
public class RenderCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", description = "Output format (default from config: txt)")
    private String format;

    @Parameters(index = "1", arity = "0..1", description = "CSV file or classpath resource", defaultValue = "data.csv")
    private String source;

    @Option(names = {"--jdbc-url"}, description = "Read data from this JDBC URL instead of a CSV file")
    private String jdbcUrl;

    @Option(names = {"--query", "-q"}, description = "SQL query to run with --jdbc-url")
    private String query;

    @Option(names = {"--title", "-t"}, description = "Section title")
    private String title;

    @Option(names = {"--delimiter", "-d"}, description = "CSV field delimiter (default from config: ;)")
    private String delimiter;

    @Option(names = {"--no-csv-header"}, description = "The first CSV line is data, not column names")
    private boolean noCsvHeader;

    @Option(names = {"--output-dir", "-o"}, description = "Directory for the report file")
    private String outputDir;

    @Option(names = {"--config-file"}, hidden = true, description = "Configuration file to read")
    private Path configFile;

    @Unmatched
    private List<String> unmatched = new ArrayList<>();

    private boolean showHeader = true;
    private boolean showRowNumbers = true;
    private boolean includeSummary = true;
    private boolean includeCalculated = true;
    private boolean titleBold = true;
    private boolean titleItalic = true;
    private boolean underline = false;
    private boolean headerBold = false;
    private Integer borderWidth;

    private final List<SummaryItem> summaryItems = new ArrayList<>();
    private final List<CalculatedColumn> calculatedColumns = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    @Option(names = "--with-header", description = "Show the table header (default)")
    void withHeader(boolean value) {
        if (value) {
            showHeader = true;
        }
    }

    @Option(names = "--no-header", description = "Hide the table header")
    void noHeader(boolean value) {
        if (value) {
            showHeader = false;
        }
    }

    @Option(names = "--with-rownums", description = "Show row numbers (default)")
    void withRowNumbers(boolean value) {
        if (value) {
            showRowNumbers = true;
        }
    }

    @Option(names = "--no-rownums", description = "Hide row numbers")
    void noRowNumbers(boolean value) {
        if (value) {
            showRowNumbers = false;
        }
    }

    @Option(names = "--with-summary", description = "Render the summary items given with --sum, --avg, --min, --max, --count, --countif and --manual (default)")
    void withSummary(boolean value) {
        if (value) {
            includeSummary = true;
        }
    }

    @Option(names = "--no-summary", description = "Leave out summary items")
    void noSummary(boolean value) {
        if (value) {
            includeSummary = false;
        }
    }

    @Option(names = {"--calc", "--with-calculated"}, description = "Apply the calculated columns given with --calc-column (default)")
    void withCalculated(boolean value) {
        if (value) {
            includeCalculated = true;
        }
    }

    @Option(names = "--no-calc", description = "Ignore calculated columns")
    void noCalculated(boolean value) {
        if (value) {
            includeCalculated = false;
        }
    }

    @Option(names = "--bold", description = "Bold title (default)")
    void bold(boolean value) {
        if (value) {
            titleBold = true;
        }
    }

    @Option(names = "--no-bold", description = "Regular weight title")
    void noBold(boolean value) {
        if (value) {
            titleBold = false;
        }
    }

    @Option(names = "--italic", description = "Italic title (default)")
    void italic(boolean value) {
        if (value) {
            titleItalic = true;
        }
    }

    @Option(names = "--no-italic", description = "Upright title")
    void noItalic(boolean value) {
        if (value) {
            titleItalic = false;
        }
    }

    @Option(names = "--underline", description = "Underline title and header")
    void underline(boolean value) {
        if (value) {
            underline = true;
        }
    }

    @Option(names = "--no-underline", description = "No underline (default)")
    void noUnderline(boolean value) {
        if (value) {
            underline = false;
        }
    }

    @Option(names = "--header-bold", description = "Bold table header")
    void headerBold(boolean value) {
        if (value) {
            headerBold = true;
        }
    }

    @Option(names = "--border", paramLabel = "WIDTH", description = "Table border width in pixels")
    void border(String value) {
        if (value == null) {
            return;
        }
        try {
            borderWidth = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            warnings.add("Invalid border width '" + value + "', using 0");
            borderWidth = 0;
        }
    }

    @Option(names = "--sum", paramLabel = "COLUMN", description = "Add a SUM summary for a column")
    void sum(String column) {
        if (column == null) {
            return;
        }
        summaryItems.add(SummaryItem.sum("SUM " + column, column));
    }

    @Option(names = "--avg", paramLabel = "COLUMN", description = "Add an AVG summary for a column")
    void average(String column) {
        if (column == null) {
            return;
        }
        summaryItems.add(SummaryItem.average("AVG " + column, column));
    }

    @Option(names = "--min", paramLabel = "COLUMN", description = "Add a MIN summary for a column")
    void min(String column) {
        if (column == null) {
            return;
        }
        summaryItems.add(SummaryItem.min("MIN " + column, column));
    }

    @Option(names = "--max", paramLabel = "COLUMN", description = "Add a MAX summary for a column")
    void max(String column) {
        if (column == null) {
            return;
        }
        summaryItems.add(SummaryItem.max("MAX " + column, column));
    }

    @Option(names = "--count", paramLabel = "COLUMN", description = "Add a COUNT summary for a column")
    void count(String column) {
        if (column == null) {
            return;
        }
        summaryItems.add(SummaryItem.count("COUNT " + column, column));
    }

    @Option(names = "--countif", paramLabel = "COLUMN:VALUE", description = "Count cells equal to VALUE")
    void countIf(String spec) {
        if (spec == null) {
            return;
        }
        String[] parts = spec.split(":", 2);
        if (parts.length != 2) {
            warnings.add("Invalid --countif '" + spec + "', expected --countif=Column:Value");
            return;
        }
        summaryItems.add(SummaryItem.countIf("COUNT_IF " + parts[0] + " == " + parts[1], parts[0], parts[1]));
    }

    @Option(names = "--manual", paramLabel = "LABEL:TEXT", description = "Add a fixed text summary line")
    void manual(String spec) {
        if (spec == null) {
            return;
        }
        String[] parts = spec.split(":", 2);
        if (parts.length != 2) {
            warnings.add("Invalid --manual '" + spec + "', expected --manual=Label:Text");
            return;
        }
        summaryItems.add(SummaryItem.manual(parts[0], parts[1]));
    }

    @Option(names = "--calc-column", paramLabel = "NAME=OP:A,B", description = "Add a calculated column, e.g. Total=MULTIPLY:Price,Qty")
    void calcColumn(String spec) {
        if (spec == null) {
            return;
        }
        Optional<CalculatedColumn> column = parseCalculatedColumn(spec);
        if (column.isPresent()) {
            calculatedColumns.add(column.get());
        } else {
            warnings.add("Invalid --calc-column '" + spec + "', expected --calc-column=Name=OP:A,B");
        }
    }

    @Override
    public Integer call() {
        ReportKitConfig config = configFile != null ? ReportKitConfig.load(configFile) : ReportKitConfig.load();

        for (String arg : unmatched) {
            warnings.add("Unknown option '" + arg + "' ignored");
        }

        String desiredFormat = format != null ? format : config.getFormat();
        RendererRegistry registry = RendererRegistry.withBuiltIns(new DefaultCalculationProvider());
        registry.loadServiceProviders();

        Optional<Renderer> renderer = registry.find(desiredFormat);
        if (renderer.isEmpty()) {
            printWarnings();
            System.err.println("❌ Unknown format '" + desiredFormat + "'. Available: "
                    + String.join(", ", registry.getNames()));
            return 1;
        }

        TabularData data;
        try {
            data = loadData(config);
        } catch (DataSourceException | IllegalArgumentException e) {
            printWarnings();
            System.err.println("❌ " + e.getMessage());
            return 1;
        }

        if (data.isEmpty()) {
            printWarnings();
            System.err.println("❌ No data found in " + describeSource());
            return 1;
        }

        List<CalculatedColumn> columns = includeCalculated ? calculatedColumns : List.of();
        List<SummaryItem> items = includeSummary ? availableSummaryItems(data, columns) : List.of();

        SectionStyle style = SectionStyle.builder()
                .titleBold(titleBold)
                .titleItalic(titleItalic)
                .underline(underline)
                .headerBold(headerBold)
                .borderWidth(borderWidth != null ? borderWidth : config.getBorderWidth())
                .build();

        Section section = Section.builder()
                .title(title != null ? title : config.getTitle())
                .data(data)
                .summaryItems(items)
                .showRowNumbers(showRowNumbers)
                .style(style)
                .showHeader(showHeader)
                .calculatedColumns(columns)
                .build();

        printWarnings();

        Path directory = Paths.get(outputDir != null ? outputDir : config.getOutputDirectory());
        try {
            ReportGenerator generator = new ReportGenerator(registry);
            Path written = generator.write(renderer.get().getName(), List.of(section), directory);
            System.out.println("✅ Report generated (" + renderer.get().getName() + "): " + written);
            return 0;
        } catch (ReportValidationException e) {
            System.err.println("❌ " + e.getMessage());
            return 1;
        } catch (ReportKitException | IOException e) {
            System.err.println("❌ Failed to generate report: " + e.getMessage());
            return 1;
        }
    }

    private TabularData loadData(ReportKitConfig config) {
        if (jdbcUrl != null) {
            if (query == null || query.isBlank()) {
                throw new IllegalArgumentException("--jdbc-url requires --query");
            }
            try (SqlDataSource dataSource = new SqlDataSource(jdbcUrl)) {
                return dataSource.query(query);
            }
        }

        char fieldDelimiter = delimiter != null
                ? ReportKitConfig.toDelimiter(delimiter)
                : config.getCsvDelimiter();
        boolean hasHeader = !noCsvHeader && config.isCsvHasHeader();

        CsvDataParser parser = new CsvDataParser();
        Path path = Paths.get(source);
        if (Files.isRegularFile(path)) {
            return parser.parse(path, hasHeader, fieldDelimiter);
        }

        // Fall back to a classpath resource of the same name
        try (InputStream input = Thread.currentThread().getContextClassLoader().getResourceAsStream(source)) {
            if (input == null) {
                throw new DataSourceException("Data source not found: " + source);
            }
            String content = new String(input.readAllBytes(), StandardCharsets.UTF_8);
            return parser.parse(content, hasHeader, fieldDelimiter);
        } catch (IOException e) {
            throw new DataSourceException("Failed to read " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Summary items whose column exists in the data or is calculated.
     */
    private List<SummaryItem> availableSummaryItems(TabularData data, List<CalculatedColumn> columns) {
        Set<String> known = new HashSet<>(data.getColumnNames());
        for (CalculatedColumn column : columns) {
            known.add(column.getName());
        }

        List<SummaryItem> available = new ArrayList<>();
        for (SummaryItem item : summaryItems) {
            if (item.getColumnName() == null || known.contains(item.getColumnName())) {
                available.add(item);
            } else {
                warnings.add("Column '" + item.getColumnName() + "' not found, summary '"
                        + item.getLabel() + "' skipped");
            }
        }
        return available;
    }

    static Optional<CalculatedColumn> parseCalculatedColumn(String spec) {
        int eq = spec.indexOf('=');
        int colon = spec.indexOf(':', eq + 1);
        if (eq <= 0 || colon < 0) {
            return Optional.empty();
        }

        String name = spec.substring(0, eq).trim();
        String operation = spec.substring(eq + 1, colon).trim();
        String[] sources = Arrays.stream(spec.substring(colon + 1).split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toArray(String[]::new);

        if (name.isEmpty() || sources.length == 0) {
            return Optional.empty();
        }
        try {
            return Optional.of(CalculatedColumn.of(name, ColumnCalcType.fromString(operation), sources));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private String describeSource() {
        return jdbcUrl != null ? jdbcUrl : source;
    }

    private void printWarnings() {
        for (String warning : warnings) {
            System.err.println("⚠️  " + warning);
        }
        warnings.clear();
    }
}
