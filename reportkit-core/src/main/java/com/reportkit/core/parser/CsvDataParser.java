package com.reportkit.core.parser;

import com.reportkit.core.exception.DataSourceException;
import com.reportkit.core.model.TabularData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parser for delimiter separated text into {@link TabularData}.
 * <p>
 * Fields are split on the delimiter only, quoting is not interpreted. Blank
 * lines are dropped, lines lose trailing whitespace and fields are trimmed.
 * Rows shorter than the header are padded with empty cells, extra fields are
 * ignored.
 */
public class CsvDataParser {

    private static final Logger logger = LoggerFactory.getLogger(CsvDataParser.class);

    public static final char DEFAULT_DELIMITER = ',';

    // Any line terminator: \r\n, \n or a lone \r
    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n|\\r|\\n");

    /**
     * Parse CSV content whose first line is a header, using a comma delimiter.
     */
    public TabularData parse(String content) {
        return parse(content, true, DEFAULT_DELIMITER);
    }

    /**
     * Parse CSV content.
     *
     * @param hasHeader when false, columns are named col0, col1, ... after the
     *                  field count of the first line
     */
    public TabularData parse(String content, boolean hasHeader, char delimiter) {
        if (content == null || content.isEmpty()) {
            return TabularData.empty();
        }

        List<String> lines = new ArrayList<>();
        for (String line : LINE_BREAK.split(content, -1)) {
            String stripped = line.stripTrailing();
            if (!stripped.isBlank()) {
                lines.add(stripped);
            }
        }
        if (lines.isEmpty()) {
            return TabularData.empty();
        }

        Pattern splitter = Pattern.compile(Pattern.quote(String.valueOf(delimiter)));

        List<String> header;
        int dataStart;
        if (hasHeader) {
            header = ColumnNames.unique(splitFields(splitter, lines.get(0)));
            dataStart = 1;
        } else {
            int fieldCount = splitFields(splitter, lines.get(0)).size();
            header = new ArrayList<>(fieldCount);
            for (int i = 0; i < fieldCount; i++) {
                header.add("col" + i);
            }
            dataStart = 0;
        }

        Map<String, List<String>> columns = new LinkedHashMap<>();
        header.forEach(name -> columns.put(name, new ArrayList<>()));

        for (int i = dataStart; i < lines.size(); i++) {
            List<String> fields = splitFields(splitter, lines.get(i));
            for (int c = 0; c < header.size(); c++) {
                columns.get(header.get(c)).add(c < fields.size() ? fields.get(c) : "");
            }
        }

        logger.debug("Parsed CSV with {} columns and {} rows", header.size(), lines.size() - dataStart);
        return TabularData.of(columns);
    }

    /**
     * Read and parse a UTF-8 CSV file.
     *
     * @throws DataSourceException if the file cannot be read
     */
    public TabularData parse(Path file, boolean hasHeader, char delimiter) {
        try {
            return parse(Files.readString(file, StandardCharsets.UTF_8), hasHeader, delimiter);
        } catch (IOException e) {
            throw new DataSourceException("Failed to read CSV file: " + file, e);
        }
    }

    private List<String> splitFields(Pattern splitter, String line) {
        String[] parts = splitter.split(line, -1);
        List<String> fields = new ArrayList<>(parts.length);
        for (String part : parts) {
            fields.add(part.trim());
        }
        return fields;
    }
}
