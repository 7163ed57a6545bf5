package com.reportkit.core.parser;

import com.reportkit.core.exception.DataSourceException;
import com.reportkit.core.model.TabularData;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvDataParserTest {

    private final CsvDataParser parser = new CsvDataParser();

    @Test
    @DisplayName("Header line names the columns")
    void withHeader() {
        TabularData data = parser.parse("Item;Price\nApple;100\nPear;50\n", true, ';');

        assertEquals(List.of("Item", "Price"), data.getColumnNames());
        assertEquals(List.of("Apple", "Pear"), data.getColumn("Item"));
        assertEquals(List.of("100", "50"), data.getColumn("Price"));
    }

    @Test
    @DisplayName("Without header columns are named col0, col1, ...")
    void withoutHeader() {
        TabularData data = parser.parse("a,b,c\nd,e,f", false, ',');

        assertEquals(List.of("col0", "col1", "col2"), data.getColumnNames());
        assertEquals(2, data.getRowCount());
        assertEquals("e", data.getCell("col1", 1));
    }

    @Test
    @DisplayName("Short rows are padded, extra fields ignored, fields trimmed")
    void raggedRows() {
        TabularData data = parser.parse("A,B,C\n 1 , 2\n4,5,6,7\n", true, ',');

        assertEquals(List.of("1", "4"), data.getColumn("A"));
        assertEquals(List.of("2", "5"), data.getColumn("B"));
        assertEquals(List.of("", "6"), data.getColumn("C"));
    }

    @Test
    @DisplayName("Blank lines and CRLF line endings are handled")
    void blankLinesAndCrlf() {
        TabularData data = parser.parse("A,B\r\n\r\n1,2\r\n   \r\n3,4\r\n", true, ',');

        assertEquals(List.of("1", "3"), data.getColumn("A"));
        assertEquals(List.of("2", "4"), data.getColumn("B"));
    }

    @Test
    @DisplayName("Empty content gives empty data")
    void emptyContent() {
        assertTrue(parser.parse("", true, ',').isEmpty());
        assertTrue(parser.parse("\n\n  \n", true, ',').isEmpty());
    }

    @Test
    @DisplayName("Header only gives columns without rows")
    void headerOnly() {
        TabularData data = parser.parse("A,B", true, ',');

        assertEquals(List.of("A", "B"), data.getColumnNames());
        assertEquals(0, data.getRowCount());
    }

    @Test
    @DisplayName("Duplicate header names get a numeric suffix")
    void duplicateHeaders() {
        TabularData data = parser.parse("A,A,B,A\n1,2,3,4", true, ',');

        assertEquals(List.of("A", "A_2", "B", "A_3"), data.getColumnNames());
        assertEquals("2", data.getCell("A_2", 0));
    }

    @Test
    @DisplayName("Delimiter is matched literally")
    void literalDelimiter() {
        TabularData data = parser.parse("A|B\n1|2", true, '|');

        assertEquals(List.of("A", "B"), data.getColumnNames());
        assertEquals("2", data.getCell("B", 0));
    }

    @Test
    @DisplayName("Files are read as UTF-8")
    void parseFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("data.csv");
        Files.writeString(file, "Grad;Cena\nNiš;120\n");

        TabularData data = parser.parse(file, true, ';');

        assertEquals("Niš", data.getCell("Grad", 0));
    }

    @Test
    @DisplayName("Missing file raises DataSourceException")
    void missingFile(@TempDir Path dir) {
        assertThrows(DataSourceException.class,
                () -> parser.parse(dir.resolve("nope.csv"), true, ','));
    }
}
