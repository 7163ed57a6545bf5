package com.reportkit.core.parser;

import com.reportkit.core.model.TabularData;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QueryResultParserTest {

    private final QueryResultParser parser = new QueryResultParser();

    @Test
    @DisplayName("Rows are turned into columns in result order")
    void rowsToColumns() {
        TabularData data = parser.parse(
                List.of("id", "name"),
                List.of(List.of(1, "Ann"), List.of(2, "Bob")));

        assertEquals(List.of("id", "name"), data.getColumnNames());
        assertEquals(List.of("1", "2"), data.getColumn("id"));
        assertEquals(List.of("Ann", "Bob"), data.getColumn("name"));
    }

    @Test
    @DisplayName("Null and missing cells become empty strings")
    void nullsAndShortRows() {
        TabularData data = parser.parse(
                List.of("a", "b"),
                List.of(Arrays.asList(null, "x"), List.of("y")));

        assertEquals(List.of("", "y"), data.getColumn("a"));
        assertEquals(List.of("x", ""), data.getColumn("b"));
    }

    @Test
    @DisplayName("No rows keeps the columns")
    void noRows() {
        TabularData data = parser.parse(List.of("a"), List.of());

        assertEquals(List.of("a"), data.getColumnNames());
        assertEquals(0, data.getRowCount());
    }

    @Test
    @DisplayName("Repeated column names are made unique")
    void duplicateNames() {
        TabularData data = parser.parse(List.of("v", "v"), List.of(List.of("1", "2")));

        assertEquals(List.of("v", "v_2"), data.getColumnNames());
        assertEquals("2", data.getCell("v_2", 0));
    }
}
