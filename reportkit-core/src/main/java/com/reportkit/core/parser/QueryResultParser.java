package com.reportkit.core.parser;

import com.reportkit.core.model.TabularData;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts a row-oriented query result into column-oriented {@link TabularData}.
 */
public class QueryResultParser {

    /**
     * One column per name in {@code columns}, filled row by row. Null cells
     * and cells missing from short rows become empty strings. Repeated column
     * names are suffixed with _2, _3, ...
     */
    public TabularData parse(List<String> columns, List<? extends List<?>> rows) {
        List<String> names = ColumnNames.unique(columns);
        List<List<String>> cells = new ArrayList<>(names.size());
        for (int c = 0; c < names.size(); c++) {
            cells.add(new ArrayList<>(rows.size()));
        }

        for (List<?> row : rows) {
            for (int c = 0; c < names.size(); c++) {
                Object cell = row != null && c < row.size() ? row.get(c) : null;
                cells.get(c).add(cell != null ? String.valueOf(cell) : "");
            }
        }

        TabularData.Builder builder = TabularData.builder();
        for (int c = 0; c < names.size(); c++) {
            builder.column(names.get(c), cells.get(c));
        }
        return builder.build();
    }
}
