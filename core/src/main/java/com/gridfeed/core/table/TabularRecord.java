package com.gridfeed.core.table;

import java.util.List;

/**
 * One data row. Cells are trimmed text; a column the row does not reach reads as blank.
 */
public record TabularRecord(long line, List<String> headers, List<String> cells) {

    public TabularRecord {
        headers = List.copyOf(headers);
        cells = List.copyOf(cells);
    }

    public String get(String column) {
        int index = headers.indexOf(column);
        return index < 0 ? "" : cell(index);
    }

    public String cell(int index) {
        if (index < 0 || index >= cells.size()) {
            return "";
        }
        String value = cells.get(index);
        return value == null ? "" : value;
    }

    public boolean isBlank(String column) {
        return get(column).isBlank();
    }
}
