package com.gridfeed.core.table;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * A sheet loaded from a delimited file: its header in file order and its data rows in
 * row order. A source that was never found on disk has {@code present() == false}.
 */
public record TabularSource(Path path, boolean present, List<String> headers, List<TabularRecord> records) {

    public TabularSource {
        headers = List.copyOf(headers);
        records = List.copyOf(records);
    }

    public static TabularSource absent(Path path) {
        return new TabularSource(path, false, List.of(), List.of());
    }

    public String name() {
        return path.getFileName().toString();
    }

    public boolean hasRows() {
        return !records.isEmpty();
    }

    public boolean hasColumn(String column) {
        return headers.contains(column);
    }

    public List<String> missingColumns(Collection<String> required) {
        List<String> missing = new ArrayList<>();
        for (String column : required) {
            if (!hasColumn(column)) {
                missing.add(column);
            }
        }
        return missing;
    }
}
