package com.gridfeed.core.series;

import com.gridfeed.core.PipelineEvents;
import com.gridfeed.core.model.ValueDescriptor;
import com.gridfeed.core.parse.Cells;
import com.gridfeed.core.table.TabularRecord;
import com.gridfeed.core.table.TabularSource;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Decodes wide time-series sheets (inflow, node price, cf, market prices).
 *
 * <p>The first column is the time axis and only aligns rows. Every other column is headed
 * {@code "<entity>,<scenario>"} and becomes one {@link ValueDescriptor} for that entity,
 * in column order. Cells that do not parse as numbers are dropped from their column, and a
 * column left with no values is skipped.
 */
public class WideSeriesDecoder {
    private final PipelineEvents events;

    public WideSeriesDecoder(PipelineEvents events) {
        this.events = events;
    }

    public Map<String, List<ValueDescriptor>> decode(TabularSource source) {
        Map<String, List<ValueDescriptor>> result = new LinkedHashMap<>();

        if (!source.present()) {
            events.sheetSkipped(source.name(), "file not found");
            return result;
        }
        if (!source.hasRows() || source.headers().size() <= 1) {
            events.sheetSkipped(source.name(), "no data columns");
            return result;
        }

        List<String> headers = source.headers();
        for (int column = 1; column < headers.size(); column++) {
            ColumnHeader header = ColumnHeader.parse(headers.get(column));
            if (header.entity().isEmpty()) {
                continue;
            }

            List<Double> values = columnValues(source.records(), column);
            if (values.isEmpty()) {
                continue;
            }

            result.computeIfAbsent(header.entity(), k -> new ArrayList<>())
                    .add(ValueDescriptor.of(header.scenario(), values));
        }

        events.sheetParsed(source.name(), result.size());
        return result;
    }

    private static List<Double> columnValues(List<TabularRecord> records, int column) {
        List<Double> values = new ArrayList<>(records.size());
        for (TabularRecord record : records) {
            OptionalDouble value = Cells.parseDecimal(record.cell(column));
            if (value.isPresent()) {
                values.add(value.getAsDouble());
            }
        }
        return values;
    }
}
