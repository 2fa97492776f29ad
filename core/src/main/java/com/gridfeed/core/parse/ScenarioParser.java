package com.gridfeed.core.parse;

import com.gridfeed.core.PipelineEvents;
import com.gridfeed.core.model.ScenarioInput;
import com.gridfeed.core.table.TabularRecord;
import com.gridfeed.core.table.TabularSource;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads scenarios.csv. The weight column is {@code probability}; workbooks in the wild also
 * spell it {@code propability}, which is accepted.
 */
public class ScenarioParser extends SheetParser<List<ScenarioInput>> {
    static final List<String> WEIGHT_COLUMNS = List.of("probability", "propability");

    public ScenarioParser(PipelineEvents events) {
        super(events);
    }

    @Override
    public List<ScenarioInput> parse(TabularSource source) {
        if (!usable(source, List.of("name"))) {
            return List.of();
        }
        String weightColumn = WEIGHT_COLUMNS.stream()
                .filter(source::hasColumn)
                .findFirst()
                .orElse(null);
        if (weightColumn == null) {
            events.sheetSkipped(source.name(),
                    "missing column probability/propability, available columns: " + source.headers());
            return List.of();
        }

        List<ScenarioInput> scenarios = new ArrayList<>();
        for (TabularRecord row : source.records()) {
            String name = row.get("name");
            if (name.isEmpty()) {
                continue;
            }
            scenarios.add(new ScenarioInput(name, Cells.toDouble(row.get(weightColumn), 0.0)));
        }

        events.sheetParsed(source.name(), scenarios.size());
        return scenarios;
    }
}
