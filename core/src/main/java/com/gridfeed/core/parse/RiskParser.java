package com.gridfeed.core.parse;

import com.gridfeed.core.PipelineEvents;
import com.gridfeed.core.model.RiskInput;
import com.gridfeed.core.table.TabularRecord;
import com.gridfeed.core.table.TabularSource;

import java.util.ArrayList;
import java.util.List;

public class RiskParser extends SheetParser<List<RiskInput>> {
    static final List<String> REQUIRED = List.of("parameter", "value");

    public RiskParser(PipelineEvents events) {
        super(events);
    }

    @Override
    public List<RiskInput> parse(TabularSource source) {
        if (!usable(source, REQUIRED)) {
            return List.of();
        }

        List<RiskInput> risks = new ArrayList<>();
        for (TabularRecord row : source.records()) {
            String parameter = row.get("parameter");
            if (parameter.isEmpty()) {
                continue;
            }
            risks.add(new RiskInput(parameter, Cells.toDouble(row.get("value"), 0.0)));
        }

        events.sheetParsed(source.name(), risks.size());
        return risks;
    }
}
