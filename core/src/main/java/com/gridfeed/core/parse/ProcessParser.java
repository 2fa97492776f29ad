package com.gridfeed.core.parse;

import com.gridfeed.core.PipelineEvents;
import com.gridfeed.core.SheetFormatException;
import com.gridfeed.core.model.Conversion;
import com.gridfeed.core.model.ProcessInput;
import com.gridfeed.core.table.TabularRecord;
import com.gridfeed.core.table.TabularSource;

import java.util.ArrayList;
import java.util.List;

import static com.gridfeed.core.parse.Cells.toBoolean;
import static com.gridfeed.core.parse.Cells.toDouble;

/**
 * Reads processes.csv. An unknown conversion code fails the whole sheet: there is no
 * conversion that would be safe to assume.
 */
public class ProcessParser extends SheetParser<List<ProcessInput>> {
    static final List<String> REQUIRED = List.of(
            "process",
            "is_cf_fix",
            "is_online",
            "is_res",
            "conversion",
            "eff",
            "load_min",
            "load_max",
            "start_cost",
            "min_online",
            "min_offline",
            "max_online",
            "max_offline",
            "initial_state",
            "scenario_independent_online"
    );

    public ProcessParser(PipelineEvents events) {
        super(events);
    }

    @Override
    public List<ProcessInput> parse(TabularSource source) {
        requireColumns(source, REQUIRED);

        List<ProcessInput> processes = new ArrayList<>();
        for (TabularRecord row : source.records()) {
            String name = row.get("process");
            if (name.isEmpty()) {
                continue;
            }
            processes.add(new ProcessInput(
                    name,
                    conversion(source, row),
                    toBoolean(row.get("is_cf_fix")),
                    toBoolean(row.get("is_online")),
                    toBoolean(row.get("is_res")),
                    toDouble(row.get("eff"), 1.0),
                    toDouble(row.get("load_min"), 0.0),
                    toDouble(row.get("load_max"), 1.0),
                    toDouble(row.get("start_cost"), 0.0),
                    toDouble(row.get("min_online"), 0.0),
                    toDouble(row.get("max_online"), 0.0),
                    toDouble(row.get("min_offline"), 0.0),
                    toDouble(row.get("max_offline"), 0.0),
                    toBoolean(row.get("initial_state")),
                    toBoolean(row.get("scenario_independent_online")),
                    List.of(),
                    List.of(),
                    List.of()
            ));
        }

        events.sheetParsed(source.name(), processes.size());
        return processes;
    }

    private static Conversion conversion(TabularSource source, TabularRecord row) {
        String raw = row.get("conversion");
        if (raw.isBlank()) {
            return Conversion.UNIT;
        }
        return Conversion.fromCode(raw).orElseThrow(() -> new SheetFormatException(source.name(),
                "unsupported conversion '" + raw + "' on line " + row.line()
                        + "; expected 1/2/3 or Unit/Transfer/Market"));
    }
}
