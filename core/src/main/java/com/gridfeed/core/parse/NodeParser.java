package com.gridfeed.core.parse;

import com.gridfeed.core.PipelineEvents;
import com.gridfeed.core.model.NodeInput;
import com.gridfeed.core.table.TabularRecord;
import com.gridfeed.core.table.TabularSource;

import java.util.ArrayList;
import java.util.List;

import static com.gridfeed.core.parse.Cells.toBoolean;

/**
 * Reads nodes.csv. Cost and inflow start empty; they come from the price and inflow sheets.
 */
public class NodeParser extends SheetParser<List<NodeInput>> {
    static final List<String> REQUIRED = List.of("node", "is_commodity", "is_res", "is_market");

    public NodeParser(PipelineEvents events) {
        super(events);
    }

    @Override
    public List<NodeInput> parse(TabularSource source) {
        requireColumns(source, REQUIRED);

        List<NodeInput> nodes = new ArrayList<>();
        for (TabularRecord row : source.records()) {
            String name = row.get("node");
            if (name.isEmpty()) {
                continue;
            }
            nodes.add(new NodeInput(
                    name,
                    toBoolean(row.get("is_commodity")),
                    toBoolean(row.get("is_market")),
                    toBoolean(row.get("is_res")),
                    List.of(),
                    List.of()
            ));
        }

        events.sheetParsed(source.name(), nodes.size());
        return nodes;
    }
}
