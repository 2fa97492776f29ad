package com.gridfeed.core.parse;

import com.gridfeed.core.PipelineEvents;
import com.gridfeed.core.model.NodeStateInput;
import com.gridfeed.core.model.StateInput;
import com.gridfeed.core.table.TabularRecord;
import com.gridfeed.core.table.TabularSource;

import java.util.ArrayList;
import java.util.List;

import static com.gridfeed.core.parse.Cells.toBoolean;

/**
 * Builds storage states from nodes.csv. Only rows flagged {@code is_state} get a state;
 * without an {@code is_state} column every node does. State columns that are absent keep
 * their defaults.
 */
public class NodeStateParser extends SheetParser<List<NodeStateInput>> {

    public NodeStateParser(PipelineEvents events) {
        super(events);
    }

    @Override
    public List<NodeStateInput> parse(TabularSource source) {
        requireColumns(source, List.of("node"));
        boolean gated = source.hasColumn("is_state");

        List<NodeStateInput> states = new ArrayList<>();
        for (TabularRecord row : source.records()) {
            String name = row.get("node");
            if (name.isEmpty()) {
                continue;
            }
            if (gated && !toBoolean(row.get("is_state"))) {
                continue;
            }
            states.add(new NodeStateInput(name, state(source, row)));
        }

        events.sheetParsed(source.name() + " (states)", states.size());
        return states;
    }

    private static StateInput state(TabularSource source, TabularRecord row) {
        StateInput d = StateInput.DEFAULTS;
        return new StateInput(
                number(source, row, "in_max", d.inMax()),
                number(source, row, "out_max", d.outMax()),
                number(source, row, "state_loss_proportional", d.stateLossProportional()),
                number(source, row, "state_min", d.stateMin()),
                number(source, row, "state_max", d.stateMax()),
                number(source, row, "initial_state", d.initialState()),
                flag(source, row, "scenario_independent_state", d.isScenarioIndependent()),
                flag(source, row, "is_temp", d.isTemp()),
                number(source, row, "t_e_conversion", d.tEConversion()),
                number(source, row, "residual_value", d.residualValue())
        );
    }

    private static double number(TabularSource source, TabularRecord row, String column, double fallback) {
        return source.hasColumn(column) ? Cells.toDouble(row.get(column), fallback) : fallback;
    }

    private static boolean flag(TabularSource source, TabularRecord row, String column, boolean fallback) {
        return source.hasColumn(column) ? toBoolean(row.get(column)) : fallback;
    }
}
