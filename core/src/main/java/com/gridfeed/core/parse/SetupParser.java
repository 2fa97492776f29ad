package com.gridfeed.core.parse;

import com.gridfeed.core.PipelineEvents;
import com.gridfeed.core.model.SetupInput;
import com.gridfeed.core.table.TabularRecord;
import com.gridfeed.core.table.TabularSource;

import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Reads the {@code parameter,value} setup sheet. Unknown parameters are ignored and blank
 * values leave the field unset.
 */
public class SetupParser extends SheetParser<SetupInput> {
    private static final List<String> REQUIRED = List.of("parameter", "value");
    private static final Set<String> TRUE_VALUES = Set.of("1", "true", "yes");

    public SetupParser(PipelineEvents events) {
        super(events);
    }

    @Override
    public SetupInput parse(TabularSource source) {
        requireColumns(source, REQUIRED);

        SetupInput.Builder setup = SetupInput.builder();
        for (TabularRecord row : source.records()) {
            String parameter = row.get("parameter");
            String value = row.get("value");
            if (value.isBlank()) {
                continue;
            }

            switch (parameter) {
                case "use_market_bids" -> setup.useMarketBids(flag(value));
                case "use_reserves" -> setup.useReserves(flag(value));
                case "use_reserve_realisation" -> setup.useReserveRealisation(flag(value));
                case "use_node_dummy_variables" -> setup.useNodeDummyVariables(flag(value));
                case "use_ramp_dummy_variables" -> setup.useRampDummyVariables(flag(value));
                case "common_start_timesteps" -> setup.commonTimesteps(integer(value));
                case "common_scenario_name" -> setup.commonScenarioName(value);
                case "node_dummy_variable_cost" -> setup.nodeDummyVariableCost(decimal(value));
                case "ramp_dummy_variable_cost" -> setup.rampDummyVariableCost(decimal(value));
                default -> {
                    // not part of the setup input
                }
            }
        }

        events.sheetParsed(source.name(), 1);
        return setup.build();
    }

    private static boolean flag(String value) {
        String v = value.toLowerCase(Locale.ROOT);
        if (TRUE_VALUES.contains(v)) {
            return true;
        }
        OptionalDouble number = Cells.parseDecimal(v);
        return number.isPresent() && (long) number.getAsDouble() != 0;
    }

    private static Integer integer(String value) {
        OptionalDouble number = Cells.parseDecimal(value);
        return number.isPresent() ? (int) number.getAsDouble() : null;
    }

    private static Double decimal(String value) {
        OptionalDouble number = Cells.parseDecimal(value);
        return number.isPresent() ? number.getAsDouble() : null;
    }
}
