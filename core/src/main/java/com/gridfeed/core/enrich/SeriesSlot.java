package com.gridfeed.core.enrich;

import com.gridfeed.core.model.MarketInput;
import com.gridfeed.core.model.NodeInput;
import com.gridfeed.core.model.ProcessInput;
import com.gridfeed.core.model.ValueDescriptor;

import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * A series field of an entity type that one auxiliary sheet fills: how to find the
 * entity's name and how to replace the field.
 */
public record SeriesSlot<T>(
        String name,
        Function<T, String> key,
        BiFunction<T, List<ValueDescriptor>, T> replace
) {
    public static final SeriesSlot<NodeInput> NODE_COST =
            new SeriesSlot<>("node cost", NodeInput::name, NodeInput::withCost);

    public static final SeriesSlot<NodeInput> NODE_INFLOW =
            new SeriesSlot<>("node inflow", NodeInput::name, NodeInput::withInflow);

    public static final SeriesSlot<ProcessInput> PROCESS_CF =
            new SeriesSlot<>("process cf", ProcessInput::name, ProcessInput::withCf);

    public static final SeriesSlot<MarketInput> MARKET_PRICE =
            new SeriesSlot<>("market price", MarketInput::name, MarketInput::withPrice);
}
