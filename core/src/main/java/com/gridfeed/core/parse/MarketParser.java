package com.gridfeed.core.parse;

import com.gridfeed.core.PipelineEvents;
import com.gridfeed.core.model.MarketDirection;
import com.gridfeed.core.model.MarketInput;
import com.gridfeed.core.model.MarketType;
import com.gridfeed.core.model.ValueDescriptor;
import com.gridfeed.core.table.TabularRecord;
import com.gridfeed.core.table.TabularSource;

import java.util.ArrayList;
import java.util.List;

import static com.gridfeed.core.parse.Cells.textOrNull;
import static com.gridfeed.core.parse.Cells.toBoolean;
import static com.gridfeed.core.parse.Cells.toDouble;

/**
 * Reads markets.csv. Unknown market types fall back to {@link MarketType#ENERGY} and unknown
 * directions to none, each with a warning. Only {@code price} is later filled from
 * market_prices.csv; the other price series stay empty.
 */
public class MarketParser extends SheetParser<List<MarketInput>> {
    static final List<String> REQUIRED = List.of(
            "market",
            "market_type",
            "node",
            "processgroup",
            "direction",
            "realisation",
            "reserve_type",
            "is_bid",
            "is_limited",
            "min_bid",
            "max_bid",
            "fee"
    );

    public MarketParser(PipelineEvents events) {
        super(events);
    }

    @Override
    public List<MarketInput> parse(TabularSource source) {
        requireColumns(source, REQUIRED);
        if (!source.hasRows()) {
            events.sheetSkipped(source.name(), "no data rows");
            return List.of();
        }
        String nodeColumn = source.hasColumn("market_node") ? "market_node" : "node";

        List<MarketInput> markets = new ArrayList<>();
        for (TabularRecord row : source.records()) {
            String name = row.get("market");
            if (name.isEmpty()) {
                continue;
            }
            markets.add(new MarketInput(
                    name,
                    marketType(source, row),
                    row.get(nodeColumn),
                    row.get("processgroup"),
                    direction(source, row),
                    realisation(row.get("realisation")),
                    textOrNull(row.get("reserve_type")),
                    toBoolean(row.get("is_bid")),
                    toBoolean(row.get("is_limited")),
                    toDouble(row.get("min_bid"), 0.0),
                    toDouble(row.get("max_bid"), 0.0),
                    toDouble(row.get("fee"), 0.0),
                    List.of(),
                    List.of(),
                    List.of(),
                    List.of()
            ));
        }

        events.sheetParsed(source.name(), markets.size());
        return markets;
    }

    private MarketType marketType(TabularSource source, TabularRecord row) {
        String raw = row.get("market_type");
        if (raw.isBlank()) {
            return MarketType.ENERGY;
        }
        return MarketType.fromCode(raw).orElseGet(() -> {
            events.codeDefaulted(source.name(), row.line(), "market_type", raw, MarketType.ENERGY.name());
            return MarketType.ENERGY;
        });
    }

    private MarketDirection direction(TabularSource source, TabularRecord row) {
        String raw = row.get("direction");
        if (raw.isBlank()) {
            return null;
        }
        return MarketDirection.fromCode(raw).orElseGet(() -> {
            events.codeDefaulted(source.name(), row.line(), "direction", raw, "none");
            return null;
        });
    }

    /**
     * A number in the realisation cell applies to every scenario.
     */
    private static List<ValueDescriptor> realisation(String raw) {
        if (raw.isBlank()) {
            return List.of();
        }
        return List.of(ValueDescriptor.constant(null, toDouble(raw, 0.0)));
    }
}
