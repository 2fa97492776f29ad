package com.gridfeed.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record NodeInput(
        @JsonProperty("name") String name,
        @JsonProperty("isCommodity") boolean isCommodity,
        @JsonProperty("isMarket") boolean isMarket,
        @JsonProperty("isRes") boolean isRes,
        @JsonProperty("cost") List<ValueDescriptor> cost,
        @JsonProperty("inflow") List<ValueDescriptor> inflow
) {
    public NodeInput {
        cost = List.copyOf(cost);
        inflow = List.copyOf(inflow);
    }

    public NodeInput withCost(List<ValueDescriptor> cost) {
        return new NodeInput(name, isCommodity, isMarket, isRes, cost, inflow);
    }

    public NodeInput withInflow(List<ValueDescriptor> inflow) {
        return new NodeInput(name, isCommodity, isMarket, isRes, cost, inflow);
    }
}
