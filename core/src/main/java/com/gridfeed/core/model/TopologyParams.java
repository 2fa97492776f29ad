package com.gridfeed.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record TopologyParams(
        @JsonProperty("capacity") double capacity,
        @JsonProperty("vomCost") double vomCost,
        @JsonProperty("rampUp") double rampUp,
        @JsonProperty("rampDown") double rampDown,
        @JsonProperty("initialLoad") double initialLoad,
        @JsonProperty("initialFlow") double initialFlow,
        @JsonProperty("capTs") List<ValueDescriptor> capTs
) {
    public TopologyParams {
        capTs = List.copyOf(capTs);
    }
}
