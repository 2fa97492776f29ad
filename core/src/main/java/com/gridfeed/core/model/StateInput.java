package com.gridfeed.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record StateInput(
        @JsonProperty("inMax") double inMax,
        @JsonProperty("outMax") double outMax,
        @JsonProperty("stateLossProportional") double stateLossProportional,
        @JsonProperty("stateMin") double stateMin,
        @JsonProperty("stateMax") double stateMax,
        @JsonProperty("initialState") double initialState,
        @JsonProperty("isScenarioIndependent") boolean isScenarioIndependent,
        @JsonProperty("isTemp") boolean isTemp,
        @JsonProperty("tEConversion") double tEConversion,
        @JsonProperty("residualValue") double residualValue
) {
    public static final StateInput DEFAULTS =
            new StateInput(0.0, 0.0, 0.0, 0.0, 0.0, 0.0, true, false, 1.0, 0.0);
}
