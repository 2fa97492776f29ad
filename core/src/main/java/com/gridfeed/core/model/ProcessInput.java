package com.gridfeed.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ProcessInput(
        @JsonProperty("name") String name,
        @JsonProperty("conversion") Conversion conversion,
        @JsonProperty("isCfFix") boolean isCfFix,
        @JsonProperty("isOnline") boolean isOnline,
        @JsonProperty("isRes") boolean isRes,
        @JsonProperty("eff") double eff,
        @JsonProperty("loadMin") double loadMin,
        @JsonProperty("loadMax") double loadMax,
        @JsonProperty("startCost") double startCost,
        @JsonProperty("minOnline") double minOnline,
        @JsonProperty("maxOnline") double maxOnline,
        @JsonProperty("minOffline") double minOffline,
        @JsonProperty("maxOffline") double maxOffline,
        @JsonProperty("initialState") boolean initialState,
        @JsonProperty("isScenarioIndependent") boolean isScenarioIndependent,
        @JsonProperty("cf") List<ValueDescriptor> cf,
        @JsonProperty("effTs") List<ValueDescriptor> effTs,
        @JsonProperty("effOpsFun") List<ValueDescriptor> effOpsFun
) {
    public ProcessInput {
        cf = List.copyOf(cf);
        effTs = List.copyOf(effTs);
        effOpsFun = List.copyOf(effOpsFun);
    }

    public ProcessInput withCf(List<ValueDescriptor> cf) {
        return new ProcessInput(name, conversion, isCfFix, isOnline, isRes, eff, loadMin, loadMax,
                startCost, minOnline, maxOnline, minOffline, maxOffline, initialState,
                isScenarioIndependent, cf, effTs, effOpsFun);
    }
}
