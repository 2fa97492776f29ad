package com.gridfeed.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ScenarioInput(
        @JsonProperty("name") String name,
        @JsonProperty("weight") double weight
) {}
