package com.gridfeed.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RiskInput(
        @JsonProperty("parameter") String parameter,
        @JsonProperty("value") double value
) {}
