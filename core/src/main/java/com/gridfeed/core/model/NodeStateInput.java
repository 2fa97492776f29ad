package com.gridfeed.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record NodeStateInput(
        @JsonProperty("nodeName") String nodeName,
        @JsonProperty("state") StateInput state
) {}
