package com.gridfeed.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record NodeMembership(
        @JsonProperty("nodeName") String nodeName,
        @JsonProperty("groupName") String groupName
) {}
