package com.gridfeed.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ProcessMembership(
        @JsonProperty("processName") String processName,
        @JsonProperty("groupName") String groupName
) {}
