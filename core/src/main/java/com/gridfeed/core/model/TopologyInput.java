package com.gridfeed.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A directed link between a process and a node. Exactly one of
 * {@code sourceNodeName} and {@code sinkNodeName} is set.
 */
public record TopologyInput(
        @JsonProperty("processName") String processName,
        @JsonProperty("sourceNodeName") String sourceNodeName,
        @JsonProperty("sinkNodeName") String sinkNodeName,
        @JsonProperty("topology") TopologyParams topology
) {
    public String nodeName() {
        return sourceNodeName != null ? sourceNodeName : sinkNodeName;
    }
}
