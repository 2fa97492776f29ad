package com.gridfeed.core.envelope;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The GraphQL request body: mutation text plus its variables.
 */
@JsonPropertyOrder({"query", "variables"})
public record Envelope(
        @JsonProperty("query") String query,
        @JsonProperty("variables") Map<String, Object> variables
) {
    public Envelope {
        // LinkedHashMap keeps argument order and allows null variables
        variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }
}
