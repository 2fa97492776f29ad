package com.gridfeed.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * One decoded time-series unit: either a single constant or an ordered series,
 * optionally scoped to a scenario. A {@code null} scenario applies to every scenario.
 */
@JsonPropertyOrder({"scenario", "constant", "series"})
public record ValueDescriptor(
        @JsonProperty("scenario") String scenario,
        @JsonProperty("constant") @JsonInclude(JsonInclude.Include.NON_NULL) Double constant,
        @JsonProperty("series") @JsonInclude(JsonInclude.Include.NON_NULL) List<Double> series
) {
    public ValueDescriptor {
        if ((constant == null) == (series == null)) {
            throw new IllegalArgumentException("Exactly one of constant or series must be set");
        }
        if (series != null) {
            if (series.isEmpty()) {
                throw new IllegalArgumentException("Series must not be empty");
            }
            series = List.copyOf(series);
        }
    }

    public static ValueDescriptor constant(String scenario, double value) {
        return new ValueDescriptor(scenario, value, null);
    }

    public static ValueDescriptor series(String scenario, List<Double> values) {
        return new ValueDescriptor(scenario, null, values);
    }

    /**
     * Collapses to a constant when every value is identical, otherwise keeps the series.
     * Uses exact floating point equality.
     */
    public static ValueDescriptor of(String scenario, List<Double> values) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Cannot describe an empty column");
        }
        double first = values.get(0);
        for (double v : values) {
            if (v != first) {
                return series(scenario, values);
            }
        }
        return constant(scenario, first);
    }

    @JsonIgnore
    public boolean isConstant() {
        return constant != null;
    }
}
