package com.gridfeed.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Global model setup. Parameters missing from the setup sheet stay {@code null}
 * and are left out of the serialized input.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SetupInput(
        @JsonProperty("useMarketBids") Boolean useMarketBids,
        @JsonProperty("useReserves") Boolean useReserves,
        @JsonProperty("useReserveRealisation") Boolean useReserveRealisation,
        @JsonProperty("useNodeDummyVariables") Boolean useNodeDummyVariables,
        @JsonProperty("useRampDummyVariables") Boolean useRampDummyVariables,
        @JsonProperty("commonTimesteps") Integer commonTimesteps,
        @JsonProperty("commonScenarioName") String commonScenarioName,
        @JsonProperty("nodeDummyVariableCost") Double nodeDummyVariableCost,
        @JsonProperty("rampDummyVariableCost") Double rampDummyVariableCost
) {
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Boolean useMarketBids;
        private Boolean useReserves;
        private Boolean useReserveRealisation;
        private Boolean useNodeDummyVariables;
        private Boolean useRampDummyVariables;
        private Integer commonTimesteps;
        private String commonScenarioName;
        private Double nodeDummyVariableCost;
        private Double rampDummyVariableCost;

        public Builder useMarketBids(Boolean useMarketBids) {
            this.useMarketBids = useMarketBids;
            return this;
        }

        public Builder useReserves(Boolean useReserves) {
            this.useReserves = useReserves;
            return this;
        }

        public Builder useReserveRealisation(Boolean useReserveRealisation) {
            this.useReserveRealisation = useReserveRealisation;
            return this;
        }

        public Builder useNodeDummyVariables(Boolean useNodeDummyVariables) {
            this.useNodeDummyVariables = useNodeDummyVariables;
            return this;
        }

        public Builder useRampDummyVariables(Boolean useRampDummyVariables) {
            this.useRampDummyVariables = useRampDummyVariables;
            return this;
        }

        public Builder commonTimesteps(Integer commonTimesteps) {
            this.commonTimesteps = commonTimesteps;
            return this;
        }

        public Builder commonScenarioName(String commonScenarioName) {
            this.commonScenarioName = commonScenarioName;
            return this;
        }

        public Builder nodeDummyVariableCost(Double nodeDummyVariableCost) {
            this.nodeDummyVariableCost = nodeDummyVariableCost;
            return this;
        }

        public Builder rampDummyVariableCost(Double rampDummyVariableCost) {
            this.rampDummyVariableCost = rampDummyVariableCost;
            return this;
        }

        public SetupInput build() {
            return new SetupInput(
                    useMarketBids,
                    useReserves,
                    useReserveRealisation,
                    useNodeDummyVariables,
                    useRampDummyVariables,
                    commonTimesteps,
                    commonScenarioName,
                    nodeDummyVariableCost,
                    rampDummyVariableCost
            );
        }
    }
}
