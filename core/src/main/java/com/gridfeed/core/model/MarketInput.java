package com.gridfeed.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record MarketInput(
        @JsonProperty("name") String name,
        @JsonProperty("mType") MarketType mType,
        @JsonProperty("node") String node,
        @JsonProperty("processGroup") String processGroup,
        @JsonProperty("direction") MarketDirection direction,
        @JsonProperty("realisation") List<ValueDescriptor> realisation,
        @JsonProperty("reserveType") String reserveType,
        @JsonProperty("isBid") boolean isBid,
        @JsonProperty("isLimited") boolean isLimited,
        @JsonProperty("minBid") double minBid,
        @JsonProperty("maxBid") double maxBid,
        @JsonProperty("fee") double fee,
        @JsonProperty("price") List<ValueDescriptor> price,
        @JsonProperty("upPrice") List<ValueDescriptor> upPrice,
        @JsonProperty("downPrice") List<ValueDescriptor> downPrice,
        @JsonProperty("reserveActivationPrice") List<ValueDescriptor> reserveActivationPrice
) {
    public MarketInput {
        realisation = List.copyOf(realisation);
        price = List.copyOf(price);
        upPrice = List.copyOf(upPrice);
        downPrice = List.copyOf(downPrice);
        reserveActivationPrice = List.copyOf(reserveActivationPrice);
    }

    public MarketInput withPrice(List<ValueDescriptor> price) {
        return new MarketInput(name, mType, node, processGroup, direction, realisation, reserveType,
                isBid, isLimited, minBid, maxBid, fee, price, upPrice, downPrice, reserveActivationPrice);
    }
}
