package com.gridfeed.core.model;

import java.util.Locale;
import java.util.Optional;

public enum MarketType {
    ENERGY("energy", "e"),
    RESERVE("reserve", "res", "r");

    private final String[] synonyms;

    MarketType(String... synonyms) {
        this.synonyms = synonyms;
    }

    public static Optional<MarketType> fromCode(String raw) {
        String code = raw.trim().toLowerCase(Locale.ROOT);
        for (MarketType type : values()) {
            for (String synonym : type.synonyms) {
                if (synonym.equals(code)) {
                    return Optional.of(type);
                }
            }
        }
        return Optional.empty();
    }
}
