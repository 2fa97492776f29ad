package com.gridfeed.core.model;

import java.util.Locale;
import java.util.Optional;

public enum MarketDirection {
    UP("up", "u"),
    DOWN("down", "d"),
    UP_DOWN("up_down", "updown", "both"),
    RES_UP("res_up", "rup", "reserve_up"),
    RES_DOWN("res_down", "rdown", "reserve_down");

    private final String[] synonyms;

    MarketDirection(String... synonyms) {
        this.synonyms = synonyms;
    }

    public static Optional<MarketDirection> fromCode(String raw) {
        String code = raw.trim().toLowerCase(Locale.ROOT);
        for (MarketDirection direction : values()) {
            for (String synonym : direction.synonyms) {
                if (synonym.equals(code)) {
                    return Optional.of(direction);
                }
            }
        }
        return Optional.empty();
    }
}
