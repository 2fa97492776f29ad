package com.gridfeed.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Process conversion kind. Sheets use numeric codes 1/2/3 or the names.
 */
public enum Conversion {
    UNIT("1", "unit", "u"),
    TRANSFER("2", "transfer", "t"),
    MARKET("3", "market", "m");

    private final String[] synonyms;

    Conversion(String... synonyms) {
        this.synonyms = synonyms;
    }

    public static Optional<Conversion> fromCode(String raw) {
        String code = raw.trim().toLowerCase(Locale.ROOT);
        for (Conversion conversion : values()) {
            for (String synonym : conversion.synonyms) {
                if (synonym.equals(code)) {
                    return Optional.of(conversion);
                }
            }
        }
        return Optional.empty();
    }
}
