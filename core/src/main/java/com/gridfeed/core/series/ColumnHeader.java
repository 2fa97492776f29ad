package com.gridfeed.core.series;

import java.util.Locale;

/**
 * A wide time-series column header, {@code "<entity>,<scenario>"} or just {@code "<entity>"}.
 * The scenario is {@code null} when it is missing or {@code ALL}.
 */
public record ColumnHeader(String entity, String scenario) {
    public static final String ALL_SCENARIOS = "ALL";

    public static ColumnHeader parse(String header) {
        String text = header == null ? "" : header.trim();
        int comma = text.indexOf(',');
        if (comma < 0) {
            return new ColumnHeader(text, null);
        }
        String entity = text.substring(0, comma).trim();
        String scenario = text.substring(comma + 1).trim();
        if (scenario.toUpperCase(Locale.ROOT).equals(ALL_SCENARIOS)) {
            scenario = null;
        }
        return new ColumnHeader(entity, scenario);
    }
}
