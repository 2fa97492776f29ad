package com.gridfeed.core.parse;

import java.util.Locale;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Cell coercion shared by every sheet parser.
 */
public final class Cells {
    private static final Set<String> TRUE_VALUES = Set.of("1", "true", "yes", "y", "t");
    private static final Set<String> FALSE_VALUES = Set.of("0", "false", "no", "n", "f", "");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private Cells() {}

    /**
     * 1/0, true/false, yes/no, y/n and t/f in any case; blank is false. Other numbers are
     * true when their integer part is non-zero, and any other non-blank text is true.
     */
    public static boolean toBoolean(String raw) {
        if (raw == null) {
            return false;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        if (TRUE_VALUES.contains(value)) {
            return true;
        }
        if (FALSE_VALUES.contains(value)) {
            return false;
        }
        OptionalDouble number = parseDecimal(value);
        if (number.isPresent()) {
            return (long) number.getAsDouble() != 0;
        }
        return true;
    }

    /**
     * Blank or unparsable text gives {@code fallback}. Decimal commas are accepted.
     */
    public static double toDouble(String raw, double fallback) {
        return parseDecimal(raw).orElse(fallback);
    }

    /**
     * Parses a decimal written with either '.' or ',' as separator. Empty when the text is
     * blank, not a plain decimal number, or not finite.
     */
    public static OptionalDouble parseDecimal(String raw) {
        if (raw == null) {
            return OptionalDouble.empty();
        }
        String value = raw.trim().replace(',', '.');
        if (value.isEmpty() || !DECIMAL.matcher(value).matches()) {
            return OptionalDouble.empty();
        }
        double parsed = Double.parseDouble(value);
        return Double.isFinite(parsed) ? OptionalDouble.of(parsed) : OptionalDouble.empty();
    }

    /**
     * Blank cells become {@code null}.
     */
    public static String textOrNull(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return raw.trim();
    }
}
