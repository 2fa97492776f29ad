package com.gridfeed.core.envelope;

/**
 * File names derived from entity names.
 */
public final class FileNames {
    public static final String FALLBACK = "unnamed";

    private FileNames() {}

    /**
     * Keeps letters, digits, space, '_' and '-', trims, falls back to {@value #FALLBACK}
     * when nothing is left, and turns spaces into underscores.
     */
    public static String sanitize(String name) {
        StringBuilder kept = new StringBuilder();
        if (name != null) {
            for (char c : name.toCharArray()) {
                if (Character.isLetterOrDigit(c) || c == ' ' || c == '_' || c == '-') {
                    kept.append(c);
                }
            }
        }
        String trimmed = kept.toString().trim();
        if (trimmed.isEmpty()) {
            trimmed = FALLBACK;
        }
        return trimmed.replace(' ', '_');
    }
}
