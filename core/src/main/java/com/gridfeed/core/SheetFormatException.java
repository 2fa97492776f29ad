package com.gridfeed.core;

/**
 * A mandatory sheet cannot be turned into records: a required column is missing,
 * or a cell holds a code that has no safe default.
 */
public class SheetFormatException extends RuntimeException {
    private final String sheet;

    public SheetFormatException(String sheet, String message) {
        super(sheet + ": " + message);
        this.sheet = sheet;
    }

    public String sheet() {
        return sheet;
    }
}
