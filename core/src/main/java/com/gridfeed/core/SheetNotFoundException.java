package com.gridfeed.core;

import java.nio.file.Path;

public class SheetNotFoundException extends SheetFormatException {
    private final Path path;

    public SheetNotFoundException(Path path) {
        super(path.getFileName().toString(), "not found at " + path);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
