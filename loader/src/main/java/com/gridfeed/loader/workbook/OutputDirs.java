package com.gridfeed.loader.workbook;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * The {@code output/csv} and {@code output/graphql} directories created next to a workbook.
 */
public record OutputDirs(Path root, Path csv, Path graphql) {

    public static OutputDirs create(Path baseDir) throws IOException {
        Path root = baseDir.resolve("output");
        OutputDirs dirs = new OutputDirs(root, root.resolve("csv"), root.resolve("graphql"));
        Files.createDirectories(dirs.csv());
        Files.createDirectories(dirs.graphql());
        return dirs;
    }

    public static OutputDirs forWorkbook(Path workbook) throws IOException {
        Path parent = workbook.toAbsolutePath().getParent();
        return create(parent);
    }
}
