package com.gridfeed.loader.cli;

import com.gridfeed.loader.workbook.OutputDirs;
import com.gridfeed.loader.workbook.WorkbookSplitter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
        name = "split",
        description = "Convert each workbook sheet into a CSV file under output/csv",
        mixinStandardHelpOptions = true
)
public class SplitCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Workbook (.xlsx)")
    private File workbook;

    @Option(names = {"--base-dir", "-b"}, description = "Directory to create output/ in (default: the workbook's directory)")
    private File baseDir;

    @Override
    public Integer call() {
        try {
            OutputDirs dirs = baseDir != null
                    ? OutputDirs.create(baseDir.toPath())
                    : OutputDirs.forWorkbook(workbook.toPath());
            List<Path> files = new WorkbookSplitter().split(workbook.toPath(), dirs.csv());
            files.forEach(f -> System.out.println("Saved: " + f));
            System.out.println("Split " + files.size() + " sheets into " + dirs.csv());
            return 0;
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            return Reporting.EXIT_FAILED;
        }
    }
}
