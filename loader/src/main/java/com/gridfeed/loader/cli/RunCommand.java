package com.gridfeed.loader.cli;

import com.gridfeed.core.CollectingPipelineEvents;
import com.gridfeed.loader.LoaderConfig;
import com.gridfeed.loader.ModelPipeline;
import com.gridfeed.loader.PipelineResult;
import com.gridfeed.loader.workbook.OutputDirs;
import com.gridfeed.loader.workbook.WorkbookSplitter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
        name = "run",
        description = "Split, build and optionally dispatch in one step",
        mixinStandardHelpOptions = true
)
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Workbook (.xlsx)")
    private File workbook;

    @Mixin
    private ServiceOptions service;

    @Override
    public Integer call() {
        try {
            System.out.println("Step 1/2: Splitting workbook...");
            OutputDirs dirs = OutputDirs.forWorkbook(workbook.toPath());
            new WorkbookSplitter().split(workbook.toPath(), dirs.csv());

            System.out.println("Step 2/2: Building mutations...");
            LoaderConfig config = service.applyTo(LoaderConfig.builder())
                    .outputRoot(dirs.root())
                    .build();
            CollectingPipelineEvents events = new CollectingPipelineEvents();
            PipelineResult result = new ModelPipeline(config, events).run();
            return Reporting.summarize(result, events, System.out);
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            return Reporting.EXIT_FAILED;
        }
    }
}
