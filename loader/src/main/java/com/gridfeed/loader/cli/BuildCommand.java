package com.gridfeed.loader.cli;

import com.gridfeed.core.CollectingPipelineEvents;
import com.gridfeed.loader.LoaderConfig;
import com.gridfeed.loader.ModelPipeline;
import com.gridfeed.loader.PipelineResult;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
        name = "build",
        description = "Build mutation files from split sheet CSVs, optionally dispatching them",
        mixinStandardHelpOptions = true
)
public class BuildCommand implements Callable<Integer> {

    @Option(names = {"--csv-dir", "-c"}, required = true, description = "Directory holding the sheet CSVs")
    private File csvDir;

    @Option(names = {"--graphql-dir", "-g"}, description = "Output directory for mutation files (default: graphql/ next to the CSV directory)")
    private File graphqlDir;

    @Mixin
    private ServiceOptions service;

    @Override
    public Integer call() {
        try {
            LoaderConfig config = service.applyTo(LoaderConfig.builder())
                    .csvDir(csvDir.toPath())
                    .graphqlDir(graphqlDir != null
                            ? graphqlDir.toPath()
                            : csvDir.toPath().toAbsolutePath().resolveSibling("graphql"))
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
