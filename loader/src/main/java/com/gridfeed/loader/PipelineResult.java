package com.gridfeed.loader;

import com.gridfeed.client.DispatchReport;
import com.gridfeed.core.batch.BatchPlan;
import com.gridfeed.core.model.ModelInputs;

import java.nio.file.Path;
import java.util.List;

/**
 * What one pipeline run produced. {@code report} is {@code null} when dispatch was disabled.
 */
public record PipelineResult(ModelInputs inputs, BatchPlan plan, List<Path> files, DispatchReport report) {

    public PipelineResult {
        files = List.copyOf(files);
    }

    public boolean dispatched() {
        return report != null;
    }
}
