package com.gridfeed.client;

import com.gridfeed.core.batch.Stage;

import java.util.List;

/**
 * Outcome of a dispatch run: per-stage counts and every failed item, in submission order.
 */
public record DispatchReport(List<StageResult> stages, List<Failure> failures) {

    public record StageResult(Stage stage, int sent, int failed) {}

    public record Failure(Stage stage, String item, String reason) {}

    public DispatchReport {
        stages = List.copyOf(stages);
        failures = List.copyOf(failures);
    }

    public int sent() {
        return stages.stream().mapToInt(StageResult::sent).sum();
    }

    public int failed() {
        return failures.size();
    }

    public boolean isClean() {
        return failures.isEmpty();
    }
}
