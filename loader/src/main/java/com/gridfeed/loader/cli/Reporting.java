package com.gridfeed.loader.cli;

import com.gridfeed.client.DispatchReport;
import com.gridfeed.core.CollectingPipelineEvents;
import com.gridfeed.loader.PipelineResult;

import java.io.PrintStream;

final class Reporting {
    static final int EXIT_FAILED = 1;
    static final int EXIT_DISPATCH_FAILURES = 3;

    private Reporting() {}

    /**
     * Prints the run summary and returns the exit code.
     */
    static int summarize(PipelineResult result, CollectingPipelineEvents events, PrintStream out) {
        out.println("Wrote " + result.files().size() + " files for " + result.plan().size() + " mutations");
        if (!events.warnings().isEmpty()) {
            out.println(events.warnings().size() + " warning(s):");
            for (CollectingPipelineEvents.Warning warning : events.warnings()) {
                out.println("  " + warning.sheet() + ": " + warning.message());
            }
        }
        if (!result.dispatched()) {
            return 0;
        }

        DispatchReport report = result.report();
        for (DispatchReport.StageResult stage : report.stages()) {
            out.println("  " + stage.stage().label() + ": " + stage.sent() + " sent, " + stage.failed() + " failed");
        }
        for (DispatchReport.Failure failure : report.failures()) {
            out.println("  FAILED " + failure.stage().label() + " " + failure.item() + ": " + failure.reason());
        }
        return report.isClean() ? 0 : EXIT_DISPATCH_FAILURES;
    }
}
