package com.gridfeed.core;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Forwards to a delegate while keeping every warning-level event, so a run can
 * finish with a summary of what it degraded on.
 */
public class CollectingPipelineEvents implements PipelineEvents {

    public record Warning(String sheet, String message) {}

    private final PipelineEvents delegate;
    private final List<Warning> warnings = new ArrayList<>();
    private final List<Path> files = new ArrayList<>();

    public CollectingPipelineEvents(PipelineEvents delegate) {
        this.delegate = delegate;
    }

    public CollectingPipelineEvents() {
        this(new LoggingPipelineEvents());
    }

    public List<Warning> warnings() {
        return List.copyOf(warnings);
    }

    public List<Path> files() {
        return List.copyOf(files);
    }

    @Override
    public void sheetSkipped(String sheet, String reason) {
        warnings.add(new Warning(sheet, reason));
        delegate.sheetSkipped(sheet, reason);
    }

    @Override
    public void sheetParsed(String sheet, int items) {
        delegate.sheetParsed(sheet, items);
    }

    @Override
    public void rowSkipped(String sheet, long line, String reason) {
        warnings.add(new Warning(sheet, "line " + line + ": " + reason));
        delegate.rowSkipped(sheet, line, reason);
    }

    @Override
    public void codeDefaulted(String sheet, long line, String column, String raw, String fallback) {
        warnings.add(new Warning(sheet, "line " + line + ": unknown " + column + " '" + raw + "'"));
        delegate.codeDefaulted(sheet, line, column, raw, fallback);
    }

    @Override
    public void fileWritten(Path path) {
        files.add(path);
        delegate.fileWritten(path);
    }

    @Override
    public void stageStarted(String stage, int items) {
        delegate.stageStarted(stage, items);
    }

    @Override
    public void itemSent(String stage, String item) {
        delegate.itemSent(stage, item);
    }

    @Override
    public void itemFailed(String stage, String item, String reason) {
        warnings.add(new Warning(stage, item + ": " + reason));
        delegate.itemFailed(stage, item, reason);
    }
}
