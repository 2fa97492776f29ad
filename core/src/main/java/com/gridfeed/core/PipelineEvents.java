package com.gridfeed.core;

import java.nio.file.Path;

/**
 * Sink for everything a pipeline run has to say about its progress. Parsers,
 * writers and the dispatcher report here instead of logging directly, so callers
 * decide how the narration is rendered and can count warnings.
 */
public interface PipelineEvents {

    /** An optional sheet was absent, empty or malformed and contributed nothing. */
    void sheetSkipped(String sheet, String reason);

    /** A sheet was read; {@code items} is the number of records it produced. */
    void sheetParsed(String sheet, int items);

    /** A single row was dropped. Blank primary keys are not reported. */
    void rowSkipped(String sheet, long line, String reason);

    /** An enum cell held an unknown code and the fallback was used instead. */
    void codeDefaulted(String sheet, long line, String column, String raw, String fallback);

    void fileWritten(Path path);

    void stageStarted(String stage, int items);

    void itemSent(String stage, String item);

    void itemFailed(String stage, String item, String reason);
}
