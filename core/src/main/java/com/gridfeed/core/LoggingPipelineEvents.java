package com.gridfeed.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

public class LoggingPipelineEvents implements PipelineEvents {
    private static final Logger logger = LoggerFactory.getLogger(LoggingPipelineEvents.class);

    @Override
    public void sheetSkipped(String sheet, String reason) {
        logger.warn("Skipping {}: {}", sheet, reason);
    }

    @Override
    public void sheetParsed(String sheet, int items) {
        logger.info("Parsed {}: {} records", sheet, items);
    }

    @Override
    public void rowSkipped(String sheet, long line, String reason) {
        logger.warn("{} line {}: {}, row skipped", sheet, line, reason);
    }

    @Override
    public void codeDefaulted(String sheet, long line, String column, String raw, String fallback) {
        logger.warn("{} line {}: unknown {} '{}', using {}", sheet, line, column, raw, fallback);
    }

    @Override
    public void fileWritten(Path path) {
        logger.debug("Saved {}", path);
    }

    @Override
    public void stageStarted(String stage, int items) {
        logger.info("Dispatching {} ({} items)", stage, items);
    }

    @Override
    public void itemSent(String stage, String item) {
        logger.info("  {} {}: ok", stage, item);
    }

    @Override
    public void itemFailed(String stage, String item, String reason) {
        logger.warn("  {} {}: failed: {}", stage, item, reason);
    }
}
