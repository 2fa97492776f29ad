package com.gridfeed.core.parse;

import com.gridfeed.core.PipelineEvents;
import com.gridfeed.core.SheetFormatException;
import com.gridfeed.core.table.TabularSource;

import java.util.List;

/**
 * Turns one sheet into typed records.
 *
 * <p>Mandatory sheets fail with {@link SheetFormatException} when a required column is
 * missing. Optional sheets report through {@link PipelineEvents#sheetSkipped} and yield an
 * empty result instead.
 */
public abstract class SheetParser<T> {
    protected final PipelineEvents events;

    protected SheetParser(PipelineEvents events) {
        this.events = events;
    }

    public abstract T parse(TabularSource source);

    protected void requireColumns(TabularSource source, List<String> required) {
        List<String> missing = source.missingColumns(required);
        if (!missing.isEmpty()) {
            throw new SheetFormatException(source.name(),
                    "missing required column(s) " + missing + ", available columns: " + source.headers());
        }
    }

    /**
     * @return true when an optional sheet exists, has rows and has every required column
     */
    protected boolean usable(TabularSource source, List<String> required) {
        if (!source.present()) {
            events.sheetSkipped(source.name(), "file not found");
            return false;
        }
        if (!source.hasRows()) {
            events.sheetSkipped(source.name(), "no data rows");
            return false;
        }
        List<String> missing = source.missingColumns(required);
        if (!missing.isEmpty()) {
            events.sheetSkipped(source.name(),
                    "missing column(s) " + missing + ", available columns: " + source.headers());
            return false;
        }
        return true;
    }
}
