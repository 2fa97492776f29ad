package com.gridfeed.core.table;

import com.gridfeed.core.SheetNotFoundException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.csv.DuplicateHeaderMode;
import org.apache.commons.io.input.BOMInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads one CSV file per sheet, as written by the workbook splitter: UTF-8, header row first.
 * A leading byte-order mark, as Excel's "CSV UTF-8" export writes, is dropped.
 */
public class TabularReader {
    private static final Logger logger = LoggerFactory.getLogger(TabularReader.class);

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true)
            .setTrim(true)
            .setAllowMissingColumnNames(true)
            .setDuplicateHeaderMode(DuplicateHeaderMode.ALLOW_ALL)
            .build();

    /**
     * Reads a mandatory sheet.
     *
     * @throws SheetNotFoundException if the file does not exist
     */
    public TabularSource read(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new SheetNotFoundException(path);
        }
        return load(path);
    }

    /**
     * Reads an optional sheet; a missing file yields an absent, empty source.
     */
    public TabularSource readOptional(Path path) {
        if (!Files.isRegularFile(path)) {
            return TabularSource.absent(path);
        }
        return load(path);
    }

    private TabularSource load(Path path) {
        try (Reader reader = new InputStreamReader(BOMInputStream.builder().setPath(path).get(), StandardCharsets.UTF_8);
             CSVParser parser = FORMAT.parse(reader)) {

            List<String> headers = new ArrayList<>();
            for (String header : parser.getHeaderNames()) {
                headers.add(header == null ? "" : header.trim());
            }

            List<TabularRecord> records = new ArrayList<>();
            for (CSVRecord record : parser) {
                List<String> cells = new ArrayList<>(record.size());
                for (String value : record) {
                    cells.add(value == null ? "" : value.trim());
                }
                // the header occupies line 1
                records.add(new TabularRecord(record.getRecordNumber() + 1, headers, cells));
            }

            logger.debug("Read {}: {} columns, {} rows", path.getFileName(), headers.size(), records.size());
            return new TabularSource(path, true, headers, records);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
    }
}
