package com.gridfeed.core.table;

import com.gridfeed.core.SheetNotFoundException;
import com.gridfeed.core.Sheets;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TabularReaderTest {

    @TempDir
    Path dir;

    private final TabularReader reader = new TabularReader();

    @Test
    void readsHeaderAndRowsWithLineNumbers() throws Exception {
        Path path = Sheets.write(dir, "nodes.csv",
                "node, is_commodity ,is_res",
                "tank1,0,1",
                "",
                "grid,1,0");

        TabularSource source = reader.read(path);

        assertTrue(source.present());
        assertEquals("nodes.csv", source.name());
        assertEquals(List.of("node", "is_commodity", "is_res"), source.headers());
        assertEquals(2, source.records().size());
        assertEquals("tank1", source.records().get(0).get("node"));
        assertEquals(2, source.records().get(0).line());
        assertEquals("1", source.records().get(1).get("is_commodity"));
    }

    @Test
    void missingColumnsReadAsBlank() throws Exception {
        TabularSource source = reader.read(Sheets.write(dir, "risk.csv",
                "parameter,value",
                "alfa"));

        TabularRecord row = source.records().get(0);
        assertEquals("", row.get("value"));
        assertEquals("", row.get("no_such_column"));
        assertTrue(row.isBlank("value"));
        assertEquals("", row.cell(7));
    }

    @Test
    void reportsMissingColumnsInRequestedOrder() throws Exception {
        TabularSource source = reader.read(Sheets.write(dir, "groups.csv",
                "entity,group",
                "tank1,storages"));

        assertTrue(source.hasColumn("entity"));
        assertEquals(List.of("group_type"), source.missingColumns(List.of("group_type", "entity", "group")));
    }

    @Test
    void mandatorySheetMustExist() {
        SheetNotFoundException e = assertThrows(SheetNotFoundException.class,
                () -> reader.read(dir.resolve("setup.csv")));

        assertEquals(dir.resolve("setup.csv"), e.path());
        assertEquals("setup.csv", e.sheet());
    }

    @Test
    void optionalSheetMayBeAbsent() {
        TabularSource source = reader.readOptional(dir.resolve("risk.csv"));

        assertFalse(source.present());
        assertFalse(source.hasRows());
        assertTrue(source.headers().isEmpty());
    }

    @Test
    void quotedCellsKeepTheirCommas() throws Exception {
        TabularSource source = reader.read(Sheets.write(dir, "inflow.csv",
                "t,\"tank1,s1\"",
                "t1,\"1,5\""));

        assertEquals(List.of("t", "tank1,s1"), source.headers());
        assertEquals("1,5", source.records().get(0).cell(1));
    }

    @Test
    void leadingByteOrderMarkIsDropped() throws Exception {
        Path path = dir.resolve("nodes.csv");
        Files.writeString(path, "\uFEFFnode,is_commodity,is_res,is_market\ntank1,0,0,0\n", StandardCharsets.UTF_8);

        TabularSource source = reader.read(path);

        assertEquals(List.of("node", "is_commodity", "is_res", "is_market"), source.headers());
        assertTrue(source.hasColumn("node"));
        assertEquals("tank1", source.records().get(0).get("node"));
    }
}
