package com.gridfeed.core.parse;

import com.gridfeed.core.CollectingPipelineEvents;
import com.gridfeed.core.SheetFormatException;
import com.gridfeed.core.Sheets;
import com.gridfeed.core.model.Conversion;
import com.gridfeed.core.model.ProcessInput;
import com.gridfeed.core.table.TabularSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProcessParserTest {
    private static final String HEADER = String.join(",", ProcessParser.REQUIRED);

    @TempDir
    Path dir;

    private final ProcessParser parser = new ProcessParser(new CollectingPipelineEvents());

    @Test
    void parsesConversionCodesAndNumbers() throws Exception {
        TabularSource source = Sheets.source(dir, "processes.csv",
                HEADER,
                "pump,0,1,0,1,0.9,0.1,1,5,2,3,4,5,1,0",
                "line,0,0,0,transfer,\"0,95\",,,,,,,,0,1",
                "spot,0,0,0,M,1,0,1,0,0,0,0,0,0,0",
                "chp,0,0,0,,1,0,1,0,0,0,0,0,0,0");

        List<ProcessInput> processes = parser.parse(source);

        assertEquals(4, processes.size());
        ProcessInput pump = processes.get(0);
        assertEquals(Conversion.UNIT, pump.conversion());
        assertTrue(pump.isOnline());
        assertEquals(0.9, pump.eff());
        assertEquals(5.0, pump.startCost());
        assertEquals(2.0, pump.minOnline());
        assertEquals(3.0, pump.minOffline());
        assertEquals(4.0, pump.maxOnline());
        assertEquals(5.0, pump.maxOffline());
        assertTrue(pump.initialState());
        assertFalse(pump.isScenarioIndependent());
        assertTrue(pump.cf().isEmpty());

        ProcessInput line = processes.get(1);
        assertEquals(Conversion.TRANSFER, line.conversion());
        assertEquals(0.95, line.eff());
        assertEquals(0.0, line.loadMin());
        assertEquals(1.0, line.loadMax());
        assertTrue(line.isScenarioIndependent());

        assertEquals(Conversion.MARKET, processes.get(2).conversion());
        assertEquals(Conversion.UNIT, processes.get(3).conversion());
    }

    @Test
    void unknownConversionFailsTheSheet() throws Exception {
        TabularSource source = Sheets.source(dir, "processes.csv",
                HEADER,
                "pump,0,1,0,4,1,0,1,0,0,0,0,0,0,0");

        SheetFormatException e = assertThrows(SheetFormatException.class, () -> parser.parse(source));

        assertTrue(e.getMessage().contains("'4'"));
        assertTrue(e.getMessage().contains("line 2"));
    }
}
