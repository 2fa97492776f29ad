package com.gridfeed.core.parse;

import com.gridfeed.core.CollectingPipelineEvents;
import com.gridfeed.core.Sheets;
import com.gridfeed.core.model.RiskInput;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RiskParserTest {

    @TempDir
    Path dir;

    private final CollectingPipelineEvents events = new CollectingPipelineEvents();

    @Test
    void risksDefaultToZero() throws Exception {
        List<RiskInput> risks = new RiskParser(events).parse(Sheets.source(dir, "risk.csv",
                "parameter,value",
                "alfa,0.1",
                "beta,",
                ",3"));

        assertEquals(List.of(new RiskInput("alfa", 0.1), new RiskInput("beta", 0.0)), risks);
    }

    @Test
    void absentRiskSheetIsSkipped() {
        assertTrue(new RiskParser(events).parse(Sheets.absent(dir, "risk.csv")).isEmpty());
        assertEquals(1, events.warnings().size());
    }

    @Test
    void sheetWithoutValueColumnIsSkipped() throws Exception {
        List<RiskInput> risks = new RiskParser(events).parse(Sheets.source(dir, "risk.csv",
                "parameter,amount",
                "alfa,0.1"));

        assertTrue(risks.isEmpty());
        assertEquals("risk.csv", events.warnings().get(0).sheet());
        assertTrue(events.warnings().get(0).message().contains("value"));
    }
}
