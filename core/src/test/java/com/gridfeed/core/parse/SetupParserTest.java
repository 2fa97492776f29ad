package com.gridfeed.core.parse;

import com.gridfeed.core.CollectingPipelineEvents;
import com.gridfeed.core.SheetFormatException;
import com.gridfeed.core.Sheets;
import com.gridfeed.core.model.SetupInput;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SetupParserTest {

    @TempDir
    Path dir;

    private final CollectingPipelineEvents events = new CollectingPipelineEvents();

    @Test
    void mapsKnownParameters() throws Exception {
        SetupInput setup = new SetupParser(events).parse(Sheets.source(dir, "setup.csv",
                "parameter,value",
                "use_market_bids,yes",
                "use_reserves,0",
                "use_reserve_realisation,True",
                "common_start_timesteps,24",
                "common_scenario_name,ALL",
                "node_dummy_variable_cost,\"10000,5\"",
                "unheard_of,42"));

        assertEquals(Boolean.TRUE, setup.useMarketBids());
        assertEquals(Boolean.FALSE, setup.useReserves());
        assertEquals(Boolean.TRUE, setup.useReserveRealisation());
        assertEquals(24, setup.commonTimesteps());
        assertEquals("ALL", setup.commonScenarioName());
        assertEquals(10000.5, setup.nodeDummyVariableCost());
    }

    @Test
    void blankValuesStayUnset() throws Exception {
        SetupInput setup = new SetupParser(events).parse(Sheets.source(dir, "setup.csv",
                "parameter,value",
                "use_market_bids,",
                "ramp_dummy_variable_cost,"));

        assertEquals(SetupInput.builder().build(), setup);
    }

    @Test
    void requiresParameterAndValueColumns() throws Exception {
        assertThrows(SheetFormatException.class, () -> new SetupParser(events).parse(Sheets.source(dir, "setup.csv",
                "name,value",
                "use_market_bids,1")));
    }
}
