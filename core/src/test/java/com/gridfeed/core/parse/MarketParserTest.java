package com.gridfeed.core.parse;

import com.gridfeed.core.CollectingPipelineEvents;
import com.gridfeed.core.Sheets;
import com.gridfeed.core.model.MarketDirection;
import com.gridfeed.core.model.MarketInput;
import com.gridfeed.core.model.MarketType;
import com.gridfeed.core.model.ValueDescriptor;
import com.gridfeed.core.table.TabularSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MarketParserTest {
    private static final String HEADER = String.join(",", MarketParser.REQUIRED);

    @TempDir
    Path dir;

    private final CollectingPipelineEvents events = new CollectingPipelineEvents();

    @Test
    void parsesReserveMarket() throws Exception {
        TabularSource source = Sheets.source(dir, "markets.csv",
                HEADER,
                "fcr_up,res,elc,p_all,rup,0.8,fcr,1,0,0,100,\"0,5\"");

        MarketInput market = new MarketParser(events).parse(source).get(0);

        assertEquals("fcr_up", market.name());
        assertEquals(MarketType.RESERVE, market.mType());
        assertEquals("elc", market.node());
        assertEquals("p_all", market.processGroup());
        assertEquals(MarketDirection.RES_UP, market.direction());
        assertEquals(List.of(ValueDescriptor.constant(null, 0.8)), market.realisation());
        assertEquals("fcr", market.reserveType());
        assertTrue(market.isBid());
        assertFalse(market.isLimited());
        assertEquals(100.0, market.maxBid());
        assertEquals(0.5, market.fee());
        assertTrue(market.price().isEmpty());
        assertTrue(events.warnings().isEmpty());
    }

    @Test
    void unknownCodesFallBackWithWarnings() throws Exception {
        TabularSource source = Sheets.source(dir, "markets.csv",
                HEADER,
                "npe,spot,elc,p_all,sideways,,,0,0,0,0,0");

        MarketInput market = new MarketParser(events).parse(source).get(0);

        assertEquals(MarketType.ENERGY, market.mType());
        assertNull(market.direction());
        assertTrue(market.realisation().isEmpty());
        assertNull(market.reserveType());
        assertEquals(2, events.warnings().size());
        assertTrue(events.warnings().get(0).message().contains("market_type 'spot'"));
        assertTrue(events.warnings().get(1).message().contains("direction 'sideways'"));
    }

    @Test
    void blankCodesDefaultSilently() throws Exception {
        TabularSource source = Sheets.source(dir, "markets.csv",
                HEADER,
                "npe,,elc,p_all,,,,0,0,0,0,0");

        MarketInput market = new MarketParser(events).parse(source).get(0);

        assertEquals(MarketType.ENERGY, market.mType());
        assertNull(market.direction());
        assertTrue(events.warnings().isEmpty());
    }

    @Test
    void prefersMarketNodeColumn() throws Exception {
        TabularSource source = Sheets.source(dir, "markets.csv",
                HEADER + ",market_node",
                "npe,e,legacy,p_all,up_down,,,0,0,0,0,0,elc");

        MarketInput market = new MarketParser(events).parse(source).get(0);

        assertEquals("elc", market.node());
        assertEquals(MarketDirection.UP_DOWN, market.direction());
    }
}
