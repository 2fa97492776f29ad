package com.gridfeed.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ValueDescriptorTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void collapsesOnlyIdenticalValues() {
        assertTrue(ValueDescriptor.of("s1", List.of(2.0, 2.0)).isConstant());
        assertFalse(ValueDescriptor.of("s1", List.of(2.0, 2.0000001)).isConstant());
    }

    @Test
    void requiresExactlyOneRepresentation() {
        assertThrows(IllegalArgumentException.class, () -> new ValueDescriptor("s1", 1.0, List.of(1.0)));
        assertThrows(IllegalArgumentException.class, () -> new ValueDescriptor("s1", null, null));
        assertThrows(IllegalArgumentException.class, () -> ValueDescriptor.series("s1", List.of()));
    }

    @Test
    void serializesOnlyTheSetRepresentation() {
        JsonNode constant = mapper.valueToTree(ValueDescriptor.constant(null, 5.0));
        assertTrue(constant.get("scenario").isNull());
        assertEquals(5.0, constant.get("constant").asDouble());
        assertFalse(constant.has("series"));

        JsonNode series = mapper.valueToTree(ValueDescriptor.series("s1", List.of(1.0, 2.0)));
        assertEquals("s1", series.get("scenario").asText());
        assertEquals(2, series.get("series").size());
        assertFalse(series.has("constant"));
    }

    @Test
    void enumCodesAcceptSynonyms() {
        assertEquals(Conversion.TRANSFER, Conversion.fromCode(" T ").orElseThrow());
        assertEquals(MarketType.RESERVE, MarketType.fromCode("r").orElseThrow());
        assertEquals(MarketDirection.RES_DOWN, MarketDirection.fromCode("reserve_down").orElseThrow());
        assertTrue(MarketDirection.fromCode("sideways").isEmpty());
    }
}
