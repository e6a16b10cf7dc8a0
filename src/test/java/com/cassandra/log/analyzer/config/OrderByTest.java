package com.cassandra.log.analyzer.config;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class OrderByTest {

    @Test
    public void testFromValue() {
        assertEquals(OrderBy.DURATION, OrderBy.fromValue("duration"));
        assertEquals(OrderBy.AVG_DURATION, OrderBy.fromValue(" AVG_DURATION "));
        assertEquals(OrderBy.COUNT, OrderBy.fromValue("Count"));
    }

    @Test
    public void testUnknownValue() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> OrderBy.fromValue("latency"));
        assertTrue(e.getMessage().contains("latency"));
        assertThrows(IllegalArgumentException.class, () -> OrderBy.fromValue(null));
    }

    @Test
    public void testToStringIsConfigValue() {
        assertEquals("avg_duration", OrderBy.AVG_DURATION.toString());
    }
}
