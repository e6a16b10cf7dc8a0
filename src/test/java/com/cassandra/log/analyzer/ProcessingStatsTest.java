package com.cassandra.log.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.util.Map;

import org.junit.jupiter.api.Test;

public class ProcessingStatsTest {

    @Test
    public void testMerge() {
        Instant t1 = Instant.parse("2024-01-15T10:00:00Z");
        Instant t2 = Instant.parse("2024-01-15T11:00:00Z");
        Instant t3 = Instant.parse("2024-01-15T12:00:00Z");
        ProcessingStats a = new ProcessingStats(10, 1, 2, 1, 6, Map.of(QueryType.SELECT, 4L, QueryType.INSERT, 2L), t2, t3);
        ProcessingStats b = new ProcessingStats(5, 0, 1, 0, 4, Map.of(QueryType.SELECT, 4L), t1, t2);

        ProcessingStats merged = a.merge(b);

        assertEquals(15, merged.hitsRead);
        assertEquals(1, merged.invalidHits);
        assertEquals(3, merged.notSlowQuery);
        assertEquals(1, merged.unhandled);
        assertEquals(10, merged.eventsProduced);
        assertEquals(8L, merged.eventsByType.get(QueryType.SELECT));
        assertEquals(2L, merged.eventsByType.get(QueryType.INSERT));
        assertEquals(t1, merged.earliestTimestamp);
        assertEquals(t3, merged.latestTimestamp);
    }

    @Test
    public void testMergeWithEmpty() {
        Instant t = Instant.parse("2024-01-15T10:00:00Z");
        ProcessingStats stats = new ProcessingStats(1, 0, 0, 0, 1, Map.of(QueryType.BATCH, 1L), t, t);

        ProcessingStats merged = ProcessingStats.EMPTY.merge(stats);

        assertEquals(1, merged.eventsProduced);
        assertEquals(t, merged.earliestTimestamp);
        assertEquals(t, merged.latestTimestamp);
    }
}
