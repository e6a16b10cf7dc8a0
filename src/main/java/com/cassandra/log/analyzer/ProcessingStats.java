package com.cassandra.log.analyzer;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Counters collected while processing input files.
 */
public class ProcessingStats {

    public static final ProcessingStats EMPTY = new ProcessingStats(0, 0, 0, 0, 0,
            new EnumMap<>(QueryType.class), null, null);

    public final long hitsRead;
    public final long invalidHits;
    public final long notSlowQuery;
    public final long unhandled;
    public final long eventsProduced;
    public final Map<QueryType, Long> eventsByType;
    public final Instant earliestTimestamp;
    public final Instant latestTimestamp;

    public ProcessingStats(long hitsRead, long invalidHits, long notSlowQuery, long unhandled, long eventsProduced,
            Map<QueryType, Long> eventsByType, Instant earliestTimestamp, Instant latestTimestamp) {
        this.hitsRead = hitsRead;
        this.invalidHits = invalidHits;
        this.notSlowQuery = notSlowQuery;
        this.unhandled = unhandled;
        this.eventsProduced = eventsProduced;
        EnumMap<QueryType, Long> byType = new EnumMap<>(QueryType.class);
        byType.putAll(eventsByType);
        this.eventsByType = Collections.unmodifiableMap(byType);
        this.earliestTimestamp = earliestTimestamp;
        this.latestTimestamp = latestTimestamp;
    }

    public ProcessingStats merge(ProcessingStats other) {
        EnumMap<QueryType, Long> byType = new EnumMap<>(QueryType.class);
        byType.putAll(eventsByType);
        other.eventsByType.forEach((type, count) -> byType.merge(type, count, Long::sum));
        return new ProcessingStats(
                hitsRead + other.hitsRead,
                invalidHits + other.invalidHits,
                notSlowQuery + other.notSlowQuery,
                unhandled + other.unhandled,
                eventsProduced + other.eventsProduced,
                byType,
                earliest(earliestTimestamp, other.earliestTimestamp),
                latest(latestTimestamp, other.latestTimestamp));
    }

    static Instant earliest(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        return b == null || a.isBefore(b) ? a : b;
    }

    static Instant latest(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        return b == null || a.isAfter(b) ? a : b;
    }

    @Override
    public String toString() {
        return String.format("%d hits read, %d invalid hits, %d not slow queries, %d unhandled, %d events",
                hitsRead, invalidHits, notSlowQuery, unhandled, eventsProduced);
    }
}
