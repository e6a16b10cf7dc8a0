package com.cassandra.log.analyzer.report;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.cassandra.log.analyzer.QueryEvent;
import com.cassandra.log.analyzer.QueryType;
import com.cassandra.log.analyzer.accumulator.RollupAccumulator;
import com.cassandra.log.analyzer.accumulator.RollupEntry;
import com.cassandra.log.analyzer.accumulator.Rollups;
import com.cassandra.log.analyzer.config.OrderBy;

public class RankingReporterTest {

    private static QueryEvent event(String timestamp, long duration, String query, String primaryKey) {
        return QueryEvent.builder(QueryType.SELECT)
                .timestamp(Instant.parse(timestamp))
                .durationMillis(duration)
                .query(query)
                .keyspace("ks1")
                .table("users")
                .primaryKey(primaryKey)
                .build();
    }

    private static List<Long> durations(List<RollupEntry> entries) {
        return entries.stream().map(RollupEntry::getDuration).collect(Collectors.toList());
    }

    @Test
    public void testTopNTruncatesInDescendingOrder() {
        Rollups rollups = RollupAccumulator.aggregate(List.of(
                event("2024-01-15T10:00:00Z", 300, "Q300", "a"),
                event("2024-01-15T10:00:01Z", 100, "Q100", "b"),
                event("2024-01-15T10:00:02Z", 500, "Q500", "c")), 1);

        SlowQueryReport report = new RankingReporter(2, 5, OrderBy.DURATION).rank(rollups);

        assertEquals(List.of(500L, 300L), durations(report.getSlowQueries()));
        assertEquals(List.of(500L, 300L), durations(report.getSlowPrimaryKeys()));
        assertEquals(List.of(500L, 300L), durations(report.getPrimaryKeys()));
    }

    @Test
    public void testOrderByCount() {
        Rollups rollups = RollupAccumulator.aggregate(List.of(
                event("2024-01-15T10:00:00Z", 900, "SLOW", "a"),
                event("2024-01-15T10:00:01Z", 10, "FREQUENT", "b"),
                event("2024-01-15T10:00:02Z", 10, "FREQUENT", "b"),
                event("2024-01-15T10:00:03Z", 10, "FREQUENT", "b")), 1);

        SlowQueryReport report = new RankingReporter(10, 5, OrderBy.COUNT).rank(rollups);

        assertEquals("FREQUENT", report.getSlowQueries().get(0).getQuery());
        assertEquals("SLOW", report.getSlowQueries().get(1).getQuery());
    }

    @Test
    public void testOrderByAvgDuration() {
        Rollups rollups = RollupAccumulator.aggregate(List.of(
                event("2024-01-15T10:00:00Z", 100, "MANY", "a"),
                event("2024-01-15T10:00:01Z", 100, "MANY", "a"),
                event("2024-01-15T10:00:02Z", 150, "ONCE", "b")), 1);

        SlowQueryReport report = new RankingReporter(10, 5, OrderBy.AVG_DURATION).rank(rollups);

        assertEquals("ONCE", report.getSlowQueries().get(0).getQuery());
    }

    @Test
    public void testTiesKeepFirstSeenOrder() {
        Rollups rollups = RollupAccumulator.aggregate(List.of(
                event("2024-01-15T10:00:00Z", 50, "FIRST", "a"),
                event("2024-01-15T10:00:01Z", 50, "SECOND", "b"),
                event("2024-01-15T10:00:02Z", 50, "THIRD", "c")), 1);

        SlowQueryReport report = new RankingReporter(2, 5, OrderBy.DURATION).rank(rollups);

        assertEquals(List.of("FIRST", "SECOND"),
                report.getSlowQueries().stream().map(RollupEntry::getQuery).collect(Collectors.toList()));
    }

    @Test
    public void testVolumeInMinuteOrderAndTopNPerMinute() {
        List<QueryEvent> events = new ArrayList<>();
        events.add(event("2024-01-15T10:02:00Z", 5, "LATE", "z"));
        for (int i = 1; i <= 4; i++) {
            events.add(event("2024-01-15T10:01:0" + i + "Z", i * 10, "Q" + i, "k" + i));
        }

        Rollups rollups = RollupAccumulator.aggregate(events, 1);
        SlowQueryReport report = new RankingReporter(100, 2, OrderBy.DURATION).rank(rollups);

        assertEquals(List.of("2024-01-15 10:01", "2024-01-15 10:02"),
                report.getVolume().stream().map(RollupEntry::getMinute).collect(Collectors.toList()));
        assertEquals(100, report.getVolume().get(0).getDuration());

        assertEquals(List.of("Q4", "Q3", "LATE"),
                report.getVolumeTopN().stream().map(RollupEntry::getQuery).collect(Collectors.toList()));
        assertEquals("2024-01-15 10:01", report.getVolumeTopN().get(0).getMinute());
    }

    @Test
    public void testRankingIsDeterministic() {
        List<QueryEvent> events = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            events.add(event("2024-01-15T10:0" + (i % 3) + ":00Z", (i % 4) * 10, "Q" + (i % 7), "k" + (i % 5)));
        }

        SlowQueryReport first = new RankingReporter(5, 3, OrderBy.DURATION).rank(RollupAccumulator.aggregate(events, 1));
        SlowQueryReport second = new RankingReporter(5, 3, OrderBy.DURATION).rank(RollupAccumulator.aggregate(events, 1));

        assertEquals(first.getSlowQueries().toString(), second.getSlowQueries().toString());
        assertEquals(first.getSlowPrimaryKeys().toString(), second.getSlowPrimaryKeys().toString());
        assertEquals(first.getPrimaryKeys().toString(), second.getPrimaryKeys().toString());
        assertEquals(first.getVolume().toString(), second.getVolume().toString());
        assertEquals(first.getVolumeTopN().toString(), second.getVolumeTopN().toString());
    }
}
