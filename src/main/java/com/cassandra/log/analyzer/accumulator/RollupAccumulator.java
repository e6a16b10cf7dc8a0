package com.cassandra.log.analyzer.accumulator;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import com.cassandra.log.analyzer.QueryEvent;

/**
 * Folds query events into the five slow query rollups.
 *
 * Each call to {@link #aggregate(Iterable, int)} works on its own maps and returns a new
 * {@link Rollups}; nothing is shared between calls.
 */
public class RollupAccumulator {

    public static final DateTimeFormatter MINUTE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm")
            .withZone(ZoneOffset.UTC);

    private final Map<String, RollupEntry> byQuery = new LinkedHashMap<>();
    private final Map<String, RollupEntry> byQueryPrimaryKey = new LinkedHashMap<>();
    private final Map<String, RollupEntry> byPrimaryKey = new LinkedHashMap<>();
    private final SortedMap<String, RollupEntry> byMinute = new TreeMap<>();
    private final SortedMap<String, Map<String, RollupEntry>> byMinuteQueryPrimaryKey = new TreeMap<>();

    private RollupAccumulator() {
    }

    /**
     * @param events   events in a stable order, ties in the reports keep this order
     * @param minCount entries seen fewer times than this are dropped from every rollup
     */
    public static Rollups aggregate(Iterable<QueryEvent> events, int minCount) {
        RollupAccumulator accumulator = new RollupAccumulator();
        for (QueryEvent event : events) {
            accumulator.accumulate(event);
        }
        return accumulator.finish(minCount);
    }

    public static String getMinute(QueryEvent event) {
        if (event.getTimestamp() == null) {
            throw new IllegalArgumentException("Query event has no timestamp: " + event);
        }
        return MINUTE_FORMAT.format(event.getTimestamp());
    }

    private void accumulate(QueryEvent event) {
        String query = event.getQuery();
        String primaryKey = event.getPrimaryKey();
        String keyspace = event.getKeyspace();
        String table = event.getTable();
        String minute = getMinute(event);
        String queryPk = query + "." + (primaryKey == null ? "" : primaryKey);
        long duration = event.getDurationMillis();

        byQuery.computeIfAbsent(query, k -> new RollupEntry(query, null, keyspace, table, null))
                .addExecution(duration);

        if (primaryKey != null) {
            byQueryPrimaryKey.computeIfAbsent(queryPk, k -> new RollupEntry(query, primaryKey, keyspace, table, null))
                    .addExecution(duration);
        }

        if (primaryKey != null && keyspace != null && table != null) {
            String fullKey = keyspace + "." + table + "." + primaryKey;
            byPrimaryKey.computeIfAbsent(fullKey, k -> new RollupEntry(null, primaryKey, keyspace, table, null))
                    .addExecution(duration);
        }

        byMinute.computeIfAbsent(minute, k -> new RollupEntry(null, null, null, null, minute))
                .addExecution(duration);

        byMinuteQueryPrimaryKey.computeIfAbsent(minute, k -> new LinkedHashMap<>())
                .computeIfAbsent(queryPk, k -> new RollupEntry(query, primaryKey, keyspace, table, minute))
                .addExecution(duration);
    }

    private Rollups finish(int minCount) {
        removeBelow(byQuery, minCount);
        removeBelow(byQueryPrimaryKey, minCount);
        removeBelow(byPrimaryKey, minCount);
        removeBelow(byMinute, minCount);
        for (Map<String, RollupEntry> minuteEntries : byMinuteQueryPrimaryKey.values()) {
            removeBelow(minuteEntries, minCount);
        }
        byMinuteQueryPrimaryKey.values().removeIf(Map::isEmpty);
        return new Rollups(byQuery, byQueryPrimaryKey, byPrimaryKey, byMinute, byMinuteQueryPrimaryKey);
    }

    private static void removeBelow(Map<String, RollupEntry> entries, int minCount) {
        entries.values().removeIf(entry -> entry.getCount() < minCount);
    }
}
