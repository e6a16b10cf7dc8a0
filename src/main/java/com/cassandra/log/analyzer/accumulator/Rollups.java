package com.cassandra.log.analyzer.accumulator;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;

/**
 * Result of folding query events: five rollups, already cut down to entries seen at
 * least {@code min_count} times. Map iteration follows first-seen order, minute maps are
 * in chronological order.
 */
public class Rollups {

    private final Map<String, RollupEntry> byQuery;
    private final Map<String, RollupEntry> byQueryPrimaryKey;
    private final Map<String, RollupEntry> byPrimaryKey;
    private final SortedMap<String, RollupEntry> byMinute;
    private final SortedMap<String, Map<String, RollupEntry>> byMinuteQueryPrimaryKey;

    Rollups(Map<String, RollupEntry> byQuery, Map<String, RollupEntry> byQueryPrimaryKey,
            Map<String, RollupEntry> byPrimaryKey, SortedMap<String, RollupEntry> byMinute,
            SortedMap<String, Map<String, RollupEntry>> byMinuteQueryPrimaryKey) {
        this.byQuery = Collections.unmodifiableMap(byQuery);
        this.byQueryPrimaryKey = Collections.unmodifiableMap(byQueryPrimaryKey);
        this.byPrimaryKey = Collections.unmodifiableMap(byPrimaryKey);
        this.byMinute = Collections.unmodifiableSortedMap(byMinute);
        this.byMinuteQueryPrimaryKey = Collections.unmodifiableSortedMap(byMinuteQueryPrimaryKey);
    }

    /** Keyed by query text. */
    public Map<String, RollupEntry> getByQuery() {
        return byQuery;
    }

    /** Keyed by {@code query + "." + primaryKey}. */
    public Map<String, RollupEntry> getByQueryPrimaryKey() {
        return byQueryPrimaryKey;
    }

    /** Keyed by {@code keyspace + "." + table + "." + primaryKey}. */
    public Map<String, RollupEntry> getByPrimaryKey() {
        return byPrimaryKey;
    }

    /** Keyed by minute, {@code yyyy-MM-dd HH:mm} UTC. */
    public SortedMap<String, RollupEntry> getByMinute() {
        return byMinute;
    }

    /** Minute, then {@code query + "." + primaryKey} with an empty primary key when unknown. */
    public SortedMap<String, Map<String, RollupEntry>> getByMinuteQueryPrimaryKey() {
        return byMinuteQueryPrimaryKey;
    }
}
