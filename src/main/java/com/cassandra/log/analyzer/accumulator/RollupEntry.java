package com.cassandra.log.analyzer.accumulator;

/**
 * Count and total duration of the slow queries sharing one grouping key. Grouping fields
 * that do not apply to a rollup are null.
 */
public class RollupEntry {

    private final String query;
    private final String primaryKey;
    private final String keyspace;
    private final String table;
    private final String minute;

    private long count;
    private long duration;

    public RollupEntry(String query, String primaryKey, String keyspace, String table, String minute) {
        this.query = query;
        this.primaryKey = primaryKey;
        this.keyspace = keyspace;
        this.table = table;
        this.minute = minute;
    }

    void addExecution(long durationMs) {
        count++;
        duration += durationMs;
    }

    public long getCount() {
        return count;
    }

    /** Total duration in ms. */
    public long getDuration() {
        return duration;
    }

    public long getAvgDuration() {
        return count > 0 ? duration / count : 0;
    }

    public String getQuery() {
        return query;
    }

    public String getPrimaryKey() {
        return primaryKey;
    }

    public String getKeyspace() {
        return keyspace;
    }

    public String getTable() {
        return table;
    }

    public String getMinute() {
        return minute;
    }

    @Override
    public String toString() {
        return String.format("%10d %10d %10d %s %s %s.%s %s", count, duration, getAvgDuration(),
                minute == null ? "" : minute, primaryKey == null ? "" : primaryKey, keyspace, table,
                query == null ? "" : query);
    }
}
