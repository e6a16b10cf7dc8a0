package com.cassandra.log.analyzer;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * Parts of one "Query too slow" message, as split by {@link LogRecordParser}.
 */
public class SlowQueryLog {

    private final Instant timestamp;
    private final long durationMillis;
    private final String boundValueCount;
    private final String boundValues;
    private final String query;
    private final List<String> tags;

    public SlowQueryLog(Instant timestamp, long durationMillis, String boundValueCount, String boundValues,
            String query, List<String> tags) {
        this.timestamp = timestamp;
        this.durationMillis = durationMillis;
        this.boundValueCount = boundValueCount;
        this.boundValues = boundValues;
        this.query = query;
        this.tags = tags == null ? Collections.emptyList() : tags;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public long getDurationMillis() {
        return durationMillis;
    }

    /** The bracketed count, e.g. {@code [2 bound values]}, or null. */
    public String getBoundValueCount() {
        return boundValueCount;
    }

    /** Raw bound value section, e.g. {@code [user_id:'u1']}, or null. */
    public String getBoundValues() {
        return boundValues;
    }

    public boolean hasBoundValues() {
        return boundValues != null && !boundValues.isEmpty();
    }

    public String getQuery() {
        return query;
    }

    public List<String> getTags() {
        return tags;
    }

    @Override
    public String toString() {
        return String.format("%d ms: %s %s", durationMillis, query, boundValues == null ? "" : boundValues);
    }
}
