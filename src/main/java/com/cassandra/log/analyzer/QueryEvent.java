package com.cassandra.log.analyzer;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Normalized slow query: what ran, for how long, and which table and partition it hit
 * when that could be worked out.
 */
public class QueryEvent {

    private final QueryType type;
    private final Instant timestamp;
    private final long durationMillis;
    private final String query;
    private final Map<String, String> boundValues;
    private final String keyspace;
    private final String table;
    private final String primaryKey;

    private QueryEvent(Builder builder) {
        this.type = builder.type;
        this.timestamp = builder.timestamp;
        this.durationMillis = builder.durationMillis;
        this.query = builder.query;
        this.boundValues = Collections.unmodifiableMap(new LinkedHashMap<>(builder.boundValues));
        this.keyspace = builder.keyspace;
        this.table = builder.table;
        this.primaryKey = builder.primaryKey;
    }

    public static Builder builder(QueryType type) {
        return new Builder(type);
    }

    public QueryType getType() {
        return type;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public long getDurationMillis() {
        return durationMillis;
    }

    public String getQuery() {
        return query;
    }

    public Map<String, String> getBoundValues() {
        return boundValues;
    }

    public String getKeyspace() {
        return keyspace;
    }

    public String getTable() {
        return table;
    }

    /**
     * Partition key values joined with '-', or null unless every partition key column had
     * a value.
     */
    public String getPrimaryKey() {
        return primaryKey;
    }

    @Override
    public String toString() {
        return String.format("%s %d ms %s.%s pk=%s: %s", type, durationMillis, keyspace, table, primaryKey, query);
    }

    public static class Builder {

        private final QueryType type;
        private Instant timestamp;
        private long durationMillis;
        private String query;
        private Map<String, String> boundValues = Collections.emptyMap();
        private String keyspace;
        private String table;
        private String primaryKey;

        private Builder(QueryType type) {
            this.type = type;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder durationMillis(long durationMillis) {
            this.durationMillis = durationMillis;
            return this;
        }

        public Builder query(String query) {
            this.query = query;
            return this;
        }

        public Builder boundValues(Map<String, String> boundValues) {
            this.boundValues = boundValues == null ? Collections.emptyMap() : boundValues;
            return this;
        }

        public Builder keyspace(String keyspace) {
            this.keyspace = keyspace;
            return this;
        }

        public Builder table(String table) {
            this.table = table;
            return this;
        }

        public Builder primaryKey(String primaryKey) {
            this.primaryKey = primaryKey;
            return this;
        }

        public QueryEvent build() {
            if (type == null) {
                throw new IllegalStateException("Query type is required");
            }
            if (durationMillis < 0) {
                throw new IllegalStateException("Duration must not be negative: " + durationMillis);
            }
            return new QueryEvent(this);
        }
    }
}
