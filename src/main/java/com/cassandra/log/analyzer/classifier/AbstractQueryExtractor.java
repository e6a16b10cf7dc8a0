package com.cassandra.log.analyzer.classifier;

import com.cassandra.log.analyzer.QueryEvent;
import com.cassandra.log.analyzer.QueryType;
import com.cassandra.log.analyzer.SlowQueryLog;
import com.cassandra.log.analyzer.config.AnalyzerConfig;

/**
 * Extractor keyed on the statement keyword. By default only type, duration and query text
 * are recorded.
 */
public abstract class AbstractQueryExtractor implements QueryExtractor {

    private final QueryType type;

    protected AbstractQueryExtractor(QueryType type) {
        this.type = type;
    }

    public QueryType getType() {
        return type;
    }

    @Override
    public boolean handles(SlowQueryLog log) {
        return type.matches(log.getQuery());
    }

    @Override
    public QueryEvent process(SlowQueryLog log, AnalyzerConfig config) {
        return eventBuilder(log).build();
    }

    protected QueryEvent.Builder eventBuilder(SlowQueryLog log) {
        return QueryEvent.builder(type)
                .timestamp(log.getTimestamp())
                .durationMillis(log.getDurationMillis())
                .query(log.getQuery());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + type.getPrefix() + "]";
    }
}
