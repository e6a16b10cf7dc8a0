package com.cassandra.log.analyzer.classifier;

import com.cassandra.log.analyzer.QueryEvent;
import com.cassandra.log.analyzer.SlowQueryLog;
import com.cassandra.log.analyzer.config.AnalyzerConfig;

/**
 * Turns slow query logs of one statement type into {@link QueryEvent}s.
 */
public interface QueryExtractor {

    boolean handles(SlowQueryLog log);

    QueryEvent process(SlowQueryLog log, AnalyzerConfig config);
}
