package com.cassandra.log.analyzer.classifier;

import java.util.List;

import com.cassandra.log.analyzer.QueryEvent;
import com.cassandra.log.analyzer.SlowQueryLog;
import com.cassandra.log.analyzer.config.AnalyzerConfig;
import com.cassandra.log.analyzer.schema.KeyspaceResolver;

/**
 * Dispatches a slow query log to the first extractor that handles it.
 *
 * The extractor order is SELECT, BATCH, INSERT, DELETE, UPDATE and is part of the
 * behaviour: prefixes are matched ignoring case, so a different order can classify the
 * same statement differently.
 */
public class QueryClassifier {

    private final AnalyzerConfig config;
    private final List<QueryExtractor> extractors;

    public QueryClassifier(AnalyzerConfig config) {
        this.config = config;
        KeyspaceResolver keyspaceResolver = new KeyspaceResolver(config.getAmbiguityIndex(), config.getTagKeyspaces());
        this.extractors = List.of(
                new SelectQueryExtractor(keyspaceResolver),
                new BatchQueryExtractor(),
                new InsertQueryExtractor(keyspaceResolver),
                new DeleteQueryExtractor(),
                new UpdateQueryExtractor());
    }

    public QueryEvent classify(SlowQueryLog log) throws UnhandledQueryException {
        for (QueryExtractor extractor : extractors) {
            if (extractor.handles(log)) {
                return extractor.process(log, config);
            }
        }
        throw new UnhandledQueryException(log.getQuery());
    }

    public List<QueryExtractor> getExtractors() {
        return extractors;
    }
}
