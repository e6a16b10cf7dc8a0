package com.cassandra.log.analyzer.classifier;

import com.cassandra.log.analyzer.QueryType;

/**
 * Batches are recorded as a whole, inner statements are not looked at.
 */
public class BatchQueryExtractor extends AbstractQueryExtractor {

    public BatchQueryExtractor() {
        super(QueryType.BATCH);
    }
}
