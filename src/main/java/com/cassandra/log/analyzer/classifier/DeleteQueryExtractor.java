package com.cassandra.log.analyzer.classifier;

import com.cassandra.log.analyzer.QueryType;

/**
 * Deletes are grouped by query text only, they never carry a primary key.
 */
public class DeleteQueryExtractor extends AbstractQueryExtractor {

    public DeleteQueryExtractor() {
        super(QueryType.DELETE);
    }
}
