package com.cassandra.log.analyzer.classifier;

import com.cassandra.log.analyzer.QueryType;

public class UpdateQueryExtractor extends AbstractQueryExtractor {

    public UpdateQueryExtractor() {
        super(QueryType.UPDATE);
    }
}
