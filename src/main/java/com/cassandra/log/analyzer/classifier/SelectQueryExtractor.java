package com.cassandra.log.analyzer.classifier;

import com.cassandra.log.analyzer.QueryType;
import com.cassandra.log.analyzer.TextUtil;
import com.cassandra.log.analyzer.schema.KeyspaceResolver;

public class SelectQueryExtractor extends TableQueryExtractor {

    public SelectQueryExtractor(KeyspaceResolver keyspaceResolver) {
        super(QueryType.SELECT, keyspaceResolver);
    }

    @Override
    protected String getTableSegment(String query) {
        return TextUtil.sliceIgnoreCase(query, " FROM ", ' ', ';');
    }
}
