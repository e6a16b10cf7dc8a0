package com.cassandra.log.analyzer.classifier;

import com.cassandra.log.analyzer.QueryType;
import com.cassandra.log.analyzer.TextUtil;
import com.cassandra.log.analyzer.schema.KeyspaceResolver;

public class InsertQueryExtractor extends TableQueryExtractor {

    public InsertQueryExtractor(KeyspaceResolver keyspaceResolver) {
        super(QueryType.INSERT, keyspaceResolver);
    }

    @Override
    protected String getTableSegment(String query) {
        // column list may follow the table name without a space
        return TextUtil.sliceIgnoreCase(query, "INSERT INTO ", ' ', '(');
    }
}
