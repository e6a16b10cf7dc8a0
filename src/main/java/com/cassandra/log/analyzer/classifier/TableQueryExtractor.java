package com.cassandra.log.analyzer.classifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cassandra.log.analyzer.QueryEvent;
import com.cassandra.log.analyzer.QueryType;
import com.cassandra.log.analyzer.SlowQueryLog;
import com.cassandra.log.analyzer.config.AnalyzerConfig;
import com.cassandra.log.analyzer.config.QueryPattern;
import com.cassandra.log.analyzer.schema.KeyspaceResolver;
import com.cassandra.log.analyzer.schema.SchemaCatalog;
import com.cassandra.log.analyzer.schema.TableKeys;
import com.cassandra.log.analyzer.schema.TableRef;

/**
 * Extractor for statements addressing a single table, where keyspace, table and the
 * partition key can be recovered.
 */
public abstract class TableQueryExtractor extends AbstractQueryExtractor {

    private static final Logger logger = LoggerFactory.getLogger(TableQueryExtractor.class);

    private final KeyspaceResolver keyspaceResolver;

    protected TableQueryExtractor(QueryType type, KeyspaceResolver keyspaceResolver) {
        super(type);
        this.keyspaceResolver = keyspaceResolver;
    }

    /**
     * Table segment of the query, {@code keyspace.table} or {@code table}, or null.
     */
    protected abstract String getTableSegment(String query);

    @Override
    public QueryEvent process(SlowQueryLog log, AnalyzerConfig config) {
        String query = log.getQuery();
        Map<String, String> boundValues = Collections.emptyMap();

        if (log.hasBoundValues()) {
            boundValues = BoundValuesDecoder.decode(log.getBoundValues());
        } else {
            for (QueryPattern pattern : config.getQueryPatterns()) {
                if (PatternMatcher.matches(query, pattern)) {
                    PatternMatcher.Result result = PatternMatcher.process(query, pattern);
                    query = result.getQuery();
                    boundValues = result.getBoundValues();
                    break;
                }
            }
        }

        TableRef tableRef = null;
        String segment = getTableSegment(query);
        if (segment != null && !segment.isEmpty()) {
            tableRef = keyspaceResolver.resolve(segment, log.getTags());
            if (!tableRef.isKeyspaceResolved()) {
                logger.debug("Unable to get keyspace for table {}. Tags: {}", tableRef.getTable(),
                        String.join(", ", log.getTags()));
            }
        } else {
            logger.debug("Unable to parse table segment out of {}", query);
        }

        String primaryKey = null;
        if (!boundValues.isEmpty() && tableRef != null && tableRef.isKeyspaceResolved()) {
            primaryKey = getPrimaryKey(boundValues, tableRef, config.getSchemaCatalog());
        }

        return eventBuilder(log)
                .query(query)
                .boundValues(boundValues)
                .keyspace(tableRef == null ? null : tableRef.getKeyspace())
                .table(tableRef == null ? null : tableRef.getTable())
                .primaryKey(primaryKey)
                .build();
    }

    /**
     * Partition key values in declared order joined with '-'. Null when the table is not
     * in the schema or any partition key column is missing a value.
     */
    static String getPrimaryKey(Map<String, String> boundValues, TableRef tableRef, SchemaCatalog catalog) {
        TableKeys keys = catalog.getTable(tableRef.getKeyspace(), tableRef.getTable());
        if (keys == null) {
            logger.debug("No schema for {}", tableRef);
            return null;
        }
        List<String> values = new ArrayList<>(keys.getPartitionKey().size());
        for (String column : keys.getPartitionKey()) {
            String value = boundValues.get(column);
            if (value == null) {
                logger.debug("Primary key field {} not in bound values for {}", column, tableRef);
                return null;
            }
            values.add(value);
        }
        return String.join("-", values);
    }
}
