package com.cassandra.log.analyzer.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import com.cassandra.log.analyzer.schema.AmbiguityIndex;
import com.cassandra.log.analyzer.schema.SchemaCatalog;

/**
 * Slow query analysis configuration. Built once per run and read-only afterwards, so it
 * is shared between the file processing threads without locking.
 */
public class AnalyzerConfig {

    public static final int DEFAULT_TOP_N = 100;
    public static final int DEFAULT_ROWS_PER_MINUTE = 5;
    public static final int DEFAULT_MIN_COUNT = 5;
    public static final OrderBy DEFAULT_ORDER_BY = OrderBy.DURATION;

    private final int topN;
    private final int rowsPerMinute;
    private final int minCount;
    private final OrderBy orderBy;
    private final SchemaCatalog schemaCatalog;
    private final AmbiguityIndex ambiguityIndex;
    private final List<QueryPattern> queryPatterns;
    private final Map<String, String> tagKeyspaces;

    private AnalyzerConfig(Builder builder) {
        this.topN = builder.topN;
        this.rowsPerMinute = builder.rowsPerMinute;
        this.minCount = builder.minCount;
        this.orderBy = builder.orderBy;
        this.schemaCatalog = builder.schemaCatalog;
        this.ambiguityIndex = AmbiguityIndex.build(schemaCatalog);
        this.queryPatterns = Collections.unmodifiableList(new ArrayList<>(builder.queryPatterns));
        this.tagKeyspaces = Collections.unmodifiableMap(new LinkedHashMap<>(builder.tagKeyspaces));
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getTopN() {
        return topN;
    }

    public int getRowsPerMinute() {
        return rowsPerMinute;
    }

    public int getMinCount() {
        return minCount;
    }

    public OrderBy getOrderBy() {
        return orderBy;
    }

    public SchemaCatalog getSchemaCatalog() {
        return schemaCatalog;
    }

    /**
     * Table to keyspace reverse index, derived from the schema catalog when the
     * configuration was built.
     */
    public AmbiguityIndex getAmbiguityIndex() {
        return ambiguityIndex;
    }

    public List<QueryPattern> getQueryPatterns() {
        return queryPatterns;
    }

    public Map<String, String> getTagKeyspaces() {
        return tagKeyspaces;
    }

    @Override
    public String toString() {
        return String.format("topN=%d, rowsPerMinute=%d, minCount=%d, orderBy=%s, tables=%d, queryPatterns=%d, tags=%d",
                topN, rowsPerMinute, minCount, orderBy, schemaCatalog.getTableCount(), queryPatterns.size(),
                tagKeyspaces.size());
    }

    public static class Builder {

        private int topN = DEFAULT_TOP_N;
        private int rowsPerMinute = DEFAULT_ROWS_PER_MINUTE;
        private int minCount = DEFAULT_MIN_COUNT;
        private OrderBy orderBy = DEFAULT_ORDER_BY;
        private SchemaCatalog schemaCatalog = SchemaCatalog.empty();
        private List<QueryPattern> queryPatterns = new ArrayList<>();
        private Map<String, String> tagKeyspaces = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder topN(int topN) {
            this.topN = topN;
            return this;
        }

        public Builder rowsPerMinute(int rowsPerMinute) {
            this.rowsPerMinute = rowsPerMinute;
            return this;
        }

        public Builder minCount(int minCount) {
            this.minCount = minCount;
            return this;
        }

        public Builder orderBy(OrderBy orderBy) {
            this.orderBy = orderBy;
            return this;
        }

        public Builder orderBy(String orderBy) {
            this.orderBy = OrderBy.fromValue(orderBy);
            return this;
        }

        public Builder schemaCatalog(SchemaCatalog schemaCatalog) {
            this.schemaCatalog = schemaCatalog;
            return this;
        }

        public Builder queryPatterns(List<QueryPattern> queryPatterns) {
            this.queryPatterns = new ArrayList<>(queryPatterns);
            return this;
        }

        public Builder tagKeyspaces(Map<String, String> tagKeyspaces) {
            this.tagKeyspaces = new LinkedHashMap<>(tagKeyspaces);
            return this;
        }

        /**
         * Load report settings from a properties file. Supports:
         * - report.topN
         * - report.rowsPerMinute
         * - report.minCount
         * - report.orderBy: duration, avg_duration or count
         */
        public Builder loadFromProperties(Properties props) {
            String value = props.getProperty("report.topN");
            if (value != null && !value.trim().isEmpty()) {
                topN = parseInt("report.topN", value);
            }
            value = props.getProperty("report.rowsPerMinute");
            if (value != null && !value.trim().isEmpty()) {
                rowsPerMinute = parseInt("report.rowsPerMinute", value);
            }
            value = props.getProperty("report.minCount");
            if (value != null && !value.trim().isEmpty()) {
                minCount = parseInt("report.minCount", value);
            }
            value = props.getProperty("report.orderBy");
            if (value != null && !value.trim().isEmpty()) {
                orderBy = OrderBy.fromValue(value);
            }
            return this;
        }

        private static int parseInt(String key, String value) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
            }
        }

        public AnalyzerConfig build() {
            if (topN < 1) {
                throw new IllegalArgumentException("top_n must be positive: " + topN);
            }
            if (rowsPerMinute < 1) {
                throw new IllegalArgumentException("rows_per_minute must be positive: " + rowsPerMinute);
            }
            if (minCount < 0) {
                throw new IllegalArgumentException("min_count must not be negative: " + minCount);
            }
            if (orderBy == null) {
                throw new IllegalArgumentException("order_by must be set");
            }
            if (schemaCatalog == null) {
                schemaCatalog = SchemaCatalog.empty();
            }
            return new AnalyzerConfig(this);
        }
    }
}
