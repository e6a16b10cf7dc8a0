package com.cassandra.log.analyzer.report;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.cassandra.log.analyzer.accumulator.RollupEntry;
import com.cassandra.log.analyzer.accumulator.Rollups;
import com.cassandra.log.analyzer.config.AnalyzerConfig;
import com.cassandra.log.analyzer.config.OrderBy;

/**
 * Sorts and limits the rollups into report rows. Sorting is stable, so entries with equal
 * ranking values stay in first-seen order.
 */
public class RankingReporter {

    private final int topN;
    private final int rowsPerMinute;
    private final OrderBy orderBy;

    public RankingReporter(AnalyzerConfig config) {
        this(config.getTopN(), config.getRowsPerMinute(), config.getOrderBy());
    }

    public RankingReporter(int topN, int rowsPerMinute, OrderBy orderBy) {
        this.topN = topN;
        this.rowsPerMinute = rowsPerMinute;
        this.orderBy = orderBy;
    }

    public SlowQueryReport rank(Rollups rollups) {
        List<RollupEntry> volumeTopN = new ArrayList<>();
        for (Map<String, RollupEntry> minuteEntries : rollups.getByMinuteQueryPrimaryKey().values()) {
            volumeTopN.addAll(top(minuteEntries.values(), rowsPerMinute));
        }

        return new SlowQueryReport(
                top(rollups.getByQuery().values(), topN),
                top(rollups.getByQueryPrimaryKey().values(), topN),
                top(rollups.getByPrimaryKey().values(), topN),
                new ArrayList<>(rollups.getByMinute().values()),
                volumeTopN);
    }

    private List<RollupEntry> top(Collection<RollupEntry> entries, int limit) {
        Comparator<RollupEntry> descending = Comparator.<RollupEntry>comparingLong(orderBy::extract).reversed();
        return entries.stream()
                .sorted(descending)
                .limit(limit)
                .collect(Collectors.toList());
    }
}
