package com.cassandra.log.analyzer.report;

import java.util.Collections;
import java.util.List;

import com.cassandra.log.analyzer.accumulator.RollupEntry;

/**
 * The five ranked report tables, ready to be written out.
 */
public class SlowQueryReport {

    private final List<RollupEntry> slowQueries;
    private final List<RollupEntry> slowPrimaryKeys;
    private final List<RollupEntry> primaryKeys;
    private final List<RollupEntry> volume;
    private final List<RollupEntry> volumeTopN;

    public SlowQueryReport(List<RollupEntry> slowQueries, List<RollupEntry> slowPrimaryKeys,
            List<RollupEntry> primaryKeys, List<RollupEntry> volume, List<RollupEntry> volumeTopN) {
        this.slowQueries = Collections.unmodifiableList(slowQueries);
        this.slowPrimaryKeys = Collections.unmodifiableList(slowPrimaryKeys);
        this.primaryKeys = Collections.unmodifiableList(primaryKeys);
        this.volume = Collections.unmodifiableList(volume);
        this.volumeTopN = Collections.unmodifiableList(volumeTopN);
    }

    /** Top queries regardless of primary key. */
    public List<RollupEntry> getSlowQueries() {
        return slowQueries;
    }

    /** Top query and primary key pairs. */
    public List<RollupEntry> getSlowPrimaryKeys() {
        return slowPrimaryKeys;
    }

    /** Top keyspace, table and primary key rows. */
    public List<RollupEntry> getPrimaryKeys() {
        return primaryKeys;
    }

    /** Per minute totals, oldest first. */
    public List<RollupEntry> getVolume() {
        return volume;
    }

    /** Top query and primary key pairs of each minute, oldest minute first. */
    public List<RollupEntry> getVolumeTopN() {
        return volumeTopN;
    }
}
