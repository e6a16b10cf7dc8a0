package com.cassandra.log.analyzer.config;

import com.cassandra.log.analyzer.accumulator.RollupEntry;

/**
 * Field the top N reports are ranked by.
 */
public enum OrderBy {
    DURATION("duration"),
    AVG_DURATION("avg_duration"),
    COUNT("count");

    OrderBy(final String pValue) {
        this.value = pValue;
    }

    private final String value;

    public String getValue() {
        return value;
    }

    public long extract(RollupEntry entry) {
        switch (this) {
        case AVG_DURATION:
            return entry.getAvgDuration();
        case COUNT:
            return entry.getCount();
        default:
            return entry.getDuration();
        }
    }

    public static OrderBy fromValue(final String pValue) {
        if (pValue == null) {
            throw new IllegalArgumentException("order_by must not be null");
        }
        final String lowerValue = pValue.trim().toLowerCase();
        for (OrderBy orderBy : values()) {
            if (orderBy.value.equals(lowerValue)) {
                return orderBy;
            }
        }
        throw new IllegalArgumentException("Unknown order_by value: " + pValue
                + " (expected one of duration, avg_duration, count)");
    }

    @Override
    public String toString() {
        return value;
    }
}
