package com.cassandra.log.analyzer.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Partition and clustering key columns of one table, in declared order.
 */
public class TableKeys {

    private final List<String> partitionKey;
    private final List<String> clusteringKey;

    public TableKeys(List<String> partitionKey, List<String> clusteringKey) {
        if (partitionKey == null || partitionKey.isEmpty()) {
            throw new IllegalArgumentException("Partition key must not be empty");
        }
        List<String> clustering = clusteringKey == null ? Collections.emptyList() : clusteringKey;
        for (String column : clustering) {
            if (partitionKey.contains(column)) {
                throw new IllegalArgumentException("Column " + column + " is in both partition and clustering key");
            }
        }
        this.partitionKey = Collections.unmodifiableList(new ArrayList<>(partitionKey));
        this.clusteringKey = Collections.unmodifiableList(new ArrayList<>(clustering));
    }

    public List<String> getPartitionKey() {
        return partitionKey;
    }

    public List<String> getClusteringKey() {
        return clusteringKey;
    }

    @Override
    public int hashCode() {
        return Objects.hash(partitionKey, clusteringKey);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TableKeys other = (TableKeys) o;
        return partitionKey.equals(other.partitionKey) && clusteringKey.equals(other.clusteringKey);
    }

    @Override
    public String toString() {
        return "PRIMARY KEY (" + partitionKey + ", " + clusteringKey + ")";
    }
}
