package com.cassandra.log.analyzer.schema;

import java.util.Objects;

/**
 * Keyspace and table a query targets. The keyspace may be null (unknown table) or
 * {@link AmbiguityIndex#AMBIGUOUS}.
 */
public class TableRef {

    private final String keyspace;
    private final String table;

    public TableRef(String keyspace, String table) {
        this.keyspace = keyspace;
        this.table = table;
    }

    public String getKeyspace() {
        return keyspace;
    }

    public String getTable() {
        return table;
    }

    public boolean isKeyspaceResolved() {
        return AmbiguityIndex.isResolved(keyspace);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keyspace, table);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TableRef other = (TableRef) o;
        return Objects.equals(keyspace, other.keyspace) && Objects.equals(table, other.table);
    }

    @Override
    public String toString() {
        return keyspace + "." + table;
    }
}
