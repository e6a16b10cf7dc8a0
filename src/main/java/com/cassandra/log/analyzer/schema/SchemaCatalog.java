package com.cassandra.log.analyzer.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Key structure of every table in a schema dump, keyed by keyspace then table.
 * Keyspace and table names are lower case.
 */
public class SchemaCatalog {

    private static final SchemaCatalog EMPTY = new SchemaCatalog(Collections.emptyMap());

    private final Map<String, Map<String, TableKeys>> keyspaces;

    SchemaCatalog(Map<String, Map<String, TableKeys>> keyspaces) {
        Map<String, Map<String, TableKeys>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, TableKeys>> entry : keyspaces.entrySet()) {
            copy.put(entry.getKey(), Collections.unmodifiableMap(new LinkedHashMap<>(entry.getValue())));
        }
        this.keyspaces = Collections.unmodifiableMap(copy);
    }

    public static SchemaCatalog empty() {
        return EMPTY;
    }

    public TableKeys getTable(String keyspace, String table) {
        if (keyspace == null || table == null) {
            return null;
        }
        Map<String, TableKeys> tables = keyspaces.get(keyspace);
        return tables == null ? null : tables.get(table);
    }

    public Set<String> getKeyspaces() {
        return keyspaces.keySet();
    }

    public Map<String, TableKeys> getTables(String keyspace) {
        Map<String, TableKeys> tables = keyspaces.get(keyspace);
        return tables == null ? Collections.emptyMap() : tables;
    }

    public int getTableCount() {
        return keyspaces.values().stream().mapToInt(Map::size).sum();
    }

    public boolean isEmpty() {
        return keyspaces.isEmpty();
    }
}
