package com.cassandra.log.analyzer.schema;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Table name to owning keyspace. A table name declared in more than one keyspace maps to
 * {@link #AMBIGUOUS} since the keyspace cannot be guessed from the name alone.
 */
public class AmbiguityIndex {

    /** Not a legal CQL identifier, so it never collides with a real keyspace. */
    public static final String AMBIGUOUS = "(ambiguous)";

    private final Map<String, String> tableKeyspaces;

    private AmbiguityIndex(Map<String, String> tableKeyspaces) {
        this.tableKeyspaces = Collections.unmodifiableMap(tableKeyspaces);
    }

    public static AmbiguityIndex build(SchemaCatalog catalog) {
        Map<String, String> tableKeyspaces = new HashMap<>();
        for (String keyspace : catalog.getKeyspaces()) {
            for (String table : catalog.getTables(keyspace).keySet()) {
                tableKeyspaces.merge(table, keyspace, (existing, added) -> AMBIGUOUS);
            }
        }
        return new AmbiguityIndex(tableKeyspaces);
    }

    /**
     * @return owning keyspace, {@link #AMBIGUOUS}, or null when the table is not in the schema
     */
    public String getKeyspace(String table) {
        return tableKeyspaces.get(table);
    }

    public boolean contains(String table) {
        return tableKeyspaces.containsKey(table);
    }

    public boolean isAmbiguous(String table) {
        return AMBIGUOUS.equals(tableKeyspaces.get(table));
    }

    public int size() {
        return tableKeyspaces.size();
    }

    public static boolean isResolved(String keyspace) {
        return keyspace != null && !AMBIGUOUS.equals(keyspace);
    }
}
