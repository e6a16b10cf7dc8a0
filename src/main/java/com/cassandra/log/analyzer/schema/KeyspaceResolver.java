package com.cassandra.log.analyzer.schema;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.cassandra.log.analyzer.TextUtil;

/**
 * Works out keyspace and table from the table segment of a query, which is either
 * {@code keyspace.table} or a bare {@code table}.
 *
 * Bare tables are looked up in the {@link AmbiguityIndex}. When the table is unknown or
 * ambiguous and tag mappings are configured, the first log tag with a mapping decides.
 */
public class KeyspaceResolver {

    private final AmbiguityIndex index;
    private final Map<String, String> tagKeyspaces;

    public KeyspaceResolver(AmbiguityIndex index, Map<String, String> tagKeyspaces) {
        this.index = index;
        this.tagKeyspaces = tagKeyspaces == null ? Collections.emptyMap() : tagKeyspaces;
    }

    public TableRef resolve(String tableSegment, List<String> tags) {
        int dot = tableSegment.indexOf('.');
        if (dot != -1) {
            return new TableRef(normalize(tableSegment.substring(0, dot)), normalize(tableSegment.substring(dot + 1)));
        }
        String table = normalize(tableSegment);
        return new TableRef(guessKeyspace(table, tags), table);
    }

    private String guessKeyspace(String table, List<String> tags) {
        if (!tagKeyspaces.isEmpty() && (!index.contains(table) || index.isAmbiguous(table)) && tags != null) {
            for (String tag : tags) {
                String keyspace = tagKeyspaces.get(tag);
                if (keyspace != null) {
                    return keyspace.toLowerCase(Locale.ROOT);
                }
            }
        }
        return index.getKeyspace(table);
    }

    private static String normalize(String identifier) {
        return TextUtil.strip(identifier.trim(), '"').toLowerCase(Locale.ROOT);
    }
}
