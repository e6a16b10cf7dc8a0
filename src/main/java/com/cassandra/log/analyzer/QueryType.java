package com.cassandra.log.analyzer;

import java.util.regex.Pattern;

public enum QueryType {
    SELECT("SELECT"),
    INSERT("INSERT"),
    UPDATE("UPDATE"),
    DELETE("DELETE"),
    BATCH("BEGIN BATCH", "BEGIN\\s+(?:(?:UNLOGGED|COUNTER|LOGGED)\\s+)?BATCH\\b");

    QueryType(final String pPrefix) {
        this(pPrefix, Pattern.quote(pPrefix));
    }

    QueryType(final String pPrefix, final String pRegex) {
        this.prefix = pPrefix;
        this.pattern = Pattern.compile(pRegex, Pattern.CASE_INSENSITIVE);
    }

    private final String prefix;
    private final Pattern pattern;

    /**
     * Statement keyword(s) a query of this type starts with.
     */
    public String getPrefix() {
        return prefix;
    }

    /** Batches may carry an UNLOGGED, COUNTER or LOGGED modifier between BEGIN and BATCH. */
    public boolean matches(String query) {
        return query != null && pattern.matcher(query).lookingAt();
    }
}
