package com.cassandra.log.analyzer.classifier;

/**
 * No extractor recognised the statement type of a slow query.
 */
public class UnhandledQueryException extends Exception {

    private static final long serialVersionUID = 1L;

    public UnhandledQueryException(String query) {
        super("No processor available for query: " + query);
    }
}
