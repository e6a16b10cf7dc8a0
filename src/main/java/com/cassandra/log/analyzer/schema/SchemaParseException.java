package com.cassandra.log.analyzer.schema;

/**
 * Schema dump could not be understood. Aborts the run.
 */
public class SchemaParseException extends Exception {

    private static final long serialVersionUID = 1L;

    private final int lineNumber;

    public SchemaParseException(String message, int lineNumber) {
        super(String.format("%s (schema line %d)", message, lineNumber));
        this.lineNumber = lineNumber;
    }

    public int getLineNumber() {
        return lineNumber;
    }
}
