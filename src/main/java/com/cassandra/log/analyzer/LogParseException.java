package com.cassandra.log.analyzer;

/**
 * A log message is not a usable slow query line. Only the record is dropped.
 */
public class LogParseException extends Exception {

    private static final long serialVersionUID = 1L;

    public LogParseException(String message) {
        super(message);
    }

    public LogParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
