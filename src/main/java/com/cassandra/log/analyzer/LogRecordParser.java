package com.cassandra.log.analyzer;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a Cassandra slow query message into duration, query text and bound values.
 *
 * Both layouts written by Cassandra are understood:
 * <pre>
 * Query too slow, took 45 ms: [1 bound values] SELECT * FROM ks.users WHERE id=?; [id:'u1']
 * Query too slow, took 45 ms: SELECT * FROM ks.users WHERE id=?; [1 bound values] [id:'u1']
 * Query too slow, took 45 ms: SELECT * FROM ks.users WHERE id='u1';
 * </pre>
 */
public class LogRecordParser {

    public static final String SLOW_QUERY_MARKER = "Query too slow, took ";
    static final String DURATION_DELIMITER = " ms: ";

    private static final Pattern BOUND_VALUE_COUNT = Pattern.compile("\\[\\d+ bound values?\\]");

    private LogRecordParser() {
    }

    public static SlowQueryLog parse(RawEvent event) throws LogParseException {
        return parse(event.getMessage(), event.getTimestamp(), event.getTags());
    }

    public static SlowQueryLog parse(String message) throws LogParseException {
        return parse(message, null, Collections.emptyList());
    }

    public static SlowQueryLog parse(String message, Instant timestamp, List<String> tags) throws LogParseException {
        if (message == null) {
            throw new LogParseException("Missing log message");
        }
        int markerPos = message.indexOf(SLOW_QUERY_MARKER);
        if (markerPos == -1) {
            throw new LogParseException("Not a slow query log");
        }
        int durationStart = markerPos + SLOW_QUERY_MARKER.length();
        int durationEnd = message.indexOf(DURATION_DELIMITER, durationStart);
        if (durationEnd == -1) {
            throw new LogParseException("Unable to find query time");
        }
        long duration = parseDuration(message.substring(durationStart, durationEnd));

        int ptr = durationEnd + DURATION_DELIMITER.length();
        String counts = null;
        String boundValues = null;
        String query;

        if (ptr < message.length() && message.charAt(ptr) == '[') {
            // [2 bound values] <query>; [<values>]
            int countEnd = message.indexOf(']', ptr);
            if (countEnd == -1) {
                throw new LogParseException("Unterminated bound value count");
            }
            counts = message.substring(ptr, countEnd + 1);
            int queryStart = Math.min(countEnd + 2, message.length());
            int split = message.indexOf("; [", queryStart);
            if (split == -1) {
                split = message.indexOf("] [", queryStart);
            }
            if (split != -1) {
                boundValues = message.substring(split + 2);
                query = message.substring(queryStart, split + 1);
            } else {
                query = message.substring(queryStart);
            }
        } else {
            // <query>; [2 bound values] [<values>]
            int split = message.indexOf("; [", ptr);
            Matcher countMatcher = split == -1 ? null
                    : BOUND_VALUE_COUNT.matcher(message).region(split + 2, message.length());
            if (countMatcher != null && countMatcher.lookingAt()) {
                counts = countMatcher.group();
                query = message.substring(ptr, split + 1);
                int valuesStart = message.indexOf('[', countMatcher.end());
                if (valuesStart != -1) {
                    boundValues = message.substring(valuesStart);
                }
            } else {
                query = message.substring(ptr);
            }
        }

        return new SlowQueryLog(timestamp, duration, counts, boundValues, query, tags);
    }

    private static long parseDuration(String text) throws LogParseException {
        try {
            long duration = Long.parseLong(text.trim());
            if (duration < 0) {
                throw new LogParseException("Negative query time: " + text);
            }
            return duration;
        } catch (NumberFormatException e) {
            throw new LogParseException("Invalid query time: " + text, e);
        }
    }
}
