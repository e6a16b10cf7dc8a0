package com.cassandra.log.analyzer.classifier;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import com.cassandra.log.analyzer.TextUtil;
import com.cassandra.log.analyzer.config.QueryPattern;

/**
 * Pulls literal parameter values out of queries that were not prepared, so they get the
 * same {@code ?} placeholder and bound value shape as prepared statements and aggregate
 * together by query text.
 */
public class PatternMatcher {

    static final String PLACEHOLDER = "?";

    private PatternMatcher() {
    }

    public static boolean matches(String query, QueryPattern pattern) {
        return query != null && query.startsWith(pattern.getStart());
    }

    /**
     * For each parameter, the value is the token after the first {@code name ... =} up to
     * the next space, comma or semicolon. Parameters without a value, or whose value runs
     * to the end of the query, are skipped.
     */
    public static Result process(String query, QueryPattern pattern) {
        String processed = query;
        Map<String, String> boundValues = new LinkedHashMap<>();

        for (String name : pattern.getParameters()) {
            int namePos = processed.indexOf(name);
            if (namePos == -1) {
                continue;
            }
            int equals = processed.indexOf('=', namePos + name.length());
            if (equals == -1) {
                continue;
            }
            int valueStart = equals + 1;
            while (valueStart < processed.length() && Character.isWhitespace(processed.charAt(valueStart))) {
                valueStart++;
            }
            int valueEnd = TextUtil.indexOfAny(processed, valueStart, ' ', ',', ';');
            if (valueEnd == -1 || valueEnd == valueStart) {
                continue;
            }
            String value = processed.substring(valueStart, valueEnd);
            processed = processed.replace(value, PLACEHOLDER);
            boundValues.put(name.toLowerCase(Locale.ROOT), TextUtil.strip(value, '\''));
        }
        return new Result(processed, boundValues);
    }

    public static class Result {

        private final String query;
        private final Map<String, String> boundValues;

        Result(String query, Map<String, String> boundValues) {
            this.query = query;
            this.boundValues = Collections.unmodifiableMap(boundValues);
        }

        /** Query with every extracted literal replaced by {@code ?}. */
        public String getQuery() {
            return query;
        }

        public Map<String, String> getBoundValues() {
            return boundValues;
        }
    }
}
