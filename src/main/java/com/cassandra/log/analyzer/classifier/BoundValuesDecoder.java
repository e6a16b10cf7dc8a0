package com.cassandra.log.analyzer.classifier;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cassandra.log.analyzer.TextUtil;

/**
 * Decodes the bound value section of a slow query log, e.g.
 * {@code [user_id:'u1', bucket:3]}, into lower case name to unquoted value.
 */
public class BoundValuesDecoder {

    private static final Logger logger = LoggerFactory.getLogger(BoundValuesDecoder.class);

    static final String IN_LIST = "in(";
    static final String TRUNCATED_OUTPUT = "truncated output";

    private BoundValuesDecoder() {
    }

    public static Map<String, String> decode(String boundValues) {
        if (boundValues == null || boundValues.isEmpty()) {
            return Collections.emptyMap();
        }
        String stripped = boundValues.replace("[", "").replace("]", "");
        // in(...) lists and truncated output split into tokens without a name, expected
        boolean tolerated = stripped.contains(IN_LIST) || stripped.contains(TRUNCATED_OUTPUT);

        Map<String, String> values = new LinkedHashMap<>();
        for (String token : stripped.split(",")) {
            int colon = token.indexOf(':');
            String name = colon == -1 ? "" : token.substring(0, colon).trim();
            if (name.isEmpty()) {
                if (!tolerated) {
                    logger.warn("Bad bound values {}", boundValues);
                }
                continue;
            }
            String value = TextUtil.strip(token.substring(colon + 1), '\'');
            values.put(name.toLowerCase(Locale.ROOT), value);
        }
        return values;
    }
}
