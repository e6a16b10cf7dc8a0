package com.cassandra.log.analyzer.schema;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cassandra.log.analyzer.TextUtil;

/**
 * Line scanner over a CQL schema dump (cqlsh {@code DESCRIBE SCHEMA} output).
 *
 * Recognises table declarations and the three primary key forms:
 * <pre>
 *     PRIMARY KEY ((a, b), c, d)   partition [a, b], clustering [c, d]
 *     PRIMARY KEY (a, b, c, d)     partition [a], clustering [b, c, d]
 *     a uuid PRIMARY KEY,          partition [a]
 * </pre>
 * Identifiers are unquoted and lower cased.
 */
public class SchemaParser {

    private static final Logger logger = LoggerFactory.getLogger(SchemaParser.class);

    private static final String[] TABLE_MARKERS = { "CREATE TABLE ", "CREATE MATERIALIZED VIEW " };
    private static final String IF_NOT_EXISTS = "IF NOT EXISTS ";
    private static final String PRIMARY_KEY = "PRIMARY KEY";

    private SchemaParser() {
    }

    public static SchemaCatalog parse(String schema) throws SchemaParseException {
        Map<String, Map<String, TableKeys>> keyspaces = new LinkedHashMap<>();
        String keyspace = null;
        String table = null;
        int lineNumber = 0;

        for (String line : schema.split("\\R")) {
            lineNumber++;
            int scanFrom = 0;

            int[] marker = findTableMarker(line);
            if (marker != null) {
                if (keyspace != null) {
                    logger.warn("No primary key found for {}.{}, table skipped", keyspace, table);
                }
                String[] names = parseTableDeclaration(line, marker[0] + marker[1], lineNumber);
                keyspace = names[0];
                table = names[1];
                scanFrom = marker[0] + marker[1];
            }

            int keyPos = findPrimaryKey(line, scanFrom);
            if (keyPos == -1) {
                continue;
            }
            if (keyspace == null) {
                throw new SchemaParseException("Primary key declared outside of a table: " + line.trim(), lineNumber);
            }

            TableKeys keys = parseKeys(line, keyPos, lineNumber);
            keyspaces.computeIfAbsent(keyspace, k -> new LinkedHashMap<>()).put(table, keys);
            logger.debug("Parsed table {}.{} {}", keyspace, table, keys);
            keyspace = null;
            table = null;
        }

        if (keyspace != null) {
            logger.warn("No primary key found for {}.{}, table skipped", keyspace, table);
        }
        return new SchemaCatalog(keyspaces);
    }

    private static int[] findTableMarker(String line) {
        for (String marker : TABLE_MARKERS) {
            int pos = TextUtil.indexOfIgnoreCase(line, marker, 0);
            if (pos != -1) {
                return new int[] { pos, marker.length() };
            }
        }
        return null;
    }

    /**
     * DESCRIBE prints the keyword in upper case. Occurrences inside a quoted string, such
     * as a table comment, are ignored.
     */
    static int findPrimaryKey(String line, int from) {
        boolean quoted = false;
        for (int i = from; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '\'') {
                quoted = !quoted;
            } else if (!quoted && line.startsWith(PRIMARY_KEY, i)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Keyspace is the text before the first '.', table the text after it up to a space or
     * an opening parenthesis.
     */
    private static String[] parseTableDeclaration(String line, int start, int lineNumber)
            throws SchemaParseException {
        String rest = line.substring(start).trim();
        if (TextUtil.startsWithIgnoreCase(rest, IF_NOT_EXISTS)) {
            rest = rest.substring(IF_NOT_EXISTS.length()).trim();
        }
        int dot = rest.indexOf('.');
        if (dot <= 0) {
            throw new SchemaParseException("Table declaration without keyspace: " + line.trim(), lineNumber);
        }
        String keyspace = normalize(rest.substring(0, dot));
        String afterDot = rest.substring(dot + 1);
        int end = TextUtil.indexOfAny(afterDot, 0, ' ', '(');
        String table = normalize(end == -1 ? afterDot : afterDot.substring(0, end));
        if (keyspace.isEmpty() || table.isEmpty()) {
            throw new SchemaParseException("Unable to read table name: " + line.trim(), lineNumber);
        }
        return new String[] { keyspace, table };
    }

    private static TableKeys parseKeys(String line, int keyPos, int lineNumber) throws SchemaParseException {
        int pos = keyPos + PRIMARY_KEY.length();
        while (pos < line.length() && Character.isWhitespace(line.charAt(pos))) {
            pos++;
        }
        try {
            if (pos < line.length() && line.charAt(pos) == '(') {
                return parseKeyList(line, pos, lineNumber);
            }
            return new TableKeys(List.of(parseInlineKey(line, keyPos, lineNumber)), List.of());
        } catch (IllegalArgumentException e) {
            throw new SchemaParseException(e.getMessage() + ": " + line.trim(), lineNumber);
        }
    }

    private static TableKeys parseKeyList(String line, int open, int lineNumber) throws SchemaParseException {
        int close = TextUtil.findClosingParen(line, open);
        if (close == -1) {
            throw new SchemaParseException("Unterminated primary key: " + line.trim(), lineNumber);
        }
        String inner = line.substring(open + 1, close).trim();

        if (inner.startsWith("(")) {
            // ((a, b), c, d)
            int partitionClose = TextUtil.findClosingParen(inner, 0);
            if (partitionClose == -1) {
                throw new SchemaParseException("Unterminated partition key: " + line.trim(), lineNumber);
            }
            List<String> partition = splitColumns(inner.substring(1, partitionClose));
            List<String> clustering = splitColumns(inner.substring(partitionClose + 1));
            return new TableKeys(partition, clustering);
        }

        // (a, b, c, d)
        List<String> columns = splitColumns(inner);
        if (columns.isEmpty()) {
            throw new SchemaParseException("Empty primary key: " + line.trim(), lineNumber);
        }
        return new TableKeys(columns.subList(0, 1), columns.subList(1, columns.size()));
    }

    private static String parseInlineKey(String line, int keyPos, int lineNumber) throws SchemaParseException {
        String definition = line.substring(0, keyPos);
        String[] tokens = definition.substring(columnStart(definition)).trim().split("\\s+");
        String column = normalize(tokens[0]);
        if (column.isEmpty()) {
            throw new SchemaParseException("Unable to read primary key column: " + line.trim(), lineNumber);
        }
        return column;
    }

    /** Start of the last column definition, skipping commas inside a {@code <...>} type. */
    private static int columnStart(String definition) {
        int depth = 0;
        for (int i = definition.length() - 1; i >= 0; i--) {
            char c = definition.charAt(i);
            if (c == '>') {
                depth++;
            } else if (c == '<') {
                depth--;
            } else if (depth == 0 && (c == ',' || c == '(')) {
                return i + 1;
            }
        }
        return 0;
    }

    private static List<String> splitColumns(String text) {
        List<String> columns = new ArrayList<>();
        for (String column : text.split(",")) {
            String name = normalize(column);
            if (!name.isEmpty()) {
                columns.add(name);
            }
        }
        return columns;
    }

    private static String normalize(String identifier) {
        return TextUtil.strip(identifier.trim(), '"').toLowerCase(Locale.ROOT);
    }
}
