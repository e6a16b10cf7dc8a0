package com.cassandra.log.analyzer.report;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import com.cassandra.log.analyzer.ProcessingStats;
import com.cassandra.log.analyzer.accumulator.RollupEntry;
import com.cassandra.log.analyzer.config.AnalyzerConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Generates one structured JSON document holding all slow query reports.
 */
public class JsonReportGenerator {

    private static final ObjectMapper mapper = new ObjectMapper();

    private JsonReportGenerator() {
    }

    public static void generateReport(Path file, SlowQueryReport report, AnalyzerConfig config,
            ProcessingStats stats) throws IOException {
        ObjectNode root = buildReport(report, config, stats);
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            mapper.writerWithDefaultPrettyPrinter().writeValue(writer, root);
        }
    }

    static ObjectNode buildReport(SlowQueryReport report, AnalyzerConfig config, ProcessingStats stats) {
        ObjectNode root = mapper.createObjectNode();

        ObjectNode metadata = mapper.createObjectNode();
        metadata.put("generatedAt", Instant.now().toString());
        metadata.put("earliestTimestamp", toText(stats.earliestTimestamp));
        metadata.put("latestTimestamp", toText(stats.latestTimestamp));

        ObjectNode settings = mapper.createObjectNode();
        settings.put("topN", config.getTopN());
        settings.put("rowsPerMinute", config.getRowsPerMinute());
        settings.put("minCount", config.getMinCount());
        settings.put("orderBy", config.getOrderBy().toString());
        settings.put("tables", config.getSchemaCatalog().getTableCount());
        settings.put("queryPatterns", config.getQueryPatterns().size());
        settings.put("tagMappings", config.getTagKeyspaces().size());
        metadata.set("configuration", settings);

        ObjectNode processing = mapper.createObjectNode();
        processing.put("hitsRead", stats.hitsRead);
        processing.put("invalidHits", stats.invalidHits);
        processing.put("notSlowQuery", stats.notSlowQuery);
        processing.put("unhandled", stats.unhandled);
        processing.put("eventsProduced", stats.eventsProduced);
        ObjectNode byType = mapper.createObjectNode();
        stats.eventsByType.forEach((type, count) -> byType.put(type.name(), count));
        processing.set("eventsByType", byType);
        metadata.set("processing", processing);

        root.set("metadata", metadata);

        root.set("slowQueries", toArray(report.getSlowQueries()));
        root.set("slowPrimaryKeys", toArray(report.getSlowPrimaryKeys()));
        root.set("primaryKeys", toArray(report.getPrimaryKeys()));
        root.set("volume", toArray(report.getVolume()));
        root.set("volumeTopN", toArray(report.getVolumeTopN()));
        return root;
    }

    private static ArrayNode toArray(List<RollupEntry> entries) {
        ArrayNode rows = mapper.createArrayNode();
        for (RollupEntry entry : entries) {
            ObjectNode row = mapper.createObjectNode();
            if (entry.getMinute() != null) {
                row.put("time", entry.getMinute());
            }
            row.put("count", entry.getCount());
            row.put("durationMs", entry.getDuration());
            row.put("avgDurationMs", entry.getAvgDuration());
            if (entry.getKeyspace() != null) {
                row.put("keyspace", entry.getKeyspace());
            }
            if (entry.getTable() != null) {
                row.put("table", entry.getTable());
            }
            if (entry.getPrimaryKey() != null) {
                row.put("primaryKey", entry.getPrimaryKey());
            }
            if (entry.getQuery() != null) {
                row.put("query", entry.getQuery());
            }
            rows.add(row);
        }
        return rows;
    }

    private static String toText(Instant instant) {
        return instant == null ? null : instant.toString();
    }
}
